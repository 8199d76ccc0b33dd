package domain.covariate;

import domain.formula.IdentifierCodec;
import domain.model.AnalysisWarning;
import domain.model.Ancombc2Exception;
import domain.model.ColumnType;
import domain.model.ErrorCategory;
import domain.model.ErrorCode;
import domain.model.ListAnalysisWarningSink;
import domain.model.SampleMetadata;
import domain.model.SampleMetadataFixtures;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CovariateTableBuilderTest {

    private final SampleMetadata metadata = SampleMetadataFixtures.movingPictures();
    private final List<String> samples = SampleMetadataFixtures.SAMPLES;

    private static CovariateTableBuilder builder() {
        return new CovariateTableBuilder(new IdentifierCodec(), null);
    }

    @Test
    void build_shouldEncodeAndCoerceEveryColumn() {
        CovariateTable t = builder().build(metadata, samples, List.of("subject"), List.of());

        assertEquals(samples, t.getSampleIds());
        assertEquals(4, t.getColumns().size());

        CovariateColumn site = t.getColumn("body-site");
        assertEquals("body.site", site.getEngineName());
        assertEquals(ColumnType.CATEGORICAL, site.getType());
        assertEquals(List.of("gut", "left palm", "right palm", "tongue"), site.getLevels());

        CovariateColumn days = t.getColumnByEngineName("days.since.experiment.start");
        assertEquals(ColumnType.NUMERIC, days.getType());
        assertEquals(84.0, days.getNumber(1));
        assertEquals("84", days.cell(1));
    }

    @Test
    void build_shouldRelevelToRequestedReference() {
        CovariateTable t = builder().build(metadata, samples, List.of("body-site"), List.of("body-site::tongue"));

        CovariateColumn site = t.getColumn("body-site");
        assertEquals("tongue", site.getLevels().get(0));
        assertEquals(List.of("tongue", "gut", "left palm", "right palm"), site.getLevels());
        assertEquals("tongue", t.getReferenceLevels().get("body-site"));
        // labels are untouched
        assertEquals("gut", site.getLabel(0));
    }

    @Test
    void build_shouldDefaultToSmallestLevel_forFormulaVariablesWithoutDirective() {
        List<AnalysisWarning> warnings = new ArrayList<>();
        CovariateTableBuilder b = new CovariateTableBuilder(new IdentifierCodec(), new ListAnalysisWarningSink(warnings));

        CovariateTable t = b.build(metadata, samples, List.of("body-site", "subject", "days-since-experiment-start"),
                List.of("subject::subject-2"));

        assertEquals("subject-2", t.getReferenceLevels().get("subject"));
        assertEquals("gut", t.getReferenceLevels().get("body-site"));
        assertFalse(t.getReferenceLevels().containsKey("days-since-experiment-start"));
        assertEquals(List.of("subject::subject-2", "body-site::gut"), t.getReferenceLevelDirectives());

        assertEquals(1, warnings.size());
        assertEquals(WarningCode.DEFAULT_REFERENCE_LEVEL, warnings.get(0).getCode());
        assertEquals("body-site", warnings.get(0).getSubject());
    }

    @Test
    void build_shouldFail_onDuplicateDirective() {
        Ancombc2Exception e = assertThrows(Ancombc2Exception.class, () -> builder().build(metadata, samples,
                List.of("body-site"), List.of("body-site::tongue", "body-site::gut")));
        assertEquals(ErrorCode.DUPLICATE_REFERENCE_COLUMN, e.getCode());
        assertEquals(ErrorCategory.REFERENCE_LEVEL, e.getCategory());
        assertTrue(e.getMessage().contains("body-site"));
    }

    @Test
    void build_shouldFail_onNumericColumn() {
        Ancombc2Exception e = assertThrows(Ancombc2Exception.class, () -> builder().build(metadata, samples,
                List.of("days-since-experiment-start"), List.of("days-since-experiment-start::0")));
        assertEquals(ErrorCode.REFERENCE_COLUMN_NUMERIC, e.getCode());
        assertTrue(e.getMessage().contains("days-since-experiment-start"));
    }

    @Test
    void build_shouldFail_onUnknownColumn_withColonHint() {
        Ancombc2Exception e = assertThrows(Ancombc2Exception.class, () -> builder().build(metadata, samples,
                List.of("body-site"), List.of("body:site::tongue")));
        assertEquals(ErrorCode.REFERENCE_COLUMN_NOT_FOUND, e.getCode());
        assertTrue(e.getMessage().contains("body:site"));
        assertTrue(e.getMessage().contains("NOTE"));
    }

    @Test
    void build_shouldFail_onUnknownLevel() {
        Ancombc2Exception e = assertThrows(Ancombc2Exception.class, () -> builder().build(metadata, samples,
                List.of("body-site"), List.of("body-site::nose")));
        assertEquals(ErrorCode.REFERENCE_LEVEL_NOT_FOUND, e.getCode());
        assertTrue(e.getMessage().contains("nose"));
        assertFalse(e.getMessage().contains("NOTE"));
    }

    @Test
    void build_shouldFail_whenLevelOnlyExistsOutsideTheFeatureTable() {
        List<String> withoutTongue = List.of("S1", "S2", "S3", "S4", "S5", "S6");

        Ancombc2Exception e = assertThrows(Ancombc2Exception.class, () -> builder().build(metadata, withoutTongue,
                List.of("body-site"), List.of("body-site::tongue")));
        assertEquals(ErrorCode.REFERENCE_LEVEL_NOT_FOUND, e.getCode());
        assertTrue(e.getMessage().contains("feature table"));
    }

    @Test
    void build_shouldFail_whenColumnIsNotInFormula() {
        Ancombc2Exception e = assertThrows(Ancombc2Exception.class, () -> builder().build(metadata, samples,
                List.of("subject"), List.of("body-site::tongue")));
        assertEquals(ErrorCode.REFERENCE_COLUMN_NOT_IN_FORMULA, e.getCode());
    }

    @Test
    void build_shouldRestrictLevels_toFeatureTableSamples() {
        List<String> subset = List.of("S7", "S1", "S3");
        CovariateTable t = builder().build(metadata, subset, List.of("body-site"), List.of());

        CovariateColumn site = t.getColumn("body-site");
        assertEquals(List.of("gut", "left palm", "tongue"), site.getLevels());
        assertEquals("tongue", site.cell(0));
        assertEquals(subset, t.getSampleIds());
    }

    @Test
    void build_shouldWriteNA_forMissingValues() {
        SampleMetadata withGaps = new SampleMetadata(SampleMetadataFixtures.SAMPLES, List.of(
                SampleMetadataFixtures.column("site", ColumnType.CATEGORICAL, "a", "", "b", "b", "a", "a", "b", "b"),
                SampleMetadataFixtures.column("depth", ColumnType.NUMERIC, "1.5", "", "2", "2", "1", "1", "2", "2")
        ));

        CovariateTable t = builder().build(withGaps, samples, List.of("site"), List.of());
        assertEquals("NA", t.getColumn("site").cell(1));
        assertEquals("NA", t.getColumn("depth").cell(1));
        assertEquals("1.5", t.getColumn("depth").cell(0));
        assertEquals(List.of("a", "b"), t.getColumn("site").getLevels());
    }
}
