package domain.result;

import domain.formula.IdentifierCodec;
import domain.model.AnalysisWarning;
import domain.model.Ancombc2Exception;
import domain.model.ColumnType;
import domain.model.ErrorCategory;
import domain.model.ErrorCode;
import domain.model.ListAnalysisWarningSink;
import domain.model.MetadataColumn;
import domain.model.ResultTable;
import domain.model.SampleMetadata;
import domain.model.SampleMetadataFixtures;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ColumnDisambiguatorTest {

    private final SampleMetadata metadata = SampleMetadataFixtures.movingPictures();
    private final List<AnalysisWarning> warnings = new ArrayList<>();

    private ColumnDisambiguator disambiguator() {
        IdentifierCodec codec = new IdentifierCodec();
        for (MetadataColumn c : metadata.getColumns()) codec.encode(c.getName());
        return new ColumnDisambiguator(metadata, codec.getLedger(), SampleMetadataFixtures.SAMPLES,
                new ListAnalysisWarningSink(warnings));
    }

    private static ResultTable slice(String... columns) {
        Map<String, List<String>> m = new LinkedHashMap<>();
        for (String c : columns) m.put(c, List.of("0.5", "-1.25"));
        return new ResultTable("taxon", List.of("f1", "f2"), m);
    }

    @Test
    void parse_shouldSplitCategoricalColumnIntoVariableAndLevel() {
        CovariateColumnRef ref = disambiguator().parse("body.siteleft palm");

        assertTrue(ref.isCategorical());
        assertEquals("body-site", ref.getVariable());
        assertEquals("left palm", ref.getLevel());
        assertEquals("body-site::left palm", ref.getOutputName());
        assertEquals("body.siteleft palm", ref.getEngineName());
    }

    @Test
    void parse_shouldAttributeNumericColumn_evenWhenCategoricalNameIsItsPrefix() {
        CovariateColumnRef ref = disambiguator().parse("body.site.count");

        assertFalse(ref.isCategorical());
        assertEquals(ColumnType.NUMERIC, ref.getType());
        assertEquals("body-site-count", ref.getVariable());
        assertEquals("body-site-count", ref.getOutputName());
        assertNull(ref.getLevel());
    }

    @Test
    void parse_shouldStripOneSeparator_soBothFormsAgree() {
        ColumnDisambiguator d = disambiguator();
        CovariateColumnRef bare = d.parse("body.sitegut");
        CovariateColumnRef separated = d.parse("body.site::gut");

        assertEquals(bare.getVariable(), separated.getVariable());
        assertEquals(bare.getLevel(), separated.getLevel());
        assertEquals("body-site::gut", separated.getOutputName());
    }

    @Test
    void parse_shouldKeepRemainingSeparatorInLevel_andWarn() {
        CovariateColumnRef ref = disambiguator().parse("body.site::a::b");

        assertEquals("a::b", ref.getLevel());
        assertEquals("body-site::a::b", ref.getOutputName());
        assertEquals(WarningCode.AMBIGUOUS_SEPARATOR, warnings.get(0).getCode());
    }

    @Test
    void parse_shouldLeaveOtherEngineTermsUnchanged() {
        CovariateColumnRef ref = disambiguator().parse("(Intercept)");

        assertFalse(ref.isCovariate());
        assertNull(ref.getVariable());
        assertEquals("(Intercept)", ref.getOutputName());
    }

    @Test
    void deduceReferenceLevels_shouldReturnTheOneLevelWithoutColumn() {
        ResultTable lfc = slice("(Intercept)", "body.sitegut", "body.siteright palm", "body.sitetongue",
                "days.since.experiment.start");

        Map<String, String> refs = disambiguator().deduceReferenceLevels(lfc);

        assertEquals(Map.of("body-site", "left palm"), refs);
    }

    @Test
    void deduceReferenceLevels_shouldFail_whenEveryLevelHasAColumn() {
        ResultTable lfc = slice("body.sitegut", "body.siteleft palm", "body.siteright palm", "body.sitetongue");

        Ancombc2Exception e = assertThrows(Ancombc2Exception.class, () -> disambiguator().deduceReferenceLevels(lfc));
        assertEquals(ErrorCode.REFERENCE_LEVEL_UNDETERMINED, e.getCode());
        assertEquals(ErrorCategory.INVARIANT_VIOLATION, e.getCategory());
        assertTrue(e.getMessage().contains("body-site"));
    }

    @Test
    void deduceReferenceLevels_shouldFail_whenSeveralLevelsLackAColumn() {
        ResultTable lfc = slice("body.sitegut", "body.sitetongue");

        Ancombc2Exception e = assertThrows(Ancombc2Exception.class, () -> disambiguator().deduceReferenceLevels(lfc));
        assertEquals(ErrorCode.REFERENCE_LEVEL_UNDETERMINED, e.getCode());
    }

    @Test
    void disambiguate_shouldRenameColumns_andAnnotateReferences() {
        ColumnDisambiguator d = disambiguator();
        ResultTable lfc = slice("(Intercept)", "body.sitegut", "body.siteright palm", "body.sitetongue",
                "body.site.count", "subjectsubject-2");

        Map<String, String> refs = d.deduceReferenceLevels(lfc);
        ResultSlice s = d.disambiguate("lfc", false, lfc, refs);

        assertEquals(List.of("(Intercept)", "body-site::gut", "body-site::right palm", "body-site::tongue",
                "body-site-count", "subject::subject-2"), s.getTable().getColumnNames());
        assertEquals(List.of("0.5", "-1.25"), s.getTable().getColumn("body-site::tongue"));
        assertEquals("left palm", s.getColumnRef("body-site::gut").getReference());
        assertEquals("subject-1", s.getColumnRef("subject::subject-2").getReference());
        assertNull(s.getColumnRef("body-site-count").getReference());
        assertEquals("lfc_slice.csv", s.getFileName());
    }

    @Test
    void disambiguate_shouldFail_whenTwoColumnsMapToTheSameName() {
        ResultTable t = slice("body.sitegut", "body.site::gut");

        Ancombc2Exception e = assertThrows(Ancombc2Exception.class,
                () -> disambiguator().disambiguate("lfc", false, t, Map.of()));
        assertEquals(ErrorCode.IDENTIFIER_COLLISION, e.getCode());
    }
}
