package infra.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.analysis.AnalysisResult;
import domain.formula.IdentifierCodec;
import domain.model.AnalysisWarningSink;
import domain.model.MetadataColumn;
import domain.model.ResultTable;
import domain.model.SampleMetadata;
import domain.model.SampleMetadataFixtures;
import domain.result.ColumnDisambiguator;
import domain.result.ResultSlice;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvBundleWriterTest {

    @TempDir
    Path tmp;

    private static ResultTable engineSlice(String a, String b) {
        Map<String, List<String>> columns = new LinkedHashMap<>();
        columns.put("(Intercept)", List.of(a, b));
        columns.put("body.siteleft palm", List.of(a, b));
        columns.put("body.siteright palm", List.of(a, "NA"));
        columns.put("body.sitetongue", List.of(a, b));
        columns.put("days.since.experiment.start", List.of(b, a));
        return new ResultTable("taxon", List.of("f1", "f,2"), columns);
    }

    private static AnalysisResult result() {
        SampleMetadata metadata = SampleMetadataFixtures.movingPictures();
        IdentifierCodec codec = new IdentifierCodec();
        for (MetadataColumn c : metadata.getColumns()) codec.encode(c.getName());
        ColumnDisambiguator d = new ColumnDisambiguator(metadata, codec.getLedger(),
                SampleMetadataFixtures.SAMPLES, AnalysisWarningSink.none());

        ResultTable lfc = engineSlice("0.5", "-1.25");
        Map<String, String> refs = d.deduceReferenceLevels(lfc);
        List<ResultSlice> slices = List.of(
                d.disambiguate("lfc", false, lfc, refs),
                d.disambiguate("diff", true, engineSlice("TRUE", "FALSE"), refs));
        return new AnalysisResult(slices, refs, null, null, codec.getLedger().asMap(), List.of());
    }

    @Test
    void write_shouldWriteOneCsvPerSliceWithOriginalNames() throws Exception {
        new CsvBundleWriter().write(tmp.resolve("bundle"), result());

        Path lfc = tmp.resolve("bundle/lfc_slice.csv");
        assertTrue(Files.exists(lfc));
        assertTrue(Files.exists(tmp.resolve("bundle/diff_slice.csv")));

        List<String> lines = Files.readAllLines(lfc, StandardCharsets.UTF_8);
        assertEquals("taxon,(Intercept),body-site::left palm,body-site::right palm,body-site::tongue,"
                + "days-since-experiment-start", lines.get(0));
        assertEquals("f1,0.5,0.5,0.5,0.5,-1.25", lines.get(1));
        assertEquals("\"f,2\",-1.25,-1.25,NA,-1.25,0.5", lines.get(2));
    }

    @Test
    void write_shouldDescribeSlicesInDataPackage() throws Exception {
        new CsvBundleWriter().write(tmp, result());

        JsonNode root = new ObjectMapper().readTree(tmp.resolve(CsvBundleWriter.DESCRIPTOR).toFile());
        assertEquals("ancombc2-bundle", root.get("name").asText());
        assertEquals(2, root.get("resources").size());

        JsonNode lfc = root.get("resources").get(0);
        assertEquals("lfc_slice.csv", lfc.get("path").asText());
        JsonNode fields = lfc.get("schema").get("fields");
        assertEquals("taxon", fields.get(0).get("name").asText());
        assertEquals("string", fields.get(0).get("type").asText());

        JsonNode palm = fields.get(2);
        assertEquals("body-site::left palm", palm.get("name").asText());
        assertEquals("number", palm.get("type").asText());
        assertEquals("body-site", palm.get("ancombc:variable").asText());
        assertEquals("categorical", palm.get("ancombc:variableType").asText());
        assertEquals("left palm", palm.get("ancombc:level").asText());
        assertEquals("gut", palm.get("ancombc:reference").asText());

        JsonNode days = fields.get(5);
        assertEquals("numeric", days.get("ancombc:variableType").asText());
        assertFalse(days.has("ancombc:level"));

        JsonNode diffField = root.get("resources").get(1).get("schema").get("fields").get(1);
        assertEquals("boolean", diffField.get("type").asText());
        assertEquals("TRUE", diffField.get("trueValues").get(0).asText());
    }
}
