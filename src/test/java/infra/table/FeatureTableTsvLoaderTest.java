package infra.table;

import domain.model.FeatureTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureTableTsvLoaderTest {

    @TempDir
    Path tmp;

    private Path write(String content) throws IOException {
        Path p = tmp.resolve("feature-table.tsv");
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void load_shouldSkipBiomCommentAndReadOtuHeader() throws Exception {
        Path p = write(""
                + "# Constructed from biom file\n"
                + "#OTU ID\tL1S8\tL1S57\tL1S76\n"
                + "f1\t12\t0\t3\n"
                + "f2\t1.0\t\t7\n");

        FeatureTable t = new FeatureTableTsvLoader().load(p);

        assertEquals(List.of("L1S8", "L1S57", "L1S76"), t.getSampleIds());
        assertEquals(List.of("f1", "f2"), t.getFeatureIds());
        assertEquals(12.0, t.getCount(0, 0));
        assertEquals(0.0, t.getCount(1, 1));
        assertEquals(7.0, t.getCount(1, 2));
    }

    @Test
    void load_shouldRejectNonNumericCount() throws Exception {
        Path p = write("feature-id\tS1\tS2\nf1\t3\tmany\n");

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new FeatureTableTsvLoader().load(p));
        assertTrue(e.getMessage().contains("many"));
    }

    @Test
    void load_shouldRejectRaggedRow() throws Exception {
        Path p = write("feature-id\tS1\tS2\nf1\t3\n");

        assertThrows(IllegalStateException.class, () -> new FeatureTableTsvLoader().load(p));
    }
}
