package infra.table;

import domain.model.Ancombc2Exception;
import domain.model.ColumnType;
import domain.model.ErrorCode;
import domain.model.SampleMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetadataTsvLoaderTest {

    @TempDir
    Path tmp;

    private Path write(String content) throws IOException {
        Path p = tmp.resolve("sample-metadata.tsv");
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void load_shouldUseDeclaredTypes() throws Exception {
        Path p = write(""
                + "sample-id\tbody-site\tyear\tdays-since-experiment-start\n"
                + "#q2:types\tcategorical\tcategorical\tnumeric\n"
                + "L1S8\tgut\t2008\t0\n"
                + "L1S57\tleft palm\t2009\t84\n");

        SampleMetadata m = new MetadataTsvLoader().load(p);

        assertEquals(List.of("L1S8", "L1S57"), m.getSampleIds());
        assertEquals(List.of("body-site", "year", "days-since-experiment-start"), m.getColumnNames());
        assertEquals(ColumnType.CATEGORICAL, m.getColumn("year").getType());
        assertEquals(ColumnType.NUMERIC, m.getColumn("days-since-experiment-start").getType());
        assertEquals("left palm", m.getColumn("body-site").getValue("L1S57"));
    }

    @Test
    void load_shouldInferTypes_whenDirectiveRowIsAbsent() throws Exception {
        Path p = write(""
                + "#SampleID\tsubject\treported-antibiotic-usage\tdays\n"
                + "# a comment row\n"
                + "S1\tsubject-1\tYes\t0\n"
                + "S2\tsubject-2\tNo\t\n"
                + "S3\tsubject-1\tYes\t84.5\n");

        SampleMetadata m = new MetadataTsvLoader().load(p);

        assertEquals(List.of("S1", "S2", "S3"), m.getSampleIds());
        assertEquals(ColumnType.CATEGORICAL, m.getColumn("subject").getType());
        assertEquals(ColumnType.NUMERIC, m.getColumn("days").getType());
    }

    @Test
    void load_shouldRejectUnknownDeclaredType() throws Exception {
        Path p = write(""
                + "id\tbody-site\n"
                + "#q2:types\tordinal\n"
                + "S1\tgut\n");

        Ancombc2Exception e = assertThrows(Ancombc2Exception.class, () -> new MetadataTsvLoader().load(p));

        assertEquals(ErrorCode.UNKNOWN_COLUMN_TYPE, e.getCode());
        assertTrue(e.getMessage().contains("ordinal"));
    }

    @Test
    void load_shouldRejectUnrecognizedIdHeader() throws Exception {
        Path p = write("name\tbody-site\nS1\tgut\n");

        assertThrows(IllegalStateException.class, () -> new MetadataTsvLoader().load(p));
    }

    @Test
    void inferType_shouldTreatAllBlankColumnAsCategorical() {
        assertEquals(ColumnType.CATEGORICAL, MetadataTsvLoader.inferType(List.of("", " ")));
        assertEquals(ColumnType.NUMERIC, MetadataTsvLoader.inferType(List.of("1", "", "-2.5e3")));
    }
}
