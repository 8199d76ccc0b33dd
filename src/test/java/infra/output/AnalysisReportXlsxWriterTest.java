package infra.output;

import domain.analysis.AnalysisResult;
import domain.formula.IdentifierCodec;
import domain.model.AnalysisWarning;
import domain.model.AnalysisWarningSink;
import domain.model.MetadataColumn;
import domain.model.ResultTable;
import domain.model.SampleMetadata;
import domain.model.SampleMetadataFixtures;
import domain.model.WarningCode;
import domain.result.ColumnDisambiguator;
import org.apache.logging.log4j.LogManager;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisReportXlsxWriterTest {

    @TempDir
    Path tmp;

    private static ResultTable engineSlice(String a, String b) {
        Map<String, List<String>> columns = new LinkedHashMap<>();
        columns.put("body.siteleft palm", List.of(a, b));
        columns.put("body.siteright palm", List.of(a, b));
        columns.put("body.sitetongue", List.of(a, b));
        return new ResultTable("taxon", List.of("f1", "f2"), columns);
    }

    private static AnalysisResult result() {
        SampleMetadata metadata = SampleMetadataFixtures.movingPictures();
        IdentifierCodec codec = new IdentifierCodec();
        for (MetadataColumn c : metadata.getColumns()) codec.encode(c.getName());
        ColumnDisambiguator d = new ColumnDisambiguator(metadata, codec.getLedger(),
                SampleMetadataFixtures.SAMPLES, AnalysisWarningSink.none());

        ResultTable lfc = engineSlice("0.5", "NA");
        Map<String, String> refs = d.deduceReferenceLevels(lfc);
        return new AnalysisResult(
                List.of(d.disambiguate("lfc", false, lfc, refs),
                        d.disambiguate("diff", true, engineSlice("TRUE", "FALSE"), refs)),
                refs, null, null, codec.getLedger().asMap(),
                List.of(AnalysisWarning.of(WarningCode.DEFAULT_REFERENCE_LEVEL, "body-site", "smallest level used")));
    }

    @Test
    void write_shouldWriteTypedSliceSheetsAndSummarySheets() throws Exception {
        Path xlsx = tmp.resolve("report/result.xlsx");

        new XlsxResultWriter(new AnalysisReportXlsxWriter()).write(xlsx, result());

        try (Workbook wb = WorkbookFactory.create(xlsx.toFile())) {
            assertNotNull(wb.getSheet("reference_levels"));
            assertNotNull(wb.getSheet("renames"));

            Sheet lfc = wb.getSheet("lfc");
            assertEquals("body-site::left palm", lfc.getRow(0).getCell(1).getStringCellValue());
            assertEquals(0.5, lfc.getRow(1).getCell(1).getNumericCellValue());
            assertEquals("NA", lfc.getRow(2).getCell(1).getStringCellValue());

            Sheet diff = wb.getSheet("diff");
            assertEquals(CellType.BOOLEAN, diff.getRow(1).getCell(1).getCellType());
            assertTrue(diff.getRow(1).getCell(1).getBooleanCellValue());

            assertEquals("gut", wb.getSheet("reference_levels").getRow(1).getCell(1).getStringCellValue());
            assertEquals("DEFAULT_REFERENCE_LEVEL", wb.getSheet("warnings").getRow(1).getCell(0).getStringCellValue());
        }
    }

    @Test
    void poiLogging_shouldBeRoutedToSlf4j() {
        assertEquals("org.apache.logging.slf4j.SLF4JLoggerContext",
                LogManager.getContext(false).getClass().getName());
    }
}
