package infra.output;

import domain.model.AnalysisWarning;
import domain.model.ResultTable;
import domain.result.ResultSlice;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>one per slice (lfc, se, W, p_val, q_val, diff, passed_ss, structural_zeros ...)</li>
 *   <li>reference_levels: deduced reference level per categorical variable</li>
 *   <li>renames: engine identifier to metadata column</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class AnalysisReportXlsxWriter {

    private static void writeSliceSheet(Workbook wb, ResultSlice slice) {
        Sheet sh = wb.createSheet(slice.getName());
        ResultTable t = slice.getTable();
        List<String> columns = t.getColumnNames();

        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue(t.getIndexName());
        for (int c = 0; c < columns.size(); c++) {
            header.createCell(c + 1)
                    .setCellValue(columns.get(c));
        }

        for (int i = 0; i < t.rowCount(); i++) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(t.getRowIds().get(i));
            for (int c = 0; c < columns.size(); c++) {
                String v = t.getColumn(columns.get(c)).get(i);
                if (slice.hasFlagValues()) {
                    Boolean b = parseFlag(v);
                    if (b != null) {
                        row.createCell(c + 1)
                                .setCellValue(b);
                        continue;
                    }
                } else {
                    Double d = parseNumber(v);
                    if (d != null) {
                        row.createCell(c + 1)
                                .setCellValue(d);
                        continue;
                    }
                }
                row.createCell(c + 1)
                        .setCellValue(nullToEmpty(v));
            }
        }
    }

    private static void writePairsSheet(Workbook wb, String name, String keyHeader, String valueHeader,
                                        Map<String, String> pairs) {
        Sheet sh = wb.createSheet(name);
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue(keyHeader);
        header.createCell(1)
                .setCellValue(valueHeader);

        for (Map.Entry<String, String> e : pairs.entrySet()) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(nullToEmpty(e.getKey()));
            row.createCell(1)
                    .setCellValue(nullToEmpty(e.getValue()));
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<AnalysisWarning> warnings) {
        Sheet sh = wb.createSheet("warnings");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("code");
        header.createCell(1)
                .setCellValue("subject");
        header.createCell(2)
                .setCellValue("message");
        header.createCell(3)
                .setCellValue("detail");

        for (AnalysisWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(w.getCode() == null ? "" : w.getCode()
                            .name());
            row.createCell(1)
                    .setCellValue(nullToEmpty(w.getSubject()));
            row.createCell(2)
                    .setCellValue(nullToEmpty(w.getMessage()));
            row.createCell(3)
                    .setCellValue(nullToEmpty(w.getDetail()));
        }
    }

    private static Double parseNumber(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return Double.valueOf(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Boolean parseFlag(String s) {
        if (s == null) return null;
        String v = s.trim();
        if (v.equalsIgnoreCase("TRUE")) return Boolean.TRUE;
        if (v.equalsIgnoreCase("FALSE")) return Boolean.FALSE;
        return null;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public void write(
            Path resultXlsx,
            List<ResultSlice> slices,
            Map<String, String> referenceLevels,
            Map<String, String> renames,
            List<AnalysisWarning> warnings
    ) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (slices == null) throw new IllegalArgumentException("slices is null");
        if (referenceLevels == null) throw new IllegalArgumentException("referenceLevels is null");
        if (renames == null) throw new IllegalArgumentException("renames is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            for (ResultSlice s : slices) {
                writeSliceSheet(wb, s);
            }
            writePairsSheet(wb, "reference_levels", "variable", "reference", referenceLevels);
            writePairsSheet(wb, "renames", "engine", "original", renames);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
