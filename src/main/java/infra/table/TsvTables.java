package infra.table;

import domain.model.ResultTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tab-separated IO shared by the loaders and the engine adapter.
 *
 * <p>Two dialects:
 * <ul>
 *   <li>{@link #QUOTED}: user files (metadata, feature table), double quotes honoured</li>
 *   <li>{@link #RAW}: files exchanged with the engine, no quoting at all; cells never contain tabs or newlines</li>
 * </ul></p>
 */
public final class TsvTables {

    public static final CSVFormat QUOTED = CSVFormat.TDF.builder()
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    public static final CSVFormat RAW = CSVFormat.TDF.builder()
            .setQuote(null)
            .setTrim(false)
            .setIgnoreSurroundingSpaces(false)
            .setIgnoreEmptyLines(true)
            .setRecordSeparator('\n')
            .build();

    private TsvTables() {
    }

    /**
     * All records as string lists. The BOM of the first cell is dropped.
     */
    public static List<List<String>> readRows(Path path, CSVFormat format) {
        if (path == null) throw new IllegalArgumentException("path is null");

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {

            List<List<String>> rows = new ArrayList<>(256);
            for (CSVRecord r : parser) {
                List<String> row = new ArrayList<>(r.size());
                for (int i = 0; i < r.size(); i++) {
                    String v = r.get(i);
                    if (rows.isEmpty() && i == 0) v = stripBom(v);
                    row.add(v == null ? "" : v);
                }
                rows.add(row);
            }
            return rows;

        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + path.toAbsolutePath(), e);
        }
    }

    /**
     * Header row = index name + column names; every other row = row id + cells.
     */
    public static ResultTable readResultTable(Path path) {
        List<List<String>> rows = readRows(path, RAW);
        if (rows.isEmpty()) {
            throw new IllegalStateException("Empty table: " + path.toAbsolutePath());
        }

        List<String> header = rows.get(0);
        if (header.isEmpty() || header.get(0).isBlank()) {
            throw new IllegalStateException("Missing index column header: " + path.toAbsolutePath());
        }

        List<String> rowIds = new ArrayList<>(rows.size() - 1);
        Map<String, List<String>> columns = new LinkedHashMap<>();
        for (int c = 1; c < header.size(); c++) {
            if (columns.put(header.get(c), new ArrayList<>(rows.size() - 1)) != null) {
                throw new IllegalStateException("Duplicate column \"" + header.get(c) + "\" in " + path.toAbsolutePath());
            }
        }

        for (int r = 1; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            if (row.size() != header.size()) {
                throw new IllegalStateException("Row " + (r + 1) + " of " + path.toAbsolutePath() + " has "
                        + row.size() + " cells, expected " + header.size());
            }
            rowIds.add(row.get(0));
            for (int c = 1; c < header.size(); c++) {
                columns.get(header.get(c)).add(row.get(c));
            }
        }
        return new ResultTable(header.get(0), rowIds, columns);
    }

    public static void writeRows(Path path, CSVFormat format, List<String> header, List<List<String>> rows) {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            printer.printRecord(header);
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write " + path.toAbsolutePath(), e);
        }
    }

    static String stripBom(String s) {
        if (s == null) return "";
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
