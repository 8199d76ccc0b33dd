package infra.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import domain.analysis.AnalysisResult;
import domain.model.ResultTable;
import domain.output.BundleWriter;
import domain.result.CovariateColumnRef;
import domain.result.ResultSlice;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the bundle as frictionless CSV files plus {@value #DESCRIPTOR}.
 *
 * <pre>
 * out/
 *   lfc_slice.csv  se_slice.csv  W_slice.csv  p_val_slice.csv  q_val_slice.csv
 *   diff_slice.csv  passed_ss_slice.csv  [structural_zeros_slice.csv]
 *   datapackage.json
 * </pre>
 */
public final class CsvBundleWriter implements BundleWriter {

    static final String DESCRIPTOR = "datapackage.json";
    static final String PACKAGE_NAME = "ancombc2-bundle";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public void write(Path outDir, AnalysisResult result) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");
        if (result == null) throw new IllegalArgumentException("result is null");

        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create bundle dir: " + outDir, e);
        }

        for (ResultSlice s : result.getSlices()) {
            writeSlice(outDir.resolve(s.getFileName()), s.getTable());
        }
        writeDescriptor(outDir.resolve(DESCRIPTOR), result.getSlices());
    }

    static void writeSlice(Path file, ResultTable t) {
        List<String> columns = t.getColumnNames();

        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, CSVFormat.DEFAULT)) {

            List<String> header = new ArrayList<>(columns.size() + 1);
            header.add(t.getIndexName());
            header.addAll(columns);
            printer.printRecord(header);

            for (int i = 0; i < t.rowCount(); i++) {
                List<String> row = new ArrayList<>(columns.size() + 1);
                row.add(t.getRowIds().get(i));
                for (String c : columns) row.add(t.getColumn(c).get(i));
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write slice: " + file, e);
        }
    }

    static ObjectNode descriptor(List<ResultSlice> slices) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("name", PACKAGE_NAME);
        root.put("profile", "tabular-data-package");

        ArrayNode resources = root.putArray("resources");
        for (ResultSlice s : slices) {
            ObjectNode res = resources.addObject();
            res.put("name", s.getName() + "_slice");
            res.put("path", s.getFileName());
            res.put("profile", "tabular-data-resource");
            res.put("format", "csv");
            res.put("mediatype", "text/csv");
            res.put("encoding", "utf-8");

            ObjectNode schema = res.putObject("schema");
            ArrayNode fields = schema.putArray("fields");

            ObjectNode index = fields.addObject();
            index.put("name", s.getTable().getIndexName());
            index.put("type", "string");
            index.put("title", "feature identifier");

            String valueType = s.hasFlagValues() ? "boolean" : "number";
            for (CovariateColumnRef ref : s.getColumnRefs()) {
                ObjectNode f = fields.addObject();
                f.put("name", ref.getOutputName());
                f.put("type", valueType);
                if (s.hasFlagValues()) {
                    f.putArray("trueValues").add("TRUE").add("True").add("true");
                    f.putArray("falseValues").add("FALSE").add("False").add("false");
                }
                if (ref.isCovariate()) {
                    f.put("ancombc:variable", ref.getVariable());
                    f.put("ancombc:variableType", ref.getType().tag());
                }
                if (ref.isCategorical()) {
                    f.put("ancombc:level", ref.getLevel());
                    if (ref.getReference() != null) f.put("ancombc:reference", ref.getReference());
                }
            }
            schema.put("primaryKey", s.getTable().getIndexName());
            schema.putArray("missingValues").add("").add("NA");
        }
        return root;
    }

    private static void writeDescriptor(Path file, List<ResultSlice> slices) {
        try {
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), descriptor(slices));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write " + DESCRIPTOR + ": " + file, e);
        }
    }
}
