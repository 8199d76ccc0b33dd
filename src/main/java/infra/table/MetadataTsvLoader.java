package infra.table;

import domain.model.ColumnType;
import domain.model.MetadataColumn;
import domain.model.SampleMetadata;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Sample metadata TSV loader.
 *
 * <p>Layout:
 * <pre>
 * sample-id   body-site   days-since-experiment-start
 * #q2:types   categorical numeric
 * L1S8        gut         0
 * </pre>
 * The first column holds the sample ids. The {@code #q2:types} row is optional; without it a column is
 * numeric when every non-empty cell parses as a number. Other rows starting with {@code #} are comments.</p>
 */
public class MetadataTsvLoader {

    static final String TYPES_DIRECTIVE = "#q2:types";

    private static final Set<String> ID_HEADERS = Set.of(
            "id", "sampleid", "sample id", "sample-id", "sample_id",
            "#sampleid", "#sample id", "#sample-id", "#sample_id",
            "featureid", "feature id", "feature-id", "feature_id", "#otuid", "#otu id"
    );

    public SampleMetadata load(Path path) {
        List<List<String>> rows = TsvTables.readRows(path, TsvTables.QUOTED);

        // ---------------------------
        // 1) header (first row that is not a comment, unless it names the id column)
        // ---------------------------
        int r = 0;
        while (r < rows.size() && isComment(rows.get(r)) && !isIdHeader(first(rows.get(r)))) r++;
        if (r >= rows.size()) {
            throw new IllegalStateException("Metadata has no header row: " + path.toAbsolutePath());
        }
        List<String> header = rows.get(r++);
        if (!isIdHeader(first(header))) {
            throw new IllegalStateException("Unrecognized metadata id column \"" + first(header) + "\" in "
                    + path.toAbsolutePath());
        }
        List<String> names = header.subList(1, header.size());

        // ---------------------------
        // 2) directives / records
        // ---------------------------
        List<String> declaredTypes = null;
        List<String> sampleIds = new ArrayList<>();
        List<Map<String, String>> values = new ArrayList<>(names.size());
        for (int c = 0; c < names.size(); c++) values.add(new LinkedHashMap<>());

        for (; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            String head = first(row);

            if (head.toLowerCase(Locale.ROOT).equals(TYPES_DIRECTIVE)) {
                declaredTypes = row.subList(1, row.size());
                continue;
            }
            if (head.startsWith("#") || isBlankRow(row)) continue;

            if (row.size() > header.size()) {
                throw new IllegalStateException("Row " + (r + 1) + " of " + path.toAbsolutePath() + " has "
                        + row.size() + " cells, header has " + header.size());
            }
            sampleIds.add(head);
            for (int c = 0; c < names.size(); c++) {
                String v = (c + 1 < row.size()) ? row.get(c + 1) : "";
                values.get(c).put(head, v);
            }
        }

        // ---------------------------
        // 3) typed columns
        // ---------------------------
        List<MetadataColumn> columns = new ArrayList<>(names.size());
        for (int c = 0; c < names.size(); c++) {
            String name = names.get(c);
            ColumnType type = (declaredTypes != null && c < declaredTypes.size() && !declaredTypes.get(c).isBlank())
                    ? ColumnType.parse(name, declaredTypes.get(c))
                    : inferType(values.get(c).values());
            columns.add(new MetadataColumn(name, type, values.get(c)));
        }
        return new SampleMetadata(sampleIds, columns);
    }

    static ColumnType inferType(Iterable<String> cells) {
        boolean any = false;
        for (String v : cells) {
            if (v == null || v.isBlank()) continue;
            any = true;
            try {
                Double.parseDouble(v.trim());
            } catch (NumberFormatException e) {
                return ColumnType.CATEGORICAL;
            }
        }
        return any ? ColumnType.NUMERIC : ColumnType.CATEGORICAL;
    }

    private static boolean isIdHeader(String s) {
        return ID_HEADERS.contains(s.trim().toLowerCase(Locale.ROOT));
    }

    private static boolean isComment(List<String> row) {
        return first(row).startsWith("#");
    }

    private static boolean isBlankRow(List<String> row) {
        for (String v : row) {
            if (v != null && !v.isBlank()) return false;
        }
        return true;
    }

    private static String first(List<String> row) {
        return row.isEmpty() ? "" : row.get(0);
    }
}
