package infra.table;

import domain.model.FeatureTable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Feature table TSV loader (BIOM-TSV convention, features as rows).
 *
 * <pre>
 * # Constructed from biom file
 * #OTU ID   L1S8   L1S57
 * f1        12     0
 * </pre>
 * Leading comment lines are skipped; the header is the first row whose first cell is an id header
 * ({@code #OTU ID}, {@code feature-id}, ...) or the first non-comment row.
 */
public class FeatureTableTsvLoader {

    public FeatureTable load(Path path) {
        List<List<String>> rows = TsvTables.readRows(path, TsvTables.QUOTED);

        int r = 0;
        while (r < rows.size() && isLeadingComment(rows.get(r))) r++;
        if (r >= rows.size()) {
            throw new IllegalStateException("Feature table has no header row: " + path.toAbsolutePath());
        }

        List<String> header = rows.get(r++);
        List<String> sampleIds = new ArrayList<>(header.subList(1, header.size()));
        if (sampleIds.isEmpty()) {
            throw new IllegalStateException("Feature table has no sample columns: " + path.toAbsolutePath());
        }

        List<String> featureIds = new ArrayList<>();
        List<double[]> counts = new ArrayList<>();
        for (; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            if (row.isEmpty() || row.get(0).startsWith("#")) continue;
            if (row.size() != header.size()) {
                throw new IllegalStateException("Row " + (r + 1) + " of " + path.toAbsolutePath() + " has "
                        + row.size() + " cells, expected " + header.size());
            }

            double[] values = new double[sampleIds.size()];
            for (int c = 0; c < values.length; c++) {
                String cell = row.get(c + 1);
                try {
                    values[c] = cell.isBlank() ? 0.0 : Double.parseDouble(cell.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalStateException("Non-numeric count \"" + cell + "\" for feature \"" + row.get(0)
                            + "\", sample \"" + sampleIds.get(c) + "\" in " + path.toAbsolutePath(), e);
                }
            }
            featureIds.add(row.get(0));
            counts.add(values);
        }

        return new FeatureTable(featureIds, sampleIds, counts.toArray(new double[0][]));
    }

    private static boolean isLeadingComment(List<String> row) {
        if (row.isEmpty()) return true;
        String head = row.get(0).trim();
        if (!head.startsWith("#")) return false;
        // "#OTU ID" is the header, not a comment
        return row.size() <= 1 && !head.equalsIgnoreCase("#OTU ID");
    }
}
