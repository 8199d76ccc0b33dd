package domain.covariate;

import domain.model.ColumnType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One engine-facing covariate: the encoded name plus values coerced by declared type.
 *
 * <p>Categorical columns carry an explicit level order; the first level is the reference the
 * engine contrasts against. Numeric columns carry doubles ({@code NaN} for missing).</p>
 */
public final class CovariateColumn {

    private final String originalName;
    private final String engineName;
    private final ColumnType type;

    // categorical
    private final List<String> levels;
    private final List<String> labels;

    // numeric
    private final double[] numbers;

    private CovariateColumn(String originalName, String engineName, ColumnType type,
                            List<String> levels, List<String> labels, double[] numbers) {
        this.originalName = Objects.requireNonNull(originalName, "originalName");
        this.engineName = Objects.requireNonNull(engineName, "engineName");
        this.type = Objects.requireNonNull(type, "type");
        this.levels = levels;
        this.labels = labels;
        this.numbers = numbers;
    }

    /**
     * @param labels one entry per sample row (null = missing)
     * @param levels distinct levels; the first is the reference
     */
    public static CovariateColumn categorical(String originalName, String engineName,
                                              List<String> labels, List<String> levels) {
        return new CovariateColumn(originalName, engineName, ColumnType.CATEGORICAL,
                Collections.unmodifiableList(new ArrayList<>(levels)),
                Collections.unmodifiableList(new ArrayList<>(labels)),
                null);
    }

    public static CovariateColumn numeric(String originalName, String engineName, double[] numbers) {
        return new CovariateColumn(originalName, engineName, ColumnType.NUMERIC, null, null, numbers.clone());
    }

    /**
     * Same labels, level order rotated so that {@code reference} comes first.
     */
    CovariateColumn relevel(String reference) {
        if (type != ColumnType.CATEGORICAL) {
            throw new IllegalStateException("relevel on a numeric column: " + originalName);
        }
        if (!levels.contains(reference)) {
            throw new IllegalArgumentException("unknown level \"" + reference + "\" for " + originalName);
        }
        List<String> reordered = new ArrayList<>(levels.size());
        reordered.add(reference);
        for (String l : levels) {
            if (!l.equals(reference)) reordered.add(l);
        }
        return categorical(originalName, engineName, labels, reordered);
    }

    public String getOriginalName() {
        return originalName;
    }

    public String getEngineName() {
        return engineName;
    }

    public ColumnType getType() {
        return type;
    }

    /**
     * @return level order (reference first); empty for numeric columns
     */
    public List<String> getLevels() {
        return levels == null ? List.of() : levels;
    }

    /**
     * @return the first level, or null for numeric or all-missing columns
     */
    public String getReferenceLevel() {
        return (levels == null || levels.isEmpty()) ? null : levels.get(0);
    }

    /**
     * Cell text for the engine's covariate file: label, number, or {@code NA}.
     */
    public String cell(int row) {
        switch (type) {
            case CATEGORICAL: {
                String v = labels.get(row);
                return v == null ? "NA" : v;
            }
            case NUMERIC: {
                double d = numbers[row];
                return Double.isNaN(d) ? "NA" : formatNumber(d);
            }
            default:
                throw new IllegalStateException("unhandled column type: " + type);
        }
    }

    public String getLabel(int row) {
        return labels == null ? null : labels.get(row);
    }

    public double getNumber(int row) {
        return numbers == null ? Double.NaN : numbers[row];
    }

    public int size() {
        return labels != null ? labels.size() : numbers.length;
    }

    private static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return String.valueOf((long) d);
        }
        return String.valueOf(d);
    }

    @Override
    public String toString() {
        return "CovariateColumn{" + originalName + " -> " + engineName + ", " + type
                + (levels == null ? "" : ", levels=" + levels)
                + (numbers == null ? "" : ", n=" + numbers.length)
                + '}';
    }
}
