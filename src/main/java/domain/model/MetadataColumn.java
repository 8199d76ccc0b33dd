package domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One typed metadata column: raw cell text per sample id.
 *
 * <p>Blank cells are missing values. The type tag is fixed at construction and never changes.</p>
 */
public final class MetadataColumn {

    private final String name;
    private final ColumnType type;
    private final Map<String, String> valuesBySample;

    public MetadataColumn(String name, ColumnType type, Map<String, String> valuesBySample) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("column name is empty");
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.valuesBySample = Collections.unmodifiableMap(new LinkedHashMap<>(
                valuesBySample == null ? Map.of() : valuesBySample));
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    public boolean isCategorical() {
        return type == ColumnType.CATEGORICAL;
    }

    /**
     * @return the raw value, or null when the sample is unknown or the cell is blank
     */
    public String getValue(String sampleId) {
        String v = valuesBySample.get(sampleId);
        if (v == null || v.isBlank()) return null;
        return v;
    }

    /**
     * @return the numeric value, or NaN when missing
     * @throws Ancombc2Exception when a non-blank cell is not a number
     */
    public double getNumber(String sampleId) {
        String v = getValue(sampleId);
        if (v == null) return Double.NaN;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new Ancombc2Exception(ErrorCode.UNKNOWN_COLUMN_TYPE,
                    "Numeric metadata column \"" + name + "\" contains a non-numeric value \"" + v
                            + "\" for sample \"" + sampleId + "\".", e);
        }
    }

    /**
     * Distinct non-missing values among the given samples, in natural string order.
     */
    public SortedSet<String> observedLevels(Collection<String> sampleIds) {
        SortedSet<String> out = new TreeSet<>();
        for (String id : sampleIds) {
            String v = getValue(id);
            if (v != null) out.add(v);
        }
        return out;
    }

    /**
     * Distinct non-missing values over every sample of the column.
     */
    public SortedSet<String> observedLevels() {
        return observedLevels(valuesBySample.keySet());
    }

    @Override
    public String toString() {
        return "MetadataColumn{name='" + name + "', type=" + type + '}';
    }
}
