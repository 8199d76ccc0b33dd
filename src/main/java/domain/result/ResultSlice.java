package domain.result;

import domain.model.ResultTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One bundle table: the renamed cells plus what each column stands for.
 */
public final class ResultSlice {

    /**
     * Name of the structural-zero slice.
     */
    public static final String STRUCTURAL_ZEROS = "structural_zeros";

    private final String name;
    private final boolean flagValues;
    private final ResultTable table;
    private final Map<String, CovariateColumnRef> refsByOutputName;

    public ResultSlice(String name, boolean flagValues, ResultTable table, List<CovariateColumnRef> refs) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is blank");
        if (table == null) throw new IllegalArgumentException("table is null");
        if (refs == null || refs.size() != table.columnCount()) {
            throw new IllegalArgumentException("slice " + name + ": one column reference per column expected");
        }

        Map<String, CovariateColumnRef> m = new LinkedHashMap<>();
        List<String> columns = table.getColumnNames();
        for (int i = 0; i < columns.size(); i++) {
            CovariateColumnRef ref = refs.get(i);
            if (!columns.get(i).equals(ref.getOutputName())) {
                throw new IllegalArgumentException("slice " + name + ": column " + columns.get(i)
                        + " does not match " + ref.getOutputName());
            }
            m.put(columns.get(i), ref);
        }
        this.name = name;
        this.flagValues = flagValues;
        this.table = table;
        this.refsByOutputName = Collections.unmodifiableMap(m);
    }

    public String getName() {
        return name;
    }

    public String getFileName() {
        return name + "_slice.csv";
    }

    /**
     * @return true when the cells are booleans (significance / pass / structural-zero flags)
     */
    public boolean hasFlagValues() {
        return flagValues;
    }

    public ResultTable getTable() {
        return table;
    }

    public List<CovariateColumnRef> getColumnRefs() {
        return List.copyOf(refsByOutputName.values());
    }

    /**
     * @return the reference, or null when the slice has no such column
     */
    public CovariateColumnRef getColumnRef(String outputName) {
        return refsByOutputName.get(outputName);
    }

    @Override
    public String toString() {
        return "ResultSlice{" + name + ", rows=" + table.rowCount() + ", columns=" + table.getColumnNames() + '}';
    }
}
