package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A row-indexed table of cell strings, as produced by the engine and as written to the bundle.
 *
 * <p>Cells are kept as text so the engine's number formatting survives unchanged.</p>
 */
public final class ResultTable {

    private final String indexName;
    private final List<String> rowIds;
    private final Map<String, List<String>> columns;

    public ResultTable(String indexName, List<String> rowIds, Map<String, List<String>> columns) {
        if (indexName == null || indexName.isEmpty()) throw new IllegalArgumentException("indexName is empty");
        if (rowIds == null) throw new IllegalArgumentException("rowIds is null");
        if (columns == null) throw new IllegalArgumentException("columns is null");

        Map<String, List<String>> m = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : columns.entrySet()) {
            List<String> values = e.getValue();
            if (values == null || values.size() != rowIds.size()) {
                throw new IllegalArgumentException("column \"" + e.getKey() + "\" has "
                        + (values == null ? 0 : values.size()) + " cells, expected " + rowIds.size());
            }
            if (e.getKey().equals(indexName)) {
                throw new IllegalArgumentException("column name clashes with index name: " + indexName);
            }
            m.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(values)));
        }
        this.indexName = indexName;
        this.rowIds = Collections.unmodifiableList(new ArrayList<>(rowIds));
        this.columns = Collections.unmodifiableMap(m);
    }

    public String getIndexName() {
        return indexName;
    }

    public List<String> getRowIds() {
        return rowIds;
    }

    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    /**
     * @return the cells of the column, or null when absent
     */
    public List<String> getColumn(String name) {
        return columns.get(name);
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public int rowCount() {
        return rowIds.size();
    }

    public int columnCount() {
        return columns.size();
    }
}
