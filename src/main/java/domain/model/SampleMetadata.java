package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-sample metadata: ordered sample ids and typed columns keyed by their original name.
 *
 * <p>Treated as read-only for the lifetime of a request.</p>
 */
public final class SampleMetadata {

    private final List<String> sampleIds;
    private final Set<String> sampleIndex;
    private final Map<String, MetadataColumn> columns;

    public SampleMetadata(List<String> sampleIds, List<MetadataColumn> columns) {
        if (sampleIds == null) throw new IllegalArgumentException("sampleIds is null");
        if (columns == null) throw new IllegalArgumentException("columns is null");

        Set<String> seen = new HashSet<>();
        for (String id : sampleIds) {
            if (!seen.add(id)) throw new IllegalArgumentException("duplicate sample id in metadata: " + id);
        }

        Map<String, MetadataColumn> m = new LinkedHashMap<>();
        for (MetadataColumn c : columns) {
            if (m.put(c.getName(), c) != null) {
                throw new IllegalArgumentException("duplicate metadata column: " + c.getName());
            }
        }
        this.sampleIds = Collections.unmodifiableList(new ArrayList<>(sampleIds));
        this.sampleIndex = Collections.unmodifiableSet(seen);
        this.columns = Collections.unmodifiableMap(m);
    }

    public List<String> getSampleIds() {
        return sampleIds;
    }

    public boolean hasSample(String sampleId) {
        return sampleId != null && sampleIndex.contains(sampleId);
    }

    public boolean hasColumn(String name) {
        return name != null && columns.containsKey(name);
    }

    /**
     * @return the column, or null when absent
     */
    public MetadataColumn getColumn(String name) {
        return (name == null) ? null : columns.get(name);
    }

    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    public List<MetadataColumn> getColumns() {
        return List.copyOf(columns.values());
    }
}
