package domain.covariate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Engine-facing covariate table: one row per sample of the feature table, one column per metadata
 * column (encoded name, coerced type, releveled categories).
 */
public final class CovariateTable {

    private final List<String> sampleIds;
    private final Map<String, CovariateColumn> byOriginal;
    private final Map<String, CovariateColumn> byEngine;
    private final Map<String, String> referenceLevels;

    CovariateTable(List<String> sampleIds, List<CovariateColumn> columns, Map<String, String> referenceLevels) {
        this.sampleIds = List.copyOf(sampleIds);

        Map<String, CovariateColumn> o = new LinkedHashMap<>();
        Map<String, CovariateColumn> e = new LinkedHashMap<>();
        for (CovariateColumn c : columns) {
            if (c.size() != sampleIds.size()) {
                throw new IllegalArgumentException("column " + c.getOriginalName() + " has " + c.size()
                        + " rows, expected " + sampleIds.size());
            }
            o.put(c.getOriginalName(), c);
            e.put(c.getEngineName(), c);
        }
        this.byOriginal = Collections.unmodifiableMap(o);
        this.byEngine = Collections.unmodifiableMap(e);
        this.referenceLevels = Collections.unmodifiableMap(new LinkedHashMap<>(referenceLevels));
    }

    public List<String> getSampleIds() {
        return sampleIds;
    }

    public List<CovariateColumn> getColumns() {
        return List.copyOf(byOriginal.values());
    }

    /**
     * @return the column, or null when absent
     */
    public CovariateColumn getColumn(String originalName) {
        return byOriginal.get(originalName);
    }

    public CovariateColumn getColumnByEngineName(String engineName) {
        return byEngine.get(engineName);
    }

    /**
     * Reference level per categorical formula variable (original column name -> level), explicit
     * directives first, defaults after, in the order they were applied.
     */
    public Map<String, String> getReferenceLevels() {
        return referenceLevels;
    }

    /**
     * The same pairs rendered as {@code column::level} directive strings.
     */
    public List<String> getReferenceLevelDirectives() {
        return referenceLevels.entrySet().stream()
                .map(en -> en.getKey() + ReferenceLevelDirective.SEPARATOR + en.getValue())
                .collect(Collectors.toList());
    }
}
