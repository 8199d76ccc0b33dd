package domain.result;

import domain.model.AnalysisWarning;
import domain.model.AnalysisWarningSink;
import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;
import domain.model.ResultTable;
import domain.model.WarningCode;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the engine's wide table into one table per statistic.
 *
 * <p>A column belongs to the statistic whose {@code <prefix>_} it starts with. When several
 * statistics claim it ({@code diff_} and {@code diff_robust_}) the longest prefix wins. The prefix is
 * stripped; the index column is carried into every slice.</p>
 */
public class ResultSliceSplitter {

    private final AnalysisWarningSink warningSink;

    public ResultSliceSplitter(AnalysisWarningSink warningSink) {
        this.warningSink = (warningSink == null) ? AnalysisWarningSink.none() : warningSink;
    }

    /**
     * @param statistics statistics to extract; required ones must have at least one column
     * @return slices keyed by statistic, in declaration order; optional statistics without columns are absent
     */
    public Map<Statistic, ResultTable> split(ResultTable wide, Collection<Statistic> statistics) {
        if (wide == null) throw new IllegalArgumentException("wide table is null");
        if (statistics == null || statistics.isEmpty()) throw new IllegalArgumentException("no statistics");

        Map<Statistic, Map<String, List<String>>> buckets = new EnumMap<>(Statistic.class);
        for (Statistic s : statistics) buckets.put(s, new LinkedHashMap<>());

        for (String column : wide.getColumnNames()) {
            Statistic owner = claim(column, statistics);
            if (owner == null) {
                warningSink.warn(AnalysisWarning.of(WarningCode.UNCLAIMED_RESULT_COLUMN, column,
                        "engine column does not belong to any known statistic; ignored"));
                continue;
            }
            String stripped = column.substring(owner.getColumnPrefix().length());
            buckets.get(owner).put(stripped, wide.getColumn(column));
        }

        Map<Statistic, ResultTable> out = new EnumMap<>(Statistic.class);
        for (Map.Entry<Statistic, Map<String, List<String>>> e : buckets.entrySet()) {
            Statistic s = e.getKey();
            if (e.getValue().isEmpty()) {
                if (s.isRequired()) {
                    throw new Ancombc2Exception(ErrorCode.MISSING_STATISTIC,
                            "The engine output has no \"" + s.getColumnPrefix() + "\" columns; the \""
                                    + s.getSliceName() + "\" slice cannot be produced. Columns seen: "
                                    + wide.getColumnNames());
                }
                continue;
            }
            out.put(s, new ResultTable(wide.getIndexName(), wide.getRowIds(), e.getValue()));
        }
        return out;
    }

    static Statistic claim(String column, Collection<Statistic> statistics) {
        Statistic best = null;
        for (Statistic s : statistics) {
            String p = s.getColumnPrefix();
            if (column.length() > p.length() && column.startsWith(p)) {
                if (best == null || p.length() > best.getColumnPrefix().length()) best = s;
            }
        }
        return best;
    }
}
