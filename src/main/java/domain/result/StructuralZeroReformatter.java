package domain.result;

import domain.model.AnalysisWarning;
import domain.model.AnalysisWarningSink;
import domain.model.ResultTable;
import domain.model.WarningCode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites the structural-zero indicator columns into the bare {@code <variable><level>} form of the
 * main result, so the same disambiguation applies.
 *
 * <p>{@code structural_zero (body.site = gut)} becomes {@code body.sitegut}.</p>
 */
public class StructuralZeroReformatter {

    static final String PREFIX = "structural_zero (";
    static final String SUFFIX = ")";
    static final String INFIX = " = ";

    private final AnalysisWarningSink warningSink;

    public StructuralZeroReformatter(AnalysisWarningSink warningSink) {
        this.warningSink = (warningSink == null) ? AnalysisWarningSink.none() : warningSink;
    }

    public ResultTable reformat(ResultTable zeros) {
        if (zeros == null) throw new IllegalArgumentException("structural zero table is null");

        Map<String, List<String>> columns = new LinkedHashMap<>();
        for (String column : zeros.getColumnNames()) {
            String bare = toBareName(column);
            if (bare == null) {
                warningSink.warn(AnalysisWarning.of(WarningCode.UNCLAIMED_RESULT_COLUMN, column,
                        "structural zero column does not follow \"" + PREFIX + "<variable>" + INFIX + "<level>"
                                + SUFFIX + "\"; kept verbatim"));
                bare = column;
            }
            columns.put(bare, zeros.getColumn(column));
        }
        return new ResultTable(zeros.getIndexName(), zeros.getRowIds(), columns);
    }

    /**
     * @return the bare concatenation, or null when the text is not decorated as expected
     */
    public static String toBareName(String column) {
        if (column == null) return null;
        if (!column.startsWith(PREFIX) || !column.endsWith(SUFFIX)) return null;
        if (column.length() < PREFIX.length() + SUFFIX.length()) return null;

        String inner = column.substring(PREFIX.length(), column.length() - SUFFIX.length());
        // engine variable names never contain spaces, levels may
        int eq = inner.indexOf(INFIX);
        if (eq <= 0) return null;
        return inner.substring(0, eq) + inner.substring(eq + INFIX.length());
    }
}
