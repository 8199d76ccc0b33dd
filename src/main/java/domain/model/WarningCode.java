package domain.model;

/**
 * Standard warning codes.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for operators.</p>
 */
public enum WarningCode {

    /**
     * Metadata samples that are not in the feature table were left out of the covariate table.
     */
    METADATA_SAMPLES_DROPPED,

    /**
     * A categorical formula variable had no reference level directive; the smallest level was used.
     */
    DEFAULT_REFERENCE_LEVEL,

    /**
     * A formula term was written with hyphens and renamed to the engine spelling.
     */
    FORMULA_TERM_RENAMED,

    /**
     * A result column's level still contains "::" after parsing; the split may be ambiguous.
     */
    AMBIGUOUS_SEPARATOR,

    /**
     * An engine output column did not start with any known statistic prefix.
     */
    UNCLAIMED_RESULT_COLUMN,

    /**
     * An engine output column that looked like a covariate could not be attributed to a metadata column.
     */
    UNRESOLVED_COVARIATE_COLUMN
}
