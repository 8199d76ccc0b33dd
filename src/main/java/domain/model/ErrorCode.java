package domain.model;

/**
 * Stable error codes.
 *
 * <p>Keep the set small: add a code only when callers can act on it differently.</p>
 */
public enum ErrorCode {

    /**
     * Metadata declares a column type other than categorical/numeric.
     */
    UNKNOWN_COLUMN_TYPE(ErrorCategory.SCHEMA),

    /**
     * A formula term does not resolve to a metadata column.
     */
    VARIABLE_NOT_FOUND(ErrorCategory.SCHEMA),

    EMPTY_FORMULA(ErrorCategory.FORMULA_GRAMMAR),

    /**
     * The formula contains a dependent-variable separator ({@code ~}).
     */
    DEPENDENT_VARIABLE(ErrorCategory.FORMULA_GRAMMAR),

    /**
     * An operator is not placed between two terms (leading, trailing or doubled).
     */
    DANGLING_OPERATOR(ErrorCategory.FORMULA_GRAMMAR),

    /**
     * A reference level directive does not contain exactly one {@code ::} separator.
     */
    MALFORMED_REFERENCE_LEVEL(ErrorCategory.REFERENCE_LEVEL),

    REFERENCE_COLUMN_NOT_FOUND(ErrorCategory.REFERENCE_LEVEL),

    REFERENCE_COLUMN_NOT_IN_FORMULA(ErrorCategory.REFERENCE_LEVEL),

    REFERENCE_COLUMN_NUMERIC(ErrorCategory.REFERENCE_LEVEL),

    DUPLICATE_REFERENCE_COLUMN(ErrorCategory.REFERENCE_LEVEL),

    /**
     * The requested level is not observed among the samples of the feature table.
     */
    REFERENCE_LEVEL_NOT_FOUND(ErrorCategory.REFERENCE_LEVEL),

    /**
     * Samples of the feature table are missing from the metadata.
     */
    SAMPLES_MISSING_FROM_METADATA(ErrorCategory.CROSS_VALIDATION),

    /**
     * Structural-zero detection was requested without a group variable.
     */
    GROUP_REQUIRED(ErrorCategory.PRECONDITION),

    GROUP_NOT_FOUND(ErrorCategory.PRECONDITION),

    GROUP_NOT_CATEGORICAL(ErrorCategory.PRECONDITION),

    /**
     * A scalar parameter is out of range or not one of the allowed choices.
     */
    INVALID_PARAMETER(ErrorCategory.PRECONDITION),

    /**
     * Two distinct column names encode to the same engine identifier.
     */
    IDENTIFIER_COLLISION(ErrorCategory.INVARIANT_VIOLATION),

    /**
     * Reference-level deduction found zero or several candidates.
     */
    REFERENCE_LEVEL_UNDETERMINED(ErrorCategory.INVARIANT_VIOLATION),

    /**
     * A required statistic has no column in the engine output.
     */
    MISSING_STATISTIC(ErrorCategory.INVARIANT_VIOLATION),

    ENGINE_FAILURE(ErrorCategory.EXTERNAL_ENGINE);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
