package domain.model;

/**
 * Broad error families. All of them are reported synchronously and none is retried.
 */
public enum ErrorCategory {

    /** Formula/metadata disagree, or metadata carries an unknown column type. */
    SCHEMA,

    FORMULA_GRAMMAR,

    REFERENCE_LEVEL,

    /** Feature table and metadata do not share the expected samples. */
    CROSS_VALIDATION,

    PRECONDITION,

    /** Should never happen with a well-behaved engine; checked anyway. */
    INVARIANT_VIOLATION,

    /** The external statistics engine itself failed. */
    EXTERNAL_ENGINE
}
