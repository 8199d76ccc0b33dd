package domain.result;

import domain.model.ColumnType;

/**
 * What one output column stands for, parsed once right after the engine call.
 *
 * <ul>
 *   <li>categorical: variable + level (+ reference once deduced)</li>
 *   <li>numeric: variable only</li>
 *   <li>other engine terms such as {@code (Intercept)}: neither</li>
 * </ul>
 */
public final class CovariateColumnRef {

    private final String engineName;
    private final String variable;
    private final ColumnType type;
    private final String level;
    private final String reference;
    private final String suffix;

    private CovariateColumnRef(String engineName, String variable, ColumnType type,
                               String level, String reference, String suffix) {
        this.engineName = engineName;
        this.variable = variable;
        this.type = type;
        this.level = level;
        this.reference = reference;
        this.suffix = suffix == null ? "" : suffix;
    }

    static CovariateColumnRef categorical(String engineName, String variable, String level) {
        return new CovariateColumnRef(engineName, variable, ColumnType.CATEGORICAL, level, null, "");
    }

    /**
     * @param suffix engine text after the variable name; normally empty
     */
    static CovariateColumnRef numeric(String engineName, String variable, String suffix) {
        return new CovariateColumnRef(engineName, variable, ColumnType.NUMERIC, null, null, suffix);
    }

    static CovariateColumnRef other(String engineName) {
        return new CovariateColumnRef(engineName, null, null, null, null, "");
    }

    CovariateColumnRef withReference(String reference) {
        if (type != ColumnType.CATEGORICAL) return this;
        return new CovariateColumnRef(engineName, variable, type, level, reference, suffix);
    }

    /**
     * Column text as the engine wrote it (slice prefix already stripped).
     */
    public String getEngineName() {
        return engineName;
    }

    /**
     * Column name in the bundle: {@code variable::level}, the numeric variable, or the engine text.
     */
    public String getOutputName() {
        if (type == null) return engineName;
        switch (type) {
            case CATEGORICAL:
                return variable + "::" + level;
            case NUMERIC:
                return variable + suffix;
            default:
                throw new IllegalStateException("unhandled column type: " + type);
        }
    }

    /**
     * @return original metadata column name, or null for terms that are not covariates
     */
    public String getVariable() {
        return variable;
    }

    /**
     * @return the column type of the variable, or null for terms that are not covariates
     */
    public ColumnType getType() {
        return type;
    }

    public String getLevel() {
        return level;
    }

    public String getReference() {
        return reference;
    }

    public boolean isCategorical() {
        return type == ColumnType.CATEGORICAL;
    }

    public boolean isCovariate() {
        return type != null;
    }

    @Override
    public String toString() {
        return engineName + " -> " + getOutputName()
                + (reference == null ? "" : " (reference " + reference + ")");
    }
}
