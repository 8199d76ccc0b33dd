package domain.model;

/**
 * Sink for analysis warnings.
 *
 * <p>Warnings are produced by several components (translator, covariate builder, result
 * post-processing). A simple sink lets us collect them without coupling those components to the
 * CLI or the report writer.</p>
 */
public interface AnalysisWarningSink {

    static AnalysisWarningSink none() {
        return NullAnalysisWarningSink.INSTANCE;
    }

    void warn(AnalysisWarning warning);
}
