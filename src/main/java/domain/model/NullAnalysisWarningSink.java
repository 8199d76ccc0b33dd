package domain.model;
/** No-op warning sink. */
final class NullAnalysisWarningSink implements AnalysisWarningSink {

    static final NullAnalysisWarningSink INSTANCE = new NullAnalysisWarningSink();

    private NullAnalysisWarningSink() {
    }

    @Override
    public void warn(AnalysisWarning warning) {
        // no-op
    }
}
