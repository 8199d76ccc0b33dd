package domain.model;

/**
 * A single non-fatal finding emitted while preparing or post-processing a model run.
 *
 * <p>Warnings never stop the analysis; they surface information operators should review
 * (dropped samples, defaulted reference levels, engine columns nobody claimed).</p>
 */
public final class AnalysisWarning {

    private final WarningCode code;
    private final String subject;
    private final String message;
    private final String detail;

    public AnalysisWarning(WarningCode code, String subject, String message, String detail) {
        this.code = code == null ? WarningCode.UNCLAIMED_RESULT_COLUMN : code;
        this.subject = nullToEmpty(subject);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static AnalysisWarning of(WarningCode code, String subject, String message) {
        return new AnalysisWarning(code, subject, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    /**
     * The identifier the warning is about (column, sample id, engine column ...).
     */
    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + " [" + subject + "] " + message + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
