package domain.engine;

import domain.model.Ancombc2Exception;
import domain.model.ErrorCode;

/**
 * p-value adjustment methods understood by the engine ({@code p.adjust}).
 */
public enum PAdjustMethod {
    HOLM("holm"),
    HOCHBERG("hochberg"),
    HOMMEL("hommel"),
    BONFERRONI("bonferroni"),
    BH("BH"),
    BY("BY"),
    FDR("fdr"),
    NONE("none");

    private final String engineName;

    PAdjustMethod(String engineName) {
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }

    /**
     * Exact engine spelling first ({@code BH} and {@code bh} are both accepted), blank means {@link #HOLM}.
     */
    public static PAdjustMethod parse(String raw) {
        if (raw == null || raw.isBlank()) return HOLM;
        String v = raw.trim();
        for (PAdjustMethod m : values()) {
            if (m.engineName.equals(v)) return m;
        }
        for (PAdjustMethod m : values()) {
            if (m.engineName.equalsIgnoreCase(v)) return m;
        }
        throw new Ancombc2Exception(ErrorCode.INVALID_PARAMETER,
                "Unknown p-value adjustment method \"" + raw + "\". Expected one of"
                        + " holm, hochberg, hommel, bonferroni, BH, BY, fdr, none.");
    }
}
