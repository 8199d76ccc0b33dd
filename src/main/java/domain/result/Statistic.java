package domain.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statistics reported by the engine, one column per covariate each.
 *
 * <p>The engine names its columns {@code <prefix>_<covariate>}. The slice name is what the bundle
 * calls the table ({@code <sliceName>_slice.csv}).</p>
 */
public enum Statistic {

    /**
     * Log fold change. Used to deduce reference levels.
     */
    LFC("lfc", "lfc", false, true),

    /**
     * Standard error of the log fold change.
     */
    SE("se", "se", false, true),

    /**
     * Test statistic.
     */
    W("W", "W", false, true),

    /**
     * Raw p-value.
     */
    P_VAL("p", "p_val", false, true),

    /**
     * Adjusted p-value.
     */
    Q_VAL("q", "q_val", false, true),

    /**
     * Significance flag at the requested alpha.
     */
    DIFF("diff", "diff", true, true),

    /**
     * Sensitivity analysis pass flag for the pseudo-count choice.
     */
    PASSED_SS("passed_ss", "passed_ss", true, true),

    /**
     * Significance flag that also requires the sensitivity pass. Newer engine releases only.
     */
    DIFF_ROBUST("diff_robust", "diff_robust", true, false);

    private final String prefix;
    private final String sliceName;
    private final boolean flag;
    private final boolean required;

    Statistic(String prefix, String sliceName, boolean flag, boolean required) {
        this.prefix = prefix;
        this.sliceName = sliceName;
        this.flag = flag;
        this.required = required;
    }

    /**
     * Bare engine prefix, without the {@code _} separator.
     */
    public String getPrefix() {
        return prefix;
    }

    /**
     * Prefix including the separator. Always match on this one: {@code p} is a literal prefix of
     * {@code passed_ss}, {@code p_} is not.
     */
    public String getColumnPrefix() {
        return prefix + "_";
    }

    public String getSliceName() {
        return sliceName;
    }

    /**
     * @return true when the cells are booleans rather than numbers
     */
    public boolean isFlag() {
        return flag;
    }

    public boolean isRequired() {
        return required;
    }

    public static List<Statistic> required() {
        List<Statistic> out = new ArrayList<>();
        for (Statistic s : values()) {
            if (s.required) out.add(s);
        }
        return Collections.unmodifiableList(out);
    }
}
