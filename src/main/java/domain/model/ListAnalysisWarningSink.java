package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>We deduplicate by (code|subject|message|detail): the same engine column is visited once per
 * slice, so identical findings would otherwise repeat.</p>
 */
public final class ListAnalysisWarningSink implements AnalysisWarningSink {

    private final List<AnalysisWarning> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListAnalysisWarningSink(List<AnalysisWarning> target) {
        this.target = target;
    }

    private static String key(AnalysisWarning w) {
        return w.getCode().name() + "|"
                + w.getSubject() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(AnalysisWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
