package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>Deduplicates by (code|file|index|message|detail); the same implicit alias inside a
 * repeated subquery would otherwise produce identical rows.</p>
 */
public final class ListAnalysisWarningSink implements AnalysisWarningSink {

    private final List<AnalysisWarning> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListAnalysisWarningSink(List<AnalysisWarning> target) {
        this.target = target;
    }

    private static String key(AnalysisWarning w) {
        return w.getCode().name() + "|"
                + w.getFile() + "|"
                + w.getStatementIndex() + "|"
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
