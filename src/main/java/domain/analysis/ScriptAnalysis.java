package domain.analysis;

import domain.model.SqlStatementResult;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of analyzing one script: a result row per statement plus the rewritten script text.
 */
public final class ScriptAnalysis {

    private final String file;
    private final List<SqlStatementResult> results;
    private final String formattedScript;

    ScriptAnalysis(String file, List<SqlStatementResult> results, String formattedScript) {
        this.file = file;
        this.results = Collections.unmodifiableList(results);
        this.formattedScript = formattedScript;
    }

    public String getFile() {
        return file;
    }

    public List<SqlStatementResult> getResults() {
        return results;
    }

    /**
     * Statements joined with {@code ;} and a blank line. Failed statements keep their
     * original text. Empty when the script held no statement.
     */
    public String getFormattedScript() {
        return formattedScript;
    }

    public int getSuccessCount() {
        int n = 0;
        for (SqlStatementResult r : results) {
            if (r.isSuccess()) n++;
        }
        return n;
    }

    public int getFailedCount() {
        return results.size() - getSuccessCount();
    }
}
