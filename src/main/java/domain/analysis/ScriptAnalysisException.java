package domain.analysis;

/**
 * Thrown in fail-fast mode on the first failing statement. Carries the rows of the statements
 * analyzed so far, the failing one included, so callers can still report them.
 */
public final class ScriptAnalysisException extends IllegalStateException {

    private final transient ScriptAnalysis partialAnalysis;

    ScriptAnalysisException(String message, ScriptAnalysis partialAnalysis, Throwable cause) {
        super(message, cause);
        this.partialAnalysis = partialAnalysis;
    }

    /** Rows up to and including the failing statement; the formatted script is empty. */
    public ScriptAnalysis getPartialAnalysis() {
        return partialAnalysis;
    }
}
