package domain.model;

/**
 * A single warning emitted while analyzing a statement.
 *
 * <p>Warnings are not fatal; they point at text operators should review.</p>
 */
public final class AnalysisWarning {

    private final WarningCode code;
    private final String file;
    private final int statementIndex;
    private final String message;
    private final String detail;

    public AnalysisWarning(WarningCode code, String file, int statementIndex, String message, String detail) {
        this.code = code == null ? WarningCode.TRANSFORM_ERROR : code;
        this.file = nullToEmpty(file);
        this.statementIndex = statementIndex;
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static AnalysisWarning of(WarningCode code, String file, int statementIndex, String message) {
        return new AnalysisWarning(code, file, statementIndex, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getFile() {
        return file;
    }

    /** 1-based statement number inside the file, 0 for file-level warnings. */
    public int getStatementIndex() {
        return statementIndex;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }
}
