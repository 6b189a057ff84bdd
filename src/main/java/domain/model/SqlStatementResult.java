package domain.model;

/**
 * One analyzed statement, as a row of the {@code result} sheet.
 *
 * <p>Plain value object, not tied to POI, so other front ends can reuse it.</p>
 */
public final class SqlStatementResult {

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILED = "FAILED";

    private final String file;
    private final int index;
    private final String status;

    /**
     * root statement kind (SELECT/INSERT/UPDATE/DELETE); empty when parsing failed
     */
    private final String kind;

    /**
     * root plus every nested statement
     */
    private final int statementCount;
    private final long elapsedMs;
    private final String message;

    /**
     * formatted SQL; null when parsing failed
     */
    private final String formattedSql;

    public SqlStatementResult(
            String file,
            int index,
            String status,
            String kind,
            int statementCount,
            long elapsedMs,
            String message,
            String formattedSql
    ) {
        this.file = nullToEmpty(file);
        this.index = index;
        this.status = nullToEmpty(status);
        this.kind = nullToEmpty(kind);
        this.statementCount = statementCount;
        this.elapsedMs = elapsedMs;
        this.message = nullToEmpty(message);
        this.formattedSql = formattedSql;
    }

    public static SqlStatementResult success(String file, int index, String kind, int statementCount,
                                             long elapsedMs, String formattedSql) {
        return new SqlStatementResult(file, index, STATUS_SUCCESS, kind, statementCount, elapsedMs, "", formattedSql);
    }

    public static SqlStatementResult failed(String file, int index, long elapsedMs, String message) {
        return new SqlStatementResult(file, index, STATUS_FAILED, "", 0, elapsedMs, message, null);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }

    public String getFile() {
        return file;
    }

    public int getIndex() {
        return index;
    }

    public String getStatus() {
        return status;
    }

    public String getKind() {
        return kind;
    }

    public int getStatementCount() {
        return statementCount;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public String getMessage() {
        return message;
    }

    public String getFormattedSql() {
        return formattedSql;
    }
}
