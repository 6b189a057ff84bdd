package domain.sql;

/**
 * Raised when SQL text cannot be parsed. Parsing never returns a partial tree.
 */
public class SqlParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public SqlParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    /** Character offset of the offending token, or -1 when unknown. */
    public int getPosition() {
        return position;
    }
}
