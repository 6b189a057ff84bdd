package domain.model;

/**
 * Warning codes written to the {@code warnings} sheet.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for operators.</p>
 */
public enum WarningCode {

    /**
     * Input directory is missing; nothing was analyzed.
     */
    SQLS_DIR_MISSING,

    /**
     * SQL file is empty (or holds only comments) and is skipped.
     */
    SQL_TEXT_EMPTY,

    /**
     * A select/output item got an alias without AS. The heuristic also fires on
     * expressions such as {@code a + b}, so review these.
     */
    IMPLICIT_ALIAS,

    /**
     * Statement ends inside a string, quoted identifier or block comment.
     */
    UNTERMINATED_LITERAL,

    /**
     * Statement could not be parsed.
     */
    PARSE_ERROR,

    /**
     * Processing failed with an unexpected exception.
     */
    TRANSFORM_ERROR,

    /**
     * Processing time exceeded the configured slow threshold.
     */
    SLOW_SQL
}
