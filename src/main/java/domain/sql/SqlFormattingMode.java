package domain.sql;

public enum SqlFormattingMode {

    /** Single line, exactly the canonical SQL. */
    INLINE,

    /** One list item per line; continuation lines start with the comma. */
    PREFIXED,

    /** One list item per line; the comma ends the previous line. */
    SUFFIXED
}
