package domain.sql;

/**
 * Clause boundaries the parser can look ahead for.
 */
enum ClauseStart {
    SELECT,
    FROM,
    WHERE,
    GROUP_BY,
    HAVING,
    ORDER_BY,
    LIMIT,
    OFFSET,
    INTO,
    VALUES,
    OUTPUT,
    RETURNING,
    USING,
    SET,
    UPDATE,
    DELETE,
    /** UNION / EXCEPT / INTERSECT. */
    SET_OPERATOR,
    /** End of input or {@code ;}. Has no keyword sequence. */
    STATEMENT_END
}
