package domain.sql;

/**
 * Parses one statement kind, starting at its leading keyword.
 */
@FunctionalInterface
interface StatementParser {

    SqlStatement parse(SqlParser parser);
}
