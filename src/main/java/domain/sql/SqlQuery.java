package domain.sql;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link SqlQueryAnalyzer#parse(String)}: the root statement plus the options it was
 * parsed with.
 */
public final class SqlQuery {

    private final SqlStatement rootStatement;
    private final SqlSyntaxOptions syntaxOptions;
    private final boolean truncatedInput;

    SqlQuery(SqlStatement rootStatement, SqlSyntaxOptions syntaxOptions, boolean truncatedInput) {
        this.rootStatement = Objects.requireNonNull(rootStatement, "rootStatement");
        this.syntaxOptions = Objects.requireNonNull(syntaxOptions, "syntaxOptions");
        this.truncatedInput = truncatedInput;
    }

    public SqlStatement getRootStatement() {
        return rootStatement;
    }

    public SqlSyntaxOptions getSyntaxOptions() {
        return syntaxOptions;
    }

    /**
     * True when the input ended inside a string literal, quoted identifier, bracket identifier
     * or block comment. The open construct was taken to run to the end of the text.
     */
    public boolean isTruncatedInput() {
        return truncatedInput;
    }

    /** Root first, then every nested statement depth-first. Rebuilt on each call. */
    public List<SqlStatement> getAllStatements() {
        return rootStatement.getAllStatements();
    }

    public String toSql() {
        return rootStatement.toSql();
    }

    public String toSql(SqlFormattingOptions options) {
        return rootStatement.toSql(options);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
