package domain.sql;

import java.util.List;
import java.util.Objects;

/**
 * A parenthesized statement inside a segment. Renders as {@code (} + nested SQL + {@code )}.
 */
public final class SqlSubqueryPart implements SqlSegmentPart {

    private final SqlStatement statement;

    SqlSubqueryPart(SqlStatement statement) {
        this.statement = Objects.requireNonNull(statement, "statement");
    }

    public SqlStatement getStatement() {
        return statement;
    }

    @Override
    public void appendTokens(List<String> out) {
        out.add("(");
        out.add(statement.toSql());
        out.add(")");
    }

    @Override
    public String toString() {
        return "(" + statement.toSql() + ")";
    }
}
