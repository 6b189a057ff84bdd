package domain.sql;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code name [(col, ...)] AS (statement)}.
 */
public final class CteDefinition {

    private final String name;
    private final List<String> columns;
    private final SqlStatement statement;

    CteDefinition(String name, List<String> columns, SqlStatement statement) {
        this.name = Objects.requireNonNull(name, "name");
        this.columns = (columns == null) ? List.of() : Collections.unmodifiableList(columns);
        this.statement = Objects.requireNonNull(statement, "statement");
    }

    public String getName() {
        return name;
    }

    /** Declared column names; empty when the CTE has no column list. */
    public List<String> getColumns() {
        return columns;
    }

    public SqlStatement getStatement() {
        return statement;
    }

    public String toSql() {
        StringBuilder sb = new StringBuilder(name);
        if (!columns.isEmpty()) sb.append('(').append(String.join(", ", columns)).append(')');
        sb.append(" AS (").append(statement.toSql()).append(')');
        return sb.toString();
    }
}
