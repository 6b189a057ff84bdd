package domain.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code INSERT INTO target [OUTPUT ...] (VALUES ... | query) [RETURNING ...]}.
 * Exactly one of VALUES and the source query is present after parsing.
 */
public final class SqlInsertStatement extends SqlStatement {

    private final SqlSegment target;
    private SqlSegment output;
    private SqlSegment values;
    private SqlStatement sourceQuery;
    private SqlSegment returning;

    SqlInsertStatement(SqlSyntaxOptions syntaxOptions, SqlSegment target) {
        super(syntaxOptions);
        this.target = Objects.requireNonNull(target, "target");
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.INSERT;
    }

    @Override
    public List<SqlSegment> getSegments() {
        return present(target, output, values, returning);
    }

    /** The source query sits between OUTPUT and RETURNING in the text. */
    @Override
    List<SqlStatement> nestedStatements() {
        List<SqlStatement> out = new ArrayList<>();
        for (SqlSegment seg : present(target, output, values)) out.addAll(seg.getSubqueries());
        if (sourceQuery != null) out.add(sourceQuery);
        if (returning != null) out.addAll(returning.getSubqueries());
        return out;
    }

    @Override
    void appendBody(StringBuilder sb) {
        sb.append("INSERT INTO ").append(target.toSql());
        appendClause(sb, "OUTPUT", output);
        if (hasContent(values)) {
            sb.append(" VALUES ").append(values.toSql());
        } else if (sourceQuery != null) {
            sb.append(' ').append(sourceQuery.toSql());
        }
        appendClause(sb, "RETURNING", returning);
    }

    public SqlSegment getTarget() {
        return target;
    }

    public SqlSegment getOutput() {
        return output;
    }

    public SqlSegment getValues() {
        return values;
    }

    /** The {@code SELECT} (or {@code WITH ... SELECT}) feeding the insert, or {@code null}. */
    public SqlStatement getSourceQuery() {
        return sourceQuery;
    }

    public SqlSegment getReturning() {
        return returning;
    }

    public SqlSegment ensureOutputSegment() {
        if (output == null) output = newSegment(SqlSegment.OUTPUT);
        return output;
    }

    /**
     * @throws IllegalStateException when the insert is fed by a query
     */
    public SqlSegment ensureValuesSegment() {
        if (sourceQuery != null) {
            throw new IllegalStateException("INSERT is fed by a query; a VALUES segment cannot be added");
        }
        if (values == null) values = newSegment(SqlSegment.VALUES);
        return values;
    }

    public SqlSegment ensureReturningSegment() {
        if (returning == null) returning = newSegment(SqlSegment.RETURNING);
        return returning;
    }

    void setOutput(SqlSegment output) {
        this.output = output;
    }

    void setValues(SqlSegment values) {
        this.values = values;
    }

    void setSourceQuery(SqlStatement sourceQuery) {
        this.sourceQuery = sourceQuery;
    }

    void setReturning(SqlSegment returning) {
        this.returning = returning;
    }
}
