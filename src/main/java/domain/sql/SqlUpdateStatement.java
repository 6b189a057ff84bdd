package domain.sql;

import java.util.List;
import java.util.Objects;

public final class SqlUpdateStatement extends SqlStatement {

    private final SqlSegment target;
    private final SqlSegment set;
    private SqlSegment output;
    private SqlSegment from;
    private SqlSegment where;
    private SqlSegment returning;

    SqlUpdateStatement(SqlSyntaxOptions syntaxOptions, SqlSegment target, SqlSegment set) {
        super(syntaxOptions);
        this.target = Objects.requireNonNull(target, "target");
        this.set = Objects.requireNonNull(set, "set");
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.UPDATE;
    }

    @Override
    public List<SqlSegment> getSegments() {
        return present(target, set, output, from, where, returning);
    }

    @Override
    void appendBody(StringBuilder sb) {
        sb.append("UPDATE ").append(target.toSql());
        sb.append(" SET ").append(set.toSql());
        appendClause(sb, "OUTPUT", output);
        appendClause(sb, "FROM", from);
        appendClause(sb, "WHERE", where);
        appendClause(sb, "RETURNING", returning);
    }

    public SqlSegment getTarget() {
        return target;
    }

    public SqlSegment getSet() {
        return set;
    }

    public SqlSegment getOutput() {
        return output;
    }

    public SqlSegment getFrom() {
        return from;
    }

    public SqlSegment getWhere() {
        return where;
    }

    public SqlSegment getReturning() {
        return returning;
    }

    public SqlSegment ensureOutputSegment() {
        if (output == null) output = newSegment(SqlSegment.OUTPUT);
        return output;
    }

    public SqlSegment ensureFromSegment() {
        if (from == null) from = newSegment(SqlSegment.FROM);
        return from;
    }

    public SqlSegment ensureWhereSegment() {
        if (where == null) where = newSegment(SqlSegment.WHERE);
        return where;
    }

    public SqlSegment ensureReturningSegment() {
        if (returning == null) returning = newSegment(SqlSegment.RETURNING);
        return returning;
    }

    void setOutput(SqlSegment output) {
        this.output = output;
    }

    void setFrom(SqlSegment from) {
        this.from = from;
    }

    void setWhere(SqlSegment where) {
        this.where = where;
    }

    void setReturning(SqlSegment returning) {
        this.returning = returning;
    }
}
