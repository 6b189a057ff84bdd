package domain.sql;

import java.util.List;
import java.util.Objects;

/**
 * {@code DELETE [target] FROM ... [OUTPUT ...] [USING ...] [WHERE ...] [RETURNING ...]}.
 */
public final class SqlDeleteStatement extends SqlStatement {

    private SqlSegment target;
    private final SqlSegment from;
    private SqlSegment output;
    private SqlSegment using;
    private SqlSegment where;
    private SqlSegment returning;

    SqlDeleteStatement(SqlSyntaxOptions syntaxOptions, SqlSegment target, SqlSegment from) {
        super(syntaxOptions);
        this.target = target;
        this.from = Objects.requireNonNull(from, "from");
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.DELETE;
    }

    @Override
    public List<SqlSegment> getSegments() {
        return present(target, from, output, using, where, returning);
    }

    @Override
    void appendBody(StringBuilder sb) {
        sb.append("DELETE");
        if (hasContent(target)) sb.append(' ').append(target.toSql());
        sb.append(" FROM ").append(from.toSql());
        appendClause(sb, "OUTPUT", output);
        appendClause(sb, "USING", using);
        appendClause(sb, "WHERE", where);
        appendClause(sb, "RETURNING", returning);
    }

    /** Alias or table named between DELETE and FROM, or {@code null}. */
    public SqlSegment getTarget() {
        return target;
    }

    public SqlSegment getFrom() {
        return from;
    }

    public SqlSegment getOutput() {
        return output;
    }

    public SqlSegment getUsing() {
        return using;
    }

    public SqlSegment getWhere() {
        return where;
    }

    public SqlSegment getReturning() {
        return returning;
    }

    public SqlSegment ensureTargetSegment() {
        if (target == null) target = newSegment(SqlSegment.TARGET);
        return target;
    }

    public SqlSegment ensureOutputSegment() {
        if (output == null) output = newSegment(SqlSegment.OUTPUT);
        return output;
    }

    public SqlSegment ensureUsingSegment() {
        if (using == null) using = newSegment(SqlSegment.USING);
        return using;
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

    void setUsing(SqlSegment using) {
        this.using = using;
    }

    void setWhere(SqlSegment where) {
        this.where = where;
    }

    void setReturning(SqlSegment returning) {
        this.returning = returning;
    }
}
