package domain.sql;

import java.util.List;

public final class SqlSelectStatement extends SqlStatement {

    private boolean distinct;
    private final SqlSegment select;
    private SqlSegment from;
    private SqlSegment where;
    private SqlSegment groupBy;
    private SqlSegment having;
    private SqlSegment orderBy;
    private SqlSegment limit;
    private SqlSegment offset;
    private SqlSegment tail;

    SqlSelectStatement(SqlSyntaxOptions syntaxOptions, SqlSegment select) {
        super(syntaxOptions);
        this.select = (select == null) ? newSegment(SqlSegment.SELECT) : select;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.SELECT;
    }

    @Override
    public List<SqlSegment> getSegments() {
        return present(select, from, where, groupBy, having, orderBy, limit, offset, tail);
    }

    @Override
    void appendBody(StringBuilder sb) {
        sb.append("SELECT");
        if (distinct) sb.append(" DISTINCT");
        sb.append(' ').append(select.toSql());
        appendClause(sb, "FROM", from);
        appendClause(sb, "WHERE", where);
        appendClause(sb, "GROUP BY", groupBy);
        appendClause(sb, "HAVING", having);
        appendClause(sb, "ORDER BY", orderBy);
        appendClause(sb, "LIMIT", limit);
        appendClause(sb, "OFFSET", offset);
        // tail carries its own UNION / EXCEPT / INTERSECT keyword
        if (hasContent(tail)) sb.append(' ').append(tail.toSql());
    }

    public boolean isDistinct() {
        return distinct;
    }

    public void setDistinct(boolean distinct) {
        this.distinct = distinct;
    }

    public SqlSegment getSelect() {
        return select;
    }

    public SqlSegment getFrom() {
        return from;
    }

    public SqlSegment getWhere() {
        return where;
    }

    public SqlSegment getGroupBy() {
        return groupBy;
    }

    public SqlSegment getHaving() {
        return having;
    }

    public SqlSegment getOrderBy() {
        return orderBy;
    }

    public SqlSegment getLimit() {
        return limit;
    }

    public SqlSegment getOffset() {
        return offset;
    }

    /** Trailing set operation ({@code UNION ...}), kept as raw parts. */
    public SqlSegment getTail() {
        return tail;
    }

    public SqlSegment ensureFromSegment() {
        if (from == null) from = newSegment(SqlSegment.FROM);
        return from;
    }

    public SqlSegment ensureWhereSegment() {
        if (where == null) where = newSegment(SqlSegment.WHERE);
        return where;
    }

    public SqlSegment ensureGroupBySegment() {
        if (groupBy == null) groupBy = newSegment(SqlSegment.GROUP_BY);
        return groupBy;
    }

    public SqlSegment ensureHavingSegment() {
        if (having == null) having = newSegment(SqlSegment.HAVING);
        return having;
    }

    public SqlSegment ensureOrderBySegment() {
        if (orderBy == null) orderBy = newSegment(SqlSegment.ORDER_BY);
        return orderBy;
    }

    public SqlSegment ensureLimitSegment() {
        if (limit == null) limit = newSegment(SqlSegment.LIMIT);
        return limit;
    }

    public SqlSegment ensureOffsetSegment() {
        if (offset == null) offset = newSegment(SqlSegment.OFFSET);
        return offset;
    }

    public SqlSegment ensureTailSegment() {
        if (tail == null) tail = newSegment(SqlSegment.TAIL);
        return tail;
    }

    void setFrom(SqlSegment from) {
        this.from = from;
    }

    void setWhere(SqlSegment where) {
        this.where = where;
    }

    void setGroupBy(SqlSegment groupBy) {
        this.groupBy = groupBy;
    }

    void setHaving(SqlSegment having) {
        this.having = having;
    }

    void setOrderBy(SqlSegment orderBy) {
        this.orderBy = orderBy;
    }

    void setLimit(SqlSegment limit) {
        this.limit = limit;
    }

    void setOffset(SqlSegment offset) {
        this.offset = offset;
    }

    void setTail(SqlSegment tail) {
        this.tail = tail;
    }
}
