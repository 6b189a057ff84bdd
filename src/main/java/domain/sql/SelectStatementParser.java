package domain.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code SELECT [DISTINCT] list [FROM] [WHERE] [GROUP BY] [HAVING] [ORDER BY] [LIMIT] [OFFSET]
 * [UNION|EXCEPT|INTERSECT ...]}.
 */
final class SelectStatementParser implements StatementParser {

    /** Optional clauses in grammar order; each one may be terminated by any that follows it. */
    private static final ClauseStart[] CLAUSE_ORDER = {
            ClauseStart.FROM, ClauseStart.WHERE, ClauseStart.GROUP_BY, ClauseStart.HAVING,
            ClauseStart.ORDER_BY, ClauseStart.LIMIT, ClauseStart.OFFSET
    };

    private static final ClauseStart[] ALWAYS_TERMINATES = {
            ClauseStart.RETURNING, ClauseStart.SET_OPERATOR, ClauseStart.STATEMENT_END
    };

    @Override
    public SqlStatement parse(SqlParser parser) {
        parser.expectKeyword("SELECT");
        boolean distinct = parser.tryConsumeKeyword("DISTINCT");

        SqlSegment select = parser.readListSegment(SqlSegment.SELECT, true, terminatorsAfter(null));
        SqlSelectStatement st = new SqlSelectStatement(parser.getSyntaxOptions(), select);
        st.setDistinct(distinct);

        if (parser.tryConsumeKeyword("FROM")) {
            st.setFrom(parser.readTableSegment(SqlSegment.FROM, terminatorsAfter(ClauseStart.FROM)));
        }
        if (parser.tryConsumeKeyword("WHERE")) {
            st.setWhere(parser.readSpanSegment(SqlSegment.WHERE, "WHERE", terminatorsAfter(ClauseStart.WHERE)));
        }
        if (parser.tryConsumeKeywords("GROUP", "BY")) {
            st.setGroupBy(parser.readListSegment(SqlSegment.GROUP_BY, false, terminatorsAfter(ClauseStart.GROUP_BY)));
        }
        if (parser.tryConsumeKeyword("HAVING")) {
            st.setHaving(parser.readSpanSegment(SqlSegment.HAVING, "HAVING", terminatorsAfter(ClauseStart.HAVING)));
        }
        if (parser.tryConsumeKeywords("ORDER", "BY")) {
            st.setOrderBy(parser.readListSegment(SqlSegment.ORDER_BY, false, terminatorsAfter(ClauseStart.ORDER_BY)));
        }
        if (parser.tryConsumeKeyword("LIMIT")) {
            st.setLimit(parser.readSpanSegment(SqlSegment.LIMIT, "LIMIT", terminatorsAfter(ClauseStart.LIMIT)));
        }
        if (parser.tryConsumeKeyword("OFFSET")) {
            st.setOffset(parser.readSpanSegment(SqlSegment.OFFSET, "OFFSET", terminatorsAfter(ClauseStart.OFFSET)));
        }

        if (parser.isClauseStart(ClauseStart.SET_OPERATOR)) {
            List<SqlToken> tail = new ArrayList<>();
            tail.add(parser.read());
            tail.addAll(parser.readSectionTokens(ClauseStart.STATEMENT_END));
            st.setTail(parser.buildSegment(SqlSegment.TAIL, tail));
        }
        return st;
    }

    /** Clauses after {@code clause} (all of them for {@code null}) plus the unconditional terminators. */
    private static ClauseStart[] terminatorsAfter(ClauseStart clause) {
        List<ClauseStart> out = new ArrayList<>();
        boolean after = (clause == null);
        for (ClauseStart c : CLAUSE_ORDER) {
            if (after) out.add(c);
            if (c == clause) after = true;
        }
        out.addAll(List.of(ALWAYS_TERMINATES));
        return out.toArray(new ClauseStart[0]);
    }
}
