package domain.sql;

import static domain.sql.ClauseStart.FROM;
import static domain.sql.ClauseStart.OUTPUT;
import static domain.sql.ClauseStart.RETURNING;
import static domain.sql.ClauseStart.STATEMENT_END;
import static domain.sql.ClauseStart.USING;
import static domain.sql.ClauseStart.WHERE;

final class DeleteStatementParser implements StatementParser {

    @Override
    public SqlStatement parse(SqlParser parser) {
        parser.expectKeyword("DELETE");

        SqlSegment target = null;
        if (!parser.checkKeyword("FROM")) {
            target = parser.readSpanSegment(SqlSegment.TARGET, "DELETE", FROM, STATEMENT_END);
        }

        parser.expectKeyword("FROM");
        SqlSegment from = parser.readTableSegment(SqlSegment.FROM, OUTPUT, USING, WHERE, RETURNING, STATEMENT_END);
        SqlDeleteStatement st = new SqlDeleteStatement(parser.getSyntaxOptions(), target, from);

        if (parser.tryConsumeKeyword("OUTPUT")) {
            st.setOutput(parser.readListSegment(SqlSegment.OUTPUT, true, USING, WHERE, RETURNING, STATEMENT_END));
        }
        if (parser.tryConsumeKeyword("USING")) {
            st.setUsing(parser.readTableSegment(SqlSegment.USING, WHERE, RETURNING, STATEMENT_END));
        }
        if (parser.tryConsumeKeyword("WHERE")) {
            st.setWhere(parser.readSpanSegment(SqlSegment.WHERE, "WHERE", RETURNING, STATEMENT_END));
        }
        if (parser.tryConsumeKeyword("RETURNING")) {
            st.setReturning(parser.readListSegment(SqlSegment.RETURNING, false, STATEMENT_END));
        }
        return st;
    }
}
