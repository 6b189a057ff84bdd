package domain.sql;

import static domain.sql.ClauseStart.FROM;
import static domain.sql.ClauseStart.OUTPUT;
import static domain.sql.ClauseStart.RETURNING;
import static domain.sql.ClauseStart.SET;
import static domain.sql.ClauseStart.STATEMENT_END;
import static domain.sql.ClauseStart.WHERE;

final class UpdateStatementParser implements StatementParser {

    @Override
    public SqlStatement parse(SqlParser parser) {
        parser.expectKeyword("UPDATE");
        SqlSegment target = parser.readSpanSegment(SqlSegment.TARGET, "UPDATE", SET, STATEMENT_END);

        parser.expectKeyword("SET");
        SqlSegment set = parser.readSpanSegment(SqlSegment.SET, "SET", OUTPUT, FROM, WHERE, RETURNING, STATEMENT_END);

        SqlUpdateStatement st = new SqlUpdateStatement(parser.getSyntaxOptions(), target, set);

        if (parser.tryConsumeKeyword("OUTPUT")) {
            st.setOutput(parser.readListSegment(SqlSegment.OUTPUT, true, FROM, WHERE, RETURNING, STATEMENT_END));
        }
        if (parser.tryConsumeKeyword("FROM")) {
            st.setFrom(parser.readTableSegment(SqlSegment.FROM, WHERE, RETURNING, STATEMENT_END));
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
