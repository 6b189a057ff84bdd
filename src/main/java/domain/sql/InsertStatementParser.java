package domain.sql;

import static domain.sql.ClauseStart.OUTPUT;
import static domain.sql.ClauseStart.RETURNING;
import static domain.sql.ClauseStart.SELECT;
import static domain.sql.ClauseStart.STATEMENT_END;
import static domain.sql.ClauseStart.VALUES;

final class InsertStatementParser implements StatementParser {

    @Override
    public SqlStatement parse(SqlParser parser) {
        parser.expectKeyword("INSERT");
        parser.expectKeyword("INTO");

        SqlSegment target = parser.readSpanSegment(SqlSegment.TARGET, "INTO",
                OUTPUT, VALUES, SELECT, RETURNING, STATEMENT_END);
        SqlInsertStatement st = new SqlInsertStatement(parser.getSyntaxOptions(), target);

        if (parser.tryConsumeKeyword("OUTPUT")) {
            st.setOutput(parser.readListSegment(SqlSegment.OUTPUT, true, VALUES, SELECT, RETURNING, STATEMENT_END));
        }

        if (parser.tryConsumeKeyword("VALUES")) {
            st.setValues(parser.readSpanSegment(SqlSegment.VALUES, "VALUES", RETURNING, STATEMENT_END));
        } else if (parser.isClauseStart(SELECT)) {
            // parsed in place: the query shares this token stream
            st.setSourceQuery(parser.parseStatement());
        } else {
            throw parser.error("Expected VALUES or SELECT clause in INSERT statement.");
        }

        if (parser.tryConsumeKeyword("RETURNING")) {
            st.setReturning(parser.readListSegment(SqlSegment.RETURNING, false, STATEMENT_END));
        }
        return st;
    }
}
