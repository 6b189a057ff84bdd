package domain.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a comma-separated expression list and returns its tokens, commas included.
 * Items end at a top-level comma (outside parentheses and CASE ... END), at an unmatched
 * {@code )}, or where a terminator clause starts.
 */
final class ExpressionListReader {

    private final SqlParser parser;

    ExpressionListReader(SqlParser parser) {
        this.parser = parser;
    }

    List<SqlToken> read(boolean allowAlias, ClauseStart... terminators) {
        List<SqlToken> all = new ArrayList<>();
        while (true) {
            List<SqlToken> item = readExpression(terminators);
            if (item.isEmpty()) throw parser.error("Expected expression but none was found.");
            if (allowAlias) validateAlias(item);
            all.addAll(item);

            if (!parser.checkSymbol(",")) break;
            all.add(parser.read());
        }
        return all;
    }

    private List<SqlToken> readExpression(ClauseStart... terminators) {
        List<SqlToken> tokens = new ArrayList<>();
        int depth = 0;
        int caseDepth = 0;

        while (!parser.isAtEnd()) {
            SqlToken t = parser.peek();
            if (depth == 0 && caseDepth == 0) {
                if (t.isSymbol(",") || t.isSymbol(")")) break;
                if (parser.isClauseStart(terminators)) break;
            }

            if (t.isSymbol("(")) depth++;
            else if (t.isSymbol(")") && depth > 0) depth--;
            else if (t.isKeyword("CASE")) caseDepth++;
            else if (t.isKeyword("END") && caseDepth > 0) caseDepth--;
            tokens.add(parser.read());
        }
        return tokens;
    }

    private void validateAlias(List<SqlToken> item) {
        int n = item.size();
        SqlToken last = item.get(n - 1);
        if (last.isKeyword("AS")) {
            throw parser.error("Expected identifier after AS but found "
                    + (parser.isAtEnd() ? "end of input" : "'" + parser.peek().getText() + "'") + ".");
        }
        if (n >= 2 && item.get(n - 2).isKeyword("AS")) {
            if (!last.isIdentifier()) {
                throw parser.error("Expected identifier after AS but found '" + last.getText() + "'.", last);
            }
            if (n == 2) throw parser.error("Expression cannot be reduced to an alias only.", item.get(0));
        }
    }
}
