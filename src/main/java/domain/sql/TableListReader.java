package domain.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a FROM / USING table list: sources separated by top-level commas, each source with any
 * number of joins. Every {@code JOIN} (other than {@code CROSS JOIN}) needs its own {@code ON}
 * before the source may end.
 */
final class TableListReader {

    private final SqlParser parser;

    TableListReader(SqlParser parser) {
        this.parser = parser;
    }

    List<SqlToken> read(ClauseStart... terminators) {
        List<SqlToken> all = new ArrayList<>();
        while (true) {
            List<SqlToken> source = readSource(terminators);
            if (source.isEmpty()) throw parser.error("Expected table but none was found.");
            all.addAll(source);

            if (parser.isAtEnd() || parser.isClauseStart(terminators)) break;
            if (parser.checkSymbol(",")) {
                all.add(parser.read());
                continue;
            }
            if (parser.checkSymbol(")") || parser.checkSymbol(";")) break;
            throw parser.error("Unexpected token '" + parser.peek().getText() + "' while reading table list.");
        }
        return all;
    }

    private List<SqlToken> readSource(ClauseStart... terminators) {
        List<SqlToken> tokens = new ArrayList<>();
        int depth = 0;
        int joins = 0;
        int ons = 0;
        SqlToken prev = null;

        while (!parser.isAtEnd()) {
            SqlToken t = parser.peek();
            if (depth == 0) {
                if (t.isSymbol(";") || t.isSymbol(")")) break;
                // an open JOIN keeps consuming past commas and clause keywords until its ON shows up
                if (ons >= joins && (t.isSymbol(",") || parser.isClauseStart(terminators))) break;
            }

            if (t.isSymbol("(")) {
                depth++;
            } else if (t.isSymbol(")")) {
                depth--;
            } else if (depth == 0 && t.isKeyword("JOIN")) {
                if (prev == null || !prev.isKeyword("CROSS")) joins++;
            } else if (depth == 0 && t.isKeyword("ON")) {
                ons++;
            }
            prev = t;
            tokens.add(parser.read());
        }

        if (ons < joins) throw parser.error("Missing ON clause for one or more JOIN operations.");
        return tokens;
    }
}
