package domain.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Eager SQL lexer. Whitespace and comments are dropped; everything else becomes a {@link SqlToken}.
 */
final class SqlTokenizer {

    static final Set<String> KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "GROUP", "BY", "HAVING", "ORDER", "LIMIT", "OFFSET",
            "UNION", "ALL", "DISTINCT", "INSERT", "INTO", "VALUES", "RETURNING", "OUTPUT",
            "UPDATE", "SET", "DELETE", "WITH", "RECURSIVE", "AS", "ON", "JOIN", "INNER",
            "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "USING", "INTERSECT", "EXCEPT",
            "AND", "OR", "NOT", "CASE", "WHEN", "THEN", "ELSE", "END", "IS", "NULL", "IN",
            "EXISTS", "LIKE", "BETWEEN", "ASC", "DESC"
    );

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(">=", "<=", "<>", "!=", "::");

    private final SqlScan scan;
    private final SqlSyntaxOptions syntaxOptions;

    SqlTokenizer(String sql, SqlSyntaxOptions syntaxOptions) {
        this.scan = new SqlScan(sql);
        this.syntaxOptions = (syntaxOptions == null) ? SqlSyntaxOptions.DEFAULT : syntaxOptions;
    }

    static List<SqlToken> tokenize(String sql, SqlSyntaxOptions syntaxOptions) {
        return new SqlTokenizer(sql, syntaxOptions).tokenize();
    }

    List<SqlToken> tokenize() {
        List<SqlToken> out = new ArrayList<>(Math.max(16, scan.s.length() / 4));

        while (scan.hasNext()) {
            char c = scan.peek();

            if (Character.isWhitespace(c)) {
                scan.readSpaces();
                continue;
            }
            if (scan.peekIsLineComment()) {
                scan.readLineComment();
                continue;
            }
            if (scan.peekIsBlockComment()) {
                scan.readBlockComment();
                continue;
            }

            int start = scan.pos;

            if (c == '\'') {
                out.add(SqlToken.literal(scan.readQuoted(), start));
                continue;
            }
            if (c == '"') {
                out.add(SqlToken.identifier(scan.readQuoted(), start));
                continue;
            }
            if (scan.peekIsBracket()) {
                out.add(SqlToken.identifier(scan.readBracketed(), start));
                continue;
            }
            if (isIdentifierStart(c)) {
                out.add(word(readWord(), start));
                continue;
            }
            if (Character.isDigit(c)) {
                out.add(SqlToken.literal(readNumber(), start));
                continue;
            }

            String pair = "" + c + scan.peekAt(1);
            if (TWO_CHAR_OPERATORS.contains(pair)) {
                scan.pos += 2;
                out.add(SqlToken.symbol(pair, start));
                continue;
            }

            scan.read();
            out.add(SqlToken.symbol(String.valueOf(c), start));
        }
        return out;
    }

    /** True when an unterminated string, bracket or block comment was consumed to end of input. */
    boolean isTruncated() {
        return scan.truncated;
    }

    private static SqlToken word(String text, int start) {
        String upper = text.toUpperCase(Locale.ROOT);
        if (KEYWORDS.contains(upper)) return SqlToken.keyword(text, upper, start);
        return SqlToken.identifier(text, start);
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$' || syntaxOptions.isIdentifierPrefix(c);
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || syntaxOptions.isIdentifierPrefix(c);
    }

    private String readWord() {
        int start = scan.pos;
        scan.pos++;
        while (scan.hasNext() && isIdentifierPart(scan.peek())) scan.pos++;
        return scan.s.substring(start, scan.pos);
    }

    private String readNumber() {
        int start = scan.pos;
        while (scan.hasNext() && (Character.isDigit(scan.peek()) || scan.peek() == '.')) scan.pos++;
        return scan.s.substring(start, scan.pos);
    }
}
