package domain.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser over a token list.
 *
 * <p>Clause bodies are read as token spans bounded by the next clause keyword of the grammar,
 * by {@code ;} or by an unmatched {@code )}, all at parenthesis depth 0. Parenthesized
 * statements inside a span are handed to a child parser over the enclosed tokens, which counts
 * against the nesting limit.</p>
 */
final class SqlParser {

    private static final Map<String, StatementParser> STATEMENT_PARSERS = Map.of(
            "SELECT", new SelectStatementParser(),
            "INSERT", new InsertStatementParser(),
            "UPDATE", new UpdateStatementParser(),
            "DELETE", new DeleteStatementParser()
    );

    private static final Set<String> SUBQUERY_LEADS = Set.of("SELECT", "INSERT", "UPDATE", "DELETE", "WITH");

    private final List<SqlToken> tokens;
    private final SqlSyntaxOptions syntaxOptions;
    private final int depth;
    private final int maxDepth;
    private int position;

    SqlParser(List<SqlToken> tokens, SqlSyntaxOptions syntaxOptions, int maxDepth) {
        this(tokens, syntaxOptions, 0, maxDepth);
    }

    private SqlParser(List<SqlToken> tokens, SqlSyntaxOptions syntaxOptions, int depth, int maxDepth) {
        this.tokens = tokens;
        this.syntaxOptions = syntaxOptions;
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    /**
     * Tokenizes a fragment and lowers it into segment parts (used by the segment mutation API).
     */
    static List<SqlSegmentPart> lowerFragment(String sql, SqlSyntaxOptions syntaxOptions) {
        List<SqlToken> fragment = SqlTokenizer.tokenize(sql, syntaxOptions);
        return new SqlParser(fragment, syntaxOptions, SqlQueryAnalyzer.defaultMaxDepth()).buildParts(fragment);
    }

    SqlSyntaxOptions getSyntaxOptions() {
        return syntaxOptions;
    }

    // ------------------------------------------------------------
    // statements
    // ------------------------------------------------------------

    /** Statement, optional trailing semicolons, then end of input. */
    SqlStatement parseComplete() {
        SqlStatement statement = parseStatement();
        consumeOptionalTerminator();
        ensureEndOfInput();
        return statement;
    }

    /** Optional WITH clause followed by one statement. */
    SqlStatement parseStatement() {
        WithClause with = null;
        if (tryConsumeKeyword("WITH")) with = parseWithClause();

        if (isAtEnd()) throw error("Unexpected end of input while expecting a statement.");

        SqlToken lead = peek();
        StatementParser parser = lead.isKeyword() ? STATEMENT_PARSERS.get(lead.getNormalized()) : null;
        if (parser == null) {
            throw error("Unsupported statement starting with '" + lead.getText() + "'.");
        }

        SqlStatement statement = parser.parse(this);
        if (with != null) statement.setWithClause(with);
        return statement;
    }

    private WithClause parseWithClause() {
        boolean recursive = tryConsumeKeyword("RECURSIVE");
        List<CteDefinition> definitions = new ArrayList<>();

        do {
            String name = expectIdentifier().getText();
            List<String> columns = List.of();
            if (tryConsumeSymbol("(")) {
                columns = parseColumnList();
                expectSymbol(")");
            }
            expectKeyword("AS");
            expectSymbol("(");

            List<SqlToken> body = readTokensUntilMatchingParenthesis();
            definitions.add(new CteDefinition(name, columns, child(body).parseComplete()));
        } while (tryConsumeSymbol(","));

        return new WithClause(recursive, definitions);
    }

    private List<String> parseColumnList() {
        List<String> columns = new ArrayList<>();
        do {
            columns.add(expectIdentifier().getText());
        } while (tryConsumeSymbol(","));
        return columns;
    }

    /** Reads past the {@code )} matching an already consumed {@code (}, returning the enclosed tokens. */
    private List<SqlToken> readTokensUntilMatchingParenthesis() {
        int start = position;
        int d = 1;
        while (!isAtEnd()) {
            SqlToken t = read();
            if (t.isSymbol("(")) {
                d++;
            } else if (t.isSymbol(")")) {
                d--;
                if (d == 0) return new ArrayList<>(tokens.subList(start, position - 1));
            }
        }
        throw error("Unterminated parenthesis in WITH clause definition.");
    }

    private SqlParser child(List<SqlToken> nested) {
        if (depth + 1 > maxDepth) {
            throw error("Maximum nesting depth of " + maxDepth + " exceeded.");
        }
        return new SqlParser(nested, syntaxOptions, depth + 1, maxDepth);
    }

    // ------------------------------------------------------------
    // clause bodies
    // ------------------------------------------------------------

    /** Raw span up to the next terminator; an empty span is an error. */
    SqlSegment readSpanSegment(String segmentName, String keyword, ClauseStart... terminators) {
        List<SqlToken> span = readSectionTokens(terminators);
        if (span.isEmpty()) throw error("Expected expression after " + keyword + ".");
        return buildSegment(segmentName, span);
    }

    /** Comma-separated expression list (select list, GROUP BY, ORDER BY, OUTPUT, RETURNING). */
    SqlSegment readListSegment(String segmentName, boolean allowAlias, ClauseStart... terminators) {
        List<SqlToken> span = new ExpressionListReader(this).read(allowAlias, terminators);
        return buildSegment(segmentName, span);
    }

    /** Comma-separated table sources with joins (FROM, USING). */
    SqlSegment readTableSegment(String segmentName, ClauseStart... terminators) {
        List<SqlToken> span = new TableListReader(this).read(terminators);
        return buildSegment(segmentName, span);
    }

    List<SqlToken> readSectionTokens(ClauseStart... terminators) {
        List<SqlToken> out = new ArrayList<>();
        int d = 0;
        while (!isAtEnd()) {
            SqlToken t = peek();
            if (d == 0 && (t.isSymbol(";") || t.isSymbol(")") || isClauseStart(terminators))) break;

            if (t.isSymbol("(")) d++;
            else if (t.isSymbol(")")) d--;
            out.add(read());
        }
        return out;
    }

    SqlSegment buildSegment(String segmentName, List<SqlToken> span) {
        return new SqlSegment(segmentName, syntaxOptions, buildParts(span));
    }

    /**
     * Lowers a span into parts: {@code ( SELECT|INSERT|UPDATE|DELETE|WITH ... )} with a matching
     * close becomes a parsed subquery, every other token stays a token part.
     */
    List<SqlSegmentPart> buildParts(List<SqlToken> span) {
        List<SqlSegmentPart> parts = new ArrayList<>(span.size());
        for (int i = 0; i < span.size(); i++) {
            SqlToken t = span.get(i);
            if (t.isSymbol("(") && i + 1 < span.size()) {
                SqlToken first = span.get(i + 1);
                int close = findMatchingParenthesis(span, i);
                if (close > i + 1 && first.isKeyword() && SUBQUERY_LEADS.contains(first.getNormalized())) {
                    SqlStatement sub = child(new ArrayList<>(span.subList(i + 1, close))).parseComplete();
                    parts.add(new SqlSubqueryPart(sub));
                    i = close;
                    continue;
                }
            }
            parts.add(new SqlTokenPart(t));
        }
        return parts;
    }

    private static int findMatchingParenthesis(List<SqlToken> span, int open) {
        int d = 0;
        for (int i = open; i < span.size(); i++) {
            SqlToken t = span.get(i);
            if (t.isSymbol("(")) {
                d++;
            } else if (t.isSymbol(")")) {
                d--;
                if (d == 0) return i;
            }
        }
        return -1;
    }

    // ------------------------------------------------------------
    // cursor
    // ------------------------------------------------------------

    boolean isAtEnd() {
        return position >= tokens.size();
    }

    SqlToken peek() {
        return isAtEnd() ? null : tokens.get(position);
    }

    SqlToken read() {
        if (isAtEnd()) throw error("Unexpected end of input.");
        return tokens.get(position++);
    }

    boolean isClauseStart(ClauseStart... candidates) {
        return ClauseKeywordRegistry.matches(tokens, position, candidates);
    }

    boolean checkKeyword(String keyword) {
        return !isAtEnd() && peek().isKeyword(keyword);
    }

    boolean checkSymbol(String symbol) {
        return !isAtEnd() && peek().isSymbol(symbol);
    }

    boolean tryConsumeKeyword(String keyword) {
        if (!checkKeyword(keyword)) return false;
        position++;
        return true;
    }

    /** Consumes a multi-word keyword such as {@code GROUP BY} only when every word matches. */
    boolean tryConsumeKeywords(String... keywords) {
        if (position + keywords.length > tokens.size()) return false;
        for (int i = 0; i < keywords.length; i++) {
            if (!tokens.get(position + i).isKeyword(keywords[i])) return false;
        }
        position += keywords.length;
        return true;
    }

    boolean tryConsumeSymbol(String symbol) {
        if (!checkSymbol(symbol)) return false;
        position++;
        return true;
    }

    void expectKeyword(String keyword) {
        if (!tryConsumeKeyword(keyword)) throw error("Expected keyword '" + keyword + "'" + foundSuffix() + ".");
    }

    void expectSymbol(String symbol) {
        if (!tryConsumeSymbol(symbol)) throw error("Expected '" + symbol + "'" + foundSuffix() + ".");
    }

    SqlToken expectIdentifier() {
        if (isAtEnd() || !peek().isIdentifier()) throw error("Expected identifier" + foundSuffix() + ".");
        return read();
    }

    void consumeOptionalTerminator() {
        while (checkSymbol(";")) position++;
    }

    void ensureEndOfInput() {
        if (!isAtEnd()) throw error("Unexpected token '" + peek().getText() + "' after end of statement.");
    }

    SqlParseException error(String message) {
        return new SqlParseException(message, currentOffset());
    }

    SqlParseException error(String message, SqlToken at) {
        return new SqlParseException(message, at == null ? currentOffset() : at.getPosition());
    }

    private String foundSuffix() {
        return isAtEnd() ? " but reached end of input" : " but found '" + peek().getText() + "'";
    }

    private int currentOffset() {
        if (!isAtEnd()) return peek().getPosition();
        if (tokens.isEmpty()) return -1;
        SqlToken last = tokens.get(tokens.size() - 1);
        return last.getPosition() < 0 ? -1 : last.getPosition() + last.getText().length();
    }
}
