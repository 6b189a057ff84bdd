package domain.sql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point: parses one SQL statement (optionally preceded by a WITH clause and followed by
 * semicolons) into an editable {@link SqlQuery}.
 *
 * <pre>
 * SqlQuery q = SqlQueryAnalyzer.parse("SELECT a FROM t");
 * ((SqlSelectStatement) q.getRootStatement()).ensureWhereSegment().addConjunction("AND", "a &gt; 0");
 * String sql = q.toSql(new SqlFormattingOptions(SqlFormattingMode.PREFIXED, 4));
 * </pre>
 *
 * <p>Nesting depth (subqueries and CTE bodies) is limited to {@value #DEFAULT_MAX_DEPTH} unless
 * the system property {@value #PROP_MAX_DEPTH} or an explicit argument says otherwise.</p>
 */
public final class SqlQueryAnalyzer {

    public static final String PROP_MAX_DEPTH = "sql.parser.maxDepth";
    public static final int DEFAULT_MAX_DEPTH = 128;

    private static final Logger log = LoggerFactory.getLogger(SqlQueryAnalyzer.class);

    private SqlQueryAnalyzer() {
    }

    public static SqlQuery parse(String sql) {
        return parse(sql, SqlSyntaxOptions.DEFAULT);
    }

    public static SqlQuery parse(String sql, SqlSyntaxOptions syntaxOptions) {
        return parse(sql, syntaxOptions, defaultMaxDepth());
    }

    /**
     * @throws SqlParseException        when the text is not a supported statement
     * @throws IllegalArgumentException when {@code sql} is blank, options are missing or
     *                                  {@code maxDepth} is not positive
     */
    public static SqlQuery parse(String sql, SqlSyntaxOptions syntaxOptions, int maxDepth) {
        if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql is null or blank");
        if (syntaxOptions == null) throw new IllegalArgumentException("syntaxOptions is null");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);

        SqlTokenizer tokenizer = new SqlTokenizer(sql, syntaxOptions);
        List<SqlToken> tokens = tokenizer.tokenize();
        boolean truncated = tokenizer.isTruncated();
        if (truncated) {
            log.warn("Input ends inside an unterminated string, identifier or comment; consumed to end of text (length={})",
                    sql.length());
        }

        SqlStatement root = new SqlParser(tokens, syntaxOptions, maxDepth).parseComplete();
        SqlQuery query = new SqlQuery(root, syntaxOptions, truncated);

        if (log.isDebugEnabled()) {
            log.debug("Parsed {} (tokens={}, statements={})",
                    root.getKind(), tokens.size(), query.getAllStatements().size());
        }
        return query;
    }

    /** Maximum depth from {@value #PROP_MAX_DEPTH}, falling back to {@value #DEFAULT_MAX_DEPTH}. */
    static int defaultMaxDepth() {
        String raw = System.getProperty(PROP_MAX_DEPTH);
        if (raw == null || raw.isBlank()) return DEFAULT_MAX_DEPTH;
        try {
            int v = Integer.parseInt(raw.trim());
            return v > 0 ? v : DEFAULT_MAX_DEPTH;
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid -D{}={}", PROP_MAX_DEPTH, raw);
            return DEFAULT_MAX_DEPTH;
        }
    }
}
