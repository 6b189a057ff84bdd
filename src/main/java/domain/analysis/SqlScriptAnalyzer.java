package domain.analysis;

import domain.model.AnalysisWarning;
import domain.model.AnalysisWarningSink;
import domain.model.SqlStatementResult;
import domain.model.WarningCode;
import domain.sql.SqlExpression;
import domain.sql.SqlFormattingOptions;
import domain.sql.SqlParseException;
import domain.sql.SqlQuery;
import domain.sql.SqlQueryAnalyzer;
import domain.sql.SqlScriptSplitter;
import domain.sql.SqlSegment;
import domain.sql.SqlStatement;
import domain.sql.SqlSyntaxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Analyzes a SQL script: splits it into statements, parses and formats each one and reports
 * what operators should review.
 *
 * <p>A statement that fails to parse becomes a FAILED row and a PARSE_ERROR warning; the rest of
 * the script is still analyzed unless {@code failFast} is set.</p>
 */
public final class SqlScriptAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SqlScriptAnalyzer.class);

    private final SqlSyntaxOptions syntaxOptions;
    private final SqlFormattingOptions formattingOptions;
    private final int maxDepth;
    private final long slowMs;
    private final boolean failFast;

    public SqlScriptAnalyzer(SqlSyntaxOptions syntaxOptions,
                             SqlFormattingOptions formattingOptions,
                             int maxDepth,
                             long slowMs,
                             boolean failFast) {
        this.syntaxOptions = Objects.requireNonNull(syntaxOptions, "syntaxOptions");
        this.formattingOptions = Objects.requireNonNull(formattingOptions, "formattingOptions");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.maxDepth = maxDepth;
        this.slowMs = slowMs;
        this.failFast = failFast;
    }

    /**
     * @param file label used in result rows and warnings (usually the path relative to the input dir)
     * @throws ScriptAnalysisException on the first failing statement when {@code failFast} is set
     */
    public ScriptAnalysis analyze(String file, String script, AnalysisWarningSink warningSink) {
        AnalysisWarningSink sink = (warningSink == null) ? AnalysisWarningSink.none() : warningSink;

        List<String> statements = SqlScriptSplitter.split(script);
        List<SqlStatementResult> results = new ArrayList<>(statements.size());
        if (statements.isEmpty()) {
            sink.warn(AnalysisWarning.of(WarningCode.SQL_TEXT_EMPTY, file, 0, "SQL text empty"));
            return new ScriptAnalysis(file, results, "");
        }

        StringBuilder out = new StringBuilder(script.length() + 64);
        for (int i = 0; i < statements.size(); i++) {
            int index = i + 1;
            String sql = statements.get(i);
            SqlStatementResult result = analyzeStatement(file, index, sql, sink, results);
            results.add(result);

            if (out.length() > 0) out.append("\n\n");
            out.append(result.isSuccess() ? result.getFormattedSql() : sql).append(';');
        }
        out.append('\n');

        return new ScriptAnalysis(file, results, out.toString());
    }

    private SqlStatementResult analyzeStatement(String file, int index, String sql, AnalysisWarningSink sink,
                                                List<SqlStatementResult> done) {
        long t0 = System.nanoTime();
        SqlStatementResult result;
        try {
            SqlQuery query = SqlQueryAnalyzer.parse(sql, syntaxOptions, maxDepth);
            String formatted = query.toSql(formattingOptions);

            if (query.isTruncatedInput()) {
                sink.warn(new AnalysisWarning(WarningCode.UNTERMINATED_LITERAL, file, index,
                        "input ends inside a string, quoted identifier or comment", abbreviate(sql)));
            }
            reportImplicitAliases(query, file, index, sink);

            List<SqlStatement> all = query.getAllStatements();
            result = SqlStatementResult.success(file, index, query.getRootStatement().getKind().name(),
                    all.size(), ms(t0), formatted);
            log.debug("analyzed {}#{} kind={} statements={}", file, index, result.getKind(), all.size());

        } catch (SqlParseException e) {
            log.warn("parse failed: {}#{} at offset {}: {}", file, index, e.getPosition(), e.getMessage());
            sink.warn(new AnalysisWarning(WarningCode.PARSE_ERROR, file, index,
                    e.getMessage(), "offset=" + e.getPosition()));
            result = SqlStatementResult.failed(file, index, ms(t0), e.getMessage());
            if (failFast) throw stop("parse failed", done, result, e);

        } catch (RuntimeException e) {
            log.error("analysis failed: {}#{}", file, index, e);
            sink.warn(new AnalysisWarning(WarningCode.TRANSFORM_ERROR, file, index,
                    e.getClass().getSimpleName(), e.getMessage()));
            result = SqlStatementResult.failed(file, index, ms(t0), e.getClass().getSimpleName());
            if (failFast) throw stop("analysis failed", done, result, e);
        }

        if (result.getElapsedMs() >= slowMs) {
            log.info("[SLOW] {}ms : {}#{}", result.getElapsedMs(), file, index);
            sink.warn(new AnalysisWarning(WarningCode.SLOW_SQL, file, index,
                    "slowMs=" + slowMs + ", actualMs=" + result.getElapsedMs(), ""));
        }
        return result;
    }

    private static ScriptAnalysisException stop(String what, List<SqlStatementResult> done,
                                                SqlStatementResult failed, RuntimeException cause) {
        List<SqlStatementResult> partial = new ArrayList<>(done);
        partial.add(failed);
        return new ScriptAnalysisException(what + ": " + failed.getFile() + "#" + failed.getIndex(),
                new ScriptAnalysis(failed.getFile(), partial, ""), cause);
    }

    private static void reportImplicitAliases(SqlQuery query, String file, int index, AnalysisWarningSink sink) {
        for (SqlStatement statement : query.getAllStatements()) {
            for (SqlSegment segment : statement.getSegments()) {
                if (!SqlSegment.SELECT.equals(segment.getName()) && !SqlSegment.OUTPUT.equals(segment.getName())) {
                    continue;
                }
                for (SqlExpression expression : segment.getExpressions()) {
                    if (!expression.hasAlias() || expression.isExplicitAlias()) continue;
                    sink.warn(new AnalysisWarning(WarningCode.IMPLICIT_ALIAS, file, index,
                            "implicit alias '" + expression.getAlias() + "' in " + segment.getName(),
                            expression.toSql()));
                }
            }
        }
    }

    private static String abbreviate(String sql) {
        String s = sql.replaceAll("\\s+", " ").trim();
        return s.length() <= 120 ? s : s.substring(0, 117) + "...";
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
