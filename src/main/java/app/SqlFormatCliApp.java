package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.SqlFormatCli;
import domain.analysis.ScriptAnalysis;
import domain.analysis.ScriptAnalysisException;
import domain.analysis.SqlScriptAnalyzer;
import domain.model.AnalysisWarning;
import domain.model.AnalysisWarningSink;
import domain.model.ListAnalysisWarningSink;
import domain.model.SqlStatementResult;
import domain.model.WarningCode;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.sql.SqlFormattingMode;
import domain.sql.SqlFormattingOptions;
import domain.sql.SqlQueryAnalyzer;
import domain.sql.SqlSyntaxOptions;
import infra.sql.SqlsDirectoryScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link SqlFormatCli}). */
public final class SqlFormatCliApp {

    private static final Logger log = LoggerFactory.getLogger(SqlFormatCliApp.class);

    private SqlFormatCliApp() {}

    public static void main(String[] args) {
        run(CliArgParser.parseArgs(args));
    }

    /**
     * Runs one batch and returns every statement row written to the report.
     *
     * @throws IllegalStateException with {@code --failFast}, after the report of the work done
     *                               so far is written
     */
    static List<SqlStatementResult> run(Map<String, String> argv) {
        long t0 = System.nanoTime();

        // ------------------------------------------------------------
        // baseDir / input / output
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();
        Path inDir = CliPathResolver.resolveInDir(baseDir, argv);

        Path outDir = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("out", "output/formatted"));
        Path resultXlsx = CliPathResolver.resolvePath(baseDir, argv.getOrDefault("result", "output/sql-analysis.xlsx"));

        SqlFormattingMode mode = CliArgParser.parseFormattingMode(argv.get("mode"));
        int indent = CliArgParser.parseInt(argv.get("indent"), 4);
        SqlSyntaxOptions dialect = CliArgParser.parseDialect(argv.get("dialect"));
        int maxDepth = CliArgParser.parseInt(argv.get("maxDepth"),
                CliArgParser.parseInt(System.getProperty(SqlQueryAnalyzer.PROP_MAX_DEPTH), SqlQueryAnalyzer.DEFAULT_MAX_DEPTH));
        int logEvery = Math.max(1, CliArgParser.parseInt(argv.get("logEvery"), 100));
        long slowMs = CliArgParser.parseLong(argv.get("slowMs"), 500L);

        // feature toggles (presence-style)
        boolean failFast = CliArgParser.flag(argv, "failFast");
        boolean noSqlOut = CliArgParser.flag(argv, "noSqlOut") || CliArgParser.flag(argv, "noOut");
        boolean noResult = CliArgParser.flag(argv, "noResult") || CliArgParser.flag(argv, "noXlsx");

        log.info("==================================================");
        log.info("[START] SQL format / analysis");
        log.info("[CONF] baseDir        = {}", baseDir);
        log.info("[CONF] in             = {} (use --in or -D{})", inDir, CliPathResolver.PROP_IN_DIR);
        log.info("[CONF] out            = {}", outDir);
        log.info("[CONF] result         = {}", resultXlsx);
        log.info("[CONF] mode           = {}", mode);
        log.info("[CONF] indent         = {}", indent);
        log.info("[CONF] dialect        = {}", dialect);
        log.info("[CONF] maxDepth       = {}", maxDepth);
        log.info("[CONF] logEvery       = {}", logEvery);
        log.info("[CONF] slowMs         = {}", slowMs);
        log.info("[CONF] failFast       = {}", failFast);
        log.info("[CONF] enableSqlOut   = {} (use --noSqlOut)", !noSqlOut);
        log.info("[CONF] enableResult   = {} (use --noResult)", !noResult);
        log.info("==================================================");

        // warnings (collected even when result xlsx is disabled)
        List<AnalysisWarning> warnings = new ArrayList<>(128);
        AnalysisWarningSink warningSink = new ListAnalysisWarningSink(warnings);

        // ------------------------------------------------------------
        // assemble runtime components
        // ------------------------------------------------------------
        SqlFormatComponentsFactory factory = new SqlFormatComponentsFactory();
        SqlsDirectoryScanner scanner = factory.createScanner(inDir);
        SqlScriptAnalyzer analyzer = factory.createAnalyzer(
                dialect, new SqlFormattingOptions(mode, indent), maxDepth, slowMs, failFast);
        SqlOutputWriter sqlOutputWriter = factory.createSqlOutputWriter(!noSqlOut);
        ResultWriter resultWriter = factory.createResultWriter(!noResult);

        if (!scanner.exists()) {
            log.warn("[WARN] input dir not found or not a directory: {}", inDir);
            log.warn("       - put *.sql files under {} or pass --in <dir> / -D{}=<dir>", inDir, CliPathResolver.PROP_IN_DIR);
            warningSink.warn(new AnalysisWarning(WarningCode.SQLS_DIR_MISSING, "", 0,
                    "input dir not found: " + inDir, ""));
        }

        if (!noSqlOut) CliPathResolver.mkdirs(outDir);

        long tScan0 = System.nanoTime();
        List<Path> files = scanner.scanAllSql();
        log.info("[STEP1] scanned input dir. files={}, elapsed={}ms", files.size(), ms(tScan0));

        int total = files.size();
        log.info("[STEP2] analyzing start. files={}", total);

        CliProgressMonitor monitor = new CliProgressMonitor(total);
        List<SqlStatementResult> results = new ArrayList<>(Math.max(16, total * 2));
        IllegalStateException stopped = null;
        long tLoop0 = System.nanoTime();

        try (CliProgressMonitor.Heartbeat ignored = monitor.startHeartbeat(CliProgressMonitor.DEFAULT_HEARTBEAT_MS)) {
            for (int i = 0; i < total; i++) {
                Path file = files.get(i);
                String key = scanner.relativize(file);
                monitor.fileStarted(key);

                try {
                    String script = Files.readString(file, StandardCharsets.UTF_8);
                    ScriptAnalysis analysis = analyzer.analyze(key, script, warningSink);
                    results.addAll(analysis.getResults());
                    monitor.record(analysis.getSuccessCount(), analysis.getFailedCount());

                    if (!analysis.getResults().isEmpty()) {
                        sqlOutputWriter.write(outDir, key, analysis.getFormattedScript());
                    }

                } catch (ScriptAnalysisException e) {
                    // fail-fast: keep the rows analyzed so far, the failing statement included
                    ScriptAnalysis partial = e.getPartialAnalysis();
                    results.addAll(partial.getResults());
                    monitor.record(partial.getSuccessCount(), partial.getFailedCount());
                    log.error("[FAILFAST] stop on first error: {} ({})", key, e.getMessage());
                    stopped = e;
                    break;

                } catch (IOException e) {
                    results.add(SqlStatementResult.failed(key, 0, 0L, "read failed: " + e.getMessage()));
                    monitor.record(0, 1);
                    warningSink.warn(new AnalysisWarning(WarningCode.TRANSFORM_ERROR, key, 0,
                            e.getClass().getSimpleName(), e.getMessage()));
                    log.error("[ERROR] read failed: {}", key, e);
                    if (failFast) {
                        stopped = new IllegalStateException("Failed to read sql file: " + file, e);
                        log.error("[FAILFAST] stop on first error.");
                        break;
                    }

                } catch (IllegalStateException e) {
                    // output write failure; the statement rows are already recorded
                    results.add(SqlStatementResult.failed(key, 0, 0L, e.getMessage()));
                    monitor.record(0, 1);
                    warningSink.warn(new AnalysisWarning(WarningCode.TRANSFORM_ERROR, key, 0,
                            e.getClass().getSimpleName(), e.getMessage()));
                    log.error("[ERROR] write failed: {}", key, e);
                    if (failFast) {
                        stopped = e;
                        log.error("[FAILFAST] stop on first error.");
                        break;
                    }

                } finally {
                    monitor.fileDone();
                }

                if ((i + 1) % logEvery == 0 || (i + 1) == total) {
                    monitor.logProgress();
                }
            }
        }

        log.info("[STEP2] analyzing done. elapsed={}ms", ms(tLoop0));
        log.info("[STAT] files={}/{}, statements={}, success={}, failed={}",
                monitor.getFilesDone(), total, monitor.getStatements(), monitor.getSuccess(), monitor.getFailed());
        log.info("[STAT] warnings={}", warnings.size());

        if (!noResult) {
            long tXlsx0 = System.nanoTime();
            log.info("[STEP3] writing result xlsx... rows={}", results.size());
            resultWriter.write(resultXlsx, results, warnings);
            log.info("[STEP3] result xlsx written. elapsed={}ms", ms(tXlsx0));
        } else {
            log.info("[STEP3] result xlsx skipped (--noResult). rows={}", results.size());
        }

        log.info("==================================================");
        log.info("[DONE] totalElapsed={}ms", ms(t0));
        log.info("==================================================");

        if (stopped != null) throw stopped;
        return results;
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
