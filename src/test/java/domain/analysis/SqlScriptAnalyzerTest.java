package domain.analysis;

import domain.model.AnalysisWarning;
import domain.model.ListAnalysisWarningSink;
import domain.model.SqlStatementResult;
import domain.model.WarningCode;
import domain.sql.SqlFormattingMode;
import domain.sql.SqlFormattingOptions;
import domain.sql.SqlSyntaxOptions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlScriptAnalyzerTest {

    private static final SqlFormattingOptions PREFIXED = new SqlFormattingOptions(SqlFormattingMode.PREFIXED, 4);

    private static SqlScriptAnalyzer analyzer(boolean failFast) {
        return new SqlScriptAnalyzer(SqlSyntaxOptions.DEFAULT, PREFIXED, 128, Long.MAX_VALUE, failFast);
    }

    private static List<WarningCode> codes(List<AnalysisWarning> warnings) {
        List<WarningCode> out = new ArrayList<>();
        for (AnalysisWarning w : warnings) out.add(w.getCode());
        return out;
    }

    @Test
    void formats_each_statement_and_reports_implicit_alias() {
        List<AnalysisWarning> warnings = new ArrayList<>();
        ScriptAnalysis analysis = analyzer(false).analyze("a.sql",
                "SELECT a, b c FROM t; UPDATE t SET x = 1;", new ListAnalysisWarningSink(warnings));

        assertEquals("SELECT\n    a\n   ,b c\nFROM t;\n\nUPDATE t\nSET\n    x = 1;\n", analysis.getFormattedScript());
        assertEquals(2, analysis.getSuccessCount());
        assertEquals(0, analysis.getFailedCount());

        List<SqlStatementResult> rows = analysis.getResults();
        assertEquals("SELECT", rows.get(0).getKind());
        assertEquals("UPDATE", rows.get(1).getKind());
        assertEquals(1, rows.get(0).getIndex());
        assertEquals(2, rows.get(1).getIndex());

        assertEquals(1, warnings.size(), warnings.toString());
        AnalysisWarning w = warnings.get(0);
        assertEquals(WarningCode.IMPLICIT_ALIAS, w.getCode());
        assertEquals("a.sql", w.getFile());
        assertEquals(1, w.getStatementIndex());
        assertEquals("implicit alias 'c' in Select", w.getMessage());
    }

    @Test
    void explicit_alias_is_not_reported() {
        List<AnalysisWarning> warnings = new ArrayList<>();
        analyzer(false).analyze("a.sql", "SELECT b AS c FROM t", new ListAnalysisWarningSink(warnings));
        assertTrue(warnings.isEmpty(), warnings.toString());
    }

    @Test
    void implicit_alias_inside_subquery_is_reported() {
        List<AnalysisWarning> warnings = new ArrayList<>();
        analyzer(false).analyze("a.sql", "SELECT x FROM (SELECT b c FROM t) s", new ListAnalysisWarningSink(warnings));
        assertEquals(List.of(WarningCode.IMPLICIT_ALIAS), codes(warnings));
    }

    @Test
    void parse_error_keeps_original_text_and_continues() {
        List<AnalysisWarning> warnings = new ArrayList<>();
        ScriptAnalysis analysis = analyzer(false).analyze("b.sql",
                "SELECT FROM t; SELECT 1", new ListAnalysisWarningSink(warnings));

        assertEquals("SELECT FROM t;\n\nSELECT\n    1;\n", analysis.getFormattedScript());
        assertEquals(1, analysis.getSuccessCount());
        assertEquals(1, analysis.getFailedCount());

        SqlStatementResult failed = analysis.getResults().get(0);
        assertEquals(SqlStatementResult.STATUS_FAILED, failed.getStatus());
        assertEquals("Expected expression but none was found.", failed.getMessage());
        assertNull(failed.getFormattedSql());

        assertEquals(List.of(WarningCode.PARSE_ERROR), codes(warnings));
        assertTrue(warnings.get(0).getDetail().startsWith("offset="), warnings.get(0).getDetail());
    }

    @Test
    void fail_fast_stops_on_first_parse_error_and_keeps_rows_so_far() {
        List<AnalysisWarning> warnings = new ArrayList<>();
        ScriptAnalysisException e = assertThrows(ScriptAnalysisException.class, () ->
                analyzer(true).analyze("c.sql", "SELECT 1; SELECT FROM t; SELECT 2", new ListAnalysisWarningSink(warnings)));
        assertEquals("parse failed: c.sql#2", e.getMessage());
        assertEquals(List.of(WarningCode.PARSE_ERROR), codes(warnings));

        ScriptAnalysis partial = e.getPartialAnalysis();
        assertEquals(2, partial.getResults().size());
        assertEquals(1, partial.getSuccessCount());
        assertEquals(1, partial.getFailedCount());
        SqlStatementResult failed = partial.getResults().get(1);
        assertEquals(2, failed.getIndex());
        assertEquals(SqlStatementResult.STATUS_FAILED, failed.getStatus());
        assertEquals("Expected expression but none was found.", failed.getMessage());
    }

    @Test
    void comment_only_script_is_reported_empty() {
        List<AnalysisWarning> warnings = new ArrayList<>();
        ScriptAnalysis analysis = analyzer(false).analyze("e.sql",
                "-- nothing here\n/* still nothing */\n;", new ListAnalysisWarningSink(warnings));

        assertTrue(analysis.getResults().isEmpty());
        assertEquals("", analysis.getFormattedScript());
        assertEquals(List.of(WarningCode.SQL_TEXT_EMPTY), codes(warnings));
        assertEquals(0, warnings.get(0).getStatementIndex());
    }

    @Test
    void unterminated_literal_is_reported() {
        List<AnalysisWarning> warnings = new ArrayList<>();
        ScriptAnalysis analysis = analyzer(false).analyze("t.sql", "SELECT 'abc", new ListAnalysisWarningSink(warnings));
        assertEquals(1, analysis.getSuccessCount());
        assertTrue(codes(warnings).contains(WarningCode.UNTERMINATED_LITERAL), warnings.toString());
    }

    @Test
    void zero_slow_threshold_reports_every_statement() {
        List<AnalysisWarning> warnings = new ArrayList<>();
        SqlScriptAnalyzer slow = new SqlScriptAnalyzer(SqlSyntaxOptions.DEFAULT, PREFIXED, 128, 0L, false);
        slow.analyze("s.sql", "SELECT 1; SELECT 2", new ListAnalysisWarningSink(warnings));
        assertEquals(List.of(WarningCode.SLOW_SQL, WarningCode.SLOW_SQL), codes(warnings));
    }

    @Test
    void null_sink_is_accepted() {
        ScriptAnalysis analysis = analyzer(false).analyze("n.sql", "SELECT b c FROM t", null);
        assertEquals(1, analysis.getSuccessCount());
    }

    @Test
    void max_depth_must_be_positive() {
        assertThrows(IllegalArgumentException.class,
                () -> new SqlScriptAnalyzer(SqlSyntaxOptions.DEFAULT, PREFIXED, 0, 500L, false));
    }
}
