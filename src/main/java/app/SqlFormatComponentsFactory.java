package app;

import domain.analysis.SqlScriptAnalyzer;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.sql.SqlFormattingOptions;
import domain.sql.SqlSyntaxOptions;
import infra.output.FileSqlOutputWriter;
import infra.output.NullResultWriter;
import infra.output.NullSqlOutputWriter;
import infra.output.XlsxResultWriter;
import infra.sql.SqlsDirectoryScanner;

import java.nio.file.Path;

/**
 * Object-assembly factory for {@link SqlFormatCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging and moves object creation here.
 */
final class SqlFormatComponentsFactory {

    SqlsDirectoryScanner createScanner(Path inDir) {
        return new SqlsDirectoryScanner(inDir);
    }

    SqlScriptAnalyzer createAnalyzer(SqlSyntaxOptions syntaxOptions,
                                     SqlFormattingOptions formattingOptions,
                                     int maxDepth,
                                     long slowMs,
                                     boolean failFast) {
        return new SqlScriptAnalyzer(syntaxOptions, formattingOptions, maxDepth, slowMs, failFast);
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter();
    }
}
