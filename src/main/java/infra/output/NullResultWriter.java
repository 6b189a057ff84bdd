package infra.output;

import domain.model.AnalysisWarning;
import domain.model.SqlStatementResult;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, List<SqlStatementResult> results, List<AnalysisWarning> warnings) {
        // intentionally no-op
    }
}
