package domain.output;

import domain.model.AnalysisWarning;
import domain.model.SqlStatementResult;

import java.nio.file.Path;
import java.util.List;

/** Stores the analysis report. */
public interface ResultWriter {

    void write(Path resultXlsx, List<SqlStatementResult> results, List<AnalysisWarning> warnings);
}
