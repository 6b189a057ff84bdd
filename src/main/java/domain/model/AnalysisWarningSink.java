package domain.model;

/**
 * Sink for analysis warnings, so the analyzer does not depend on the CLI or the XLSX writer.
 */
public interface AnalysisWarningSink {

    static AnalysisWarningSink none() {
        return NullAnalysisWarningSink.INSTANCE;
    }

    void warn(AnalysisWarning warning);
}
