package domain.output;

import java.nio.file.Path;

/** Writes a formatted script next to where its source sat in the input tree. */
public interface SqlOutputWriter {
    void write(Path outDir, String relativePath, String sqlText);
}
