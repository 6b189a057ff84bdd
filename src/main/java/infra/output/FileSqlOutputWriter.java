package infra.output;

import domain.output.SqlFileNamePolicy;
import domain.output.SqlOutputWriter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link SqlOutputWriter} that stores formatted scripts into files.
 * <p>
 * Output layout: {@code <outDir>/<relative path of the input>}, normalized by {@link SqlFileNamePolicy}.
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    @Override
    public void write(Path outDir, String relativePath, String sqlText) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");

        List<String> parts = SqlFileNamePolicy.build(relativePath);
        Path target = outDir;
        for (String p : parts) target = target.resolve(p);

        Path targetDir = target.getParent();
        try {
            Files.createDirectories(targetDir);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create output directory: " + targetDir, e);
        }

        try {
            Files.writeString(target, sqlText == null ? "" : sqlText, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write sql file: " + target, e);
        }
    }
}
