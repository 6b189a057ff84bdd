package infra.sql;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Scans {@code *.sql} files under an input directory, sorted by path.
 */
public final class SqlsDirectoryScanner {

    private final Path sqlsDir;

    public SqlsDirectoryScanner(Path sqlsDir) {
        if (sqlsDir == null) throw new IllegalArgumentException("sqlsDir is null");
        this.sqlsDir = sqlsDir.toAbsolutePath().normalize();
    }

    public boolean exists() {
        return Files.isDirectory(sqlsDir);
    }

    /** Empty when the directory does not exist. */
    public List<Path> scanAllSql() {
        if (!exists()) return List.of();

        List<Path> out = new ArrayList<>(256);
        try (Stream<Path> s = Files.walk(sqlsDir)) {
            s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName()
                            .toString()
                            .toLowerCase(Locale.ROOT)
                            .endsWith(".sql"))
                    .forEach(out::add);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan sql files under: " + sqlsDir, e);
        }
        out.sort(Comparator.comparing(Path::toString));
        return out;
    }

    /** Path of {@code file} relative to the scanned directory, with {@code /} separators. */
    public String relativize(Path file) {
        Path rel = sqlsDir.relativize(file.toAbsolutePath().normalize());
        return rel.toString().replace('\\', '/');
    }

    public Path getSqlsDir() {
        return sqlsDir;
    }
}
