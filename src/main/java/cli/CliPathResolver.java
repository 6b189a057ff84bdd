package cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/** CLI path resolver (baseDir / input dir). */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static final String PROP_BASE_DIR = "baseDir";
    public static final String PROP_IN_DIR   = "sql.inDir";

    public static void applyBaseDirPropertyIfPresent(Map<String, String> argv) {
        String bd = (argv == null) ? null : argv.get("baseDir");
        if (bd == null || bd.isBlank()) return;
        System.setProperty(PROP_BASE_DIR, bd.trim());
    }

    public static Path resolveBaseDir() {
        String bd = System.getProperty(PROP_BASE_DIR);
        if (bd != null && !bd.isBlank()) {
            return resolveAgainstUserDir(bd).toAbsolutePath().normalize();
        }
        return Paths.get(".").toAbsolutePath().normalize();
    }

    /**
     * Input dir: {@code -Dsql.inDir} first, then {@code --in}, then {@code <baseDir>/sqls}.
     */
    public static Path resolveInDir(Path baseDir, Map<String, String> argv) {
        String fromProp = trimToNull(System.getProperty(PROP_IN_DIR));
        if (fromProp != null) return resolvePath(baseDir, fromProp);

        String fromArg = (argv == null) ? null : trimToNull(argv.get("in"));
        if (fromArg != null) return resolvePath(baseDir, fromArg);

        return baseDir.resolve("sqls")
                .toAbsolutePath()
                .normalize();
    }

    public static Path resolvePath(Path baseDir, String input) {
        if (input == null || input.isBlank()) return null;
        Path p = Paths.get(input.trim());
        if (!p.isAbsolute()) {
            if (baseDir != null) p = baseDir.resolve(p);
            else p = resolveAgainstUserDir(input.trim());
        }
        return p.toAbsolutePath().normalize();
    }

    public static Path resolveAgainstUserDir(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Path p = Paths.get(raw.trim());
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }

    public static void mkdirs(Path p) {
        if (p == null) return;
        try {
            Files.createDirectories(p);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create directory: " + p, e);
        }
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
