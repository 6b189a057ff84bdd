package domain.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Output path policy for formatted SQL.
 * <p>
 * The relative path of the input file is kept, each segment made filename-safe:
 * <pre>
 * billing/monthly close.sql  -> billing/monthly_close.sql
 * ../etc/x.sql               -> _/etc/x.sql
 * report                     -> report.sql
 * </pre>
 */
public final class SqlFileNamePolicy {

    private SqlFileNamePolicy() {
    }

    /**
     * Normalized relative path segments, the last one always ending in {@code .sql}.
     */
    public static List<String> build(String relativePath) {
        String raw = (relativePath == null) ? "" : relativePath.trim().replace('\\', '/');

        List<String> parts = new ArrayList<>();
        for (String p : raw.split("/")) {
            if (p.isBlank() || p.equals(".")) continue;
            parts.add(p.equals("..") ? "_" : p);
        }
        if (parts.isEmpty()) parts.add("unknown");

        List<String> out = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            boolean last = (i == parts.size() - 1);
            String s = safePart(parts.get(i), last ? "unknown" : "_");
            if (last && !s.toLowerCase(Locale.ROOT).endsWith(".sql")) s = s + ".sql";
            out.add(limit(s, 180));
        }
        return out;
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        // no hidden files
        if (s.startsWith(".")) s = "_" + s.substring(1);

        // windows reserved names protection
        String u = s.toUpperCase(Locale.ROOT);
        int dot = u.indexOf('.');
        String stem = (dot >= 0) ? u.substring(0, dot) : u;
        if (stem.equals("CON") || stem.equals("PRN") || stem.equals("AUX") || stem.equals("NUL")
                || stem.matches("COM[1-9]") || stem.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s == null) return "";
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
