package cli;

import domain.sql.SqlFormattingMode;
import domain.sql.SqlSyntaxOptions;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    private CliArgParser() {
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static long parseLong(String s, long def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--noResult       => true</li>
     *   <li>--noResult=true  => true</li>
     *   <li>--noResult=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * Formatting mode, case-insensitive.
     * <ul>
     *   <li>inline / none / off -> INLINE</li>
     *   <li>prefixed / prefix / leading -> PREFIXED</li>
     *   <li>suffixed / suffix / trailing -> SUFFIXED</li>
     * </ul>
     * Default: PREFIXED
     *
     * @throws IllegalArgumentException for any other value
     */
    public static SqlFormattingMode parseFormattingMode(String raw) {
        if (raw == null || raw.isBlank()) return SqlFormattingMode.PREFIXED;
        String v = raw.trim()
                .toLowerCase(Locale.ROOT);

        switch (v) {
            case "inline":
            case "none":
            case "off":
                return SqlFormattingMode.INLINE;
            case "prefixed":
            case "prefix":
            case "leading":
                return SqlFormattingMode.PREFIXED;
            case "suffixed":
            case "suffix":
            case "trailing":
                return SqlFormattingMode.SUFFIXED;
            default:
                throw new IllegalArgumentException("Unknown --mode: " + raw + " (inline|prefixed|suffixed)");
        }
    }

    /**
     * Dialect preset, case-insensitive; {@code -} and {@code _} are ignored
     * (sql-server, sql_server, mssql -> SQL_SERVER).
     * Default: SQL_SERVER
     *
     * @throws IllegalArgumentException for an unknown dialect
     */
    public static SqlSyntaxOptions parseDialect(String raw) {
        if (raw == null || raw.isBlank()) return SqlSyntaxOptions.DEFAULT;
        String v = raw.trim()
                .toLowerCase(Locale.ROOT)
                .replace("-", "")
                .replace("_", "");

        switch (v) {
            case "sqlserver":
            case "mssql":
            case "tsql":
                return SqlSyntaxOptions.SQL_SERVER;
            case "oracle":
                return SqlSyntaxOptions.ORACLE;
            case "mysql":
            case "mariadb":
                return SqlSyntaxOptions.MY_SQL;
            case "sqlite":
                return SqlSyntaxOptions.SQLITE;
            case "postgresql":
            case "postgres":
            case "pg":
                return SqlSyntaxOptions.POSTGRE_SQL;
            default:
                throw new IllegalArgumentException("Unknown --dialect: " + raw
                        + " (sqlserver|oracle|mysql|sqlite|postgresql)");
        }
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        if (args == null) return m;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) continue;

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        return m;
    }
}
