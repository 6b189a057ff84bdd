package cli;

import domain.sql.SqlFormattingMode;
import domain.sql.SqlSyntaxOptions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void parses_key_value_and_presence_flags() {
        Map<String, String> argv = CliArgParser.parseArgs(new String[]{
                "--in", "sqls", "--mode=suffixed", "--failFast", "--noResult=false", "stray"});

        assertEquals("sqls", argv.get("in"));
        assertEquals("suffixed", argv.get("mode"));
        assertTrue(CliArgParser.flag(argv, "failFast"));
        assertFalse(CliArgParser.flag(argv, "noResult"));
        assertFalse(CliArgParser.flag(argv, "noSqlOut"));
        assertFalse(argv.containsKey("stray"));
    }

    @Test
    void numbers_fall_back_to_default() {
        assertEquals(4, CliArgParser.parseInt(null, 4));
        assertEquals(4, CliArgParser.parseInt("four", 4));
        assertEquals(2, CliArgParser.parseInt(" 2 ", 4));
        assertEquals(500L, CliArgParser.parseLong("", 500L));
        assertEquals(10L, CliArgParser.parseLong("10", 500L));
    }

    @Test
    void formatting_mode_aliases() {
        assertEquals(SqlFormattingMode.PREFIXED, CliArgParser.parseFormattingMode(null));
        assertEquals(SqlFormattingMode.INLINE, CliArgParser.parseFormattingMode("OFF"));
        assertEquals(SqlFormattingMode.PREFIXED, CliArgParser.parseFormattingMode("leading"));
        assertEquals(SqlFormattingMode.SUFFIXED, CliArgParser.parseFormattingMode("Trailing"));
        assertThrows(IllegalArgumentException.class, () -> CliArgParser.parseFormattingMode("pretty"));
    }

    @Test
    void dialect_aliases() {
        assertSame(SqlSyntaxOptions.DEFAULT, CliArgParser.parseDialect(null));
        assertSame(SqlSyntaxOptions.SQL_SERVER, CliArgParser.parseDialect("sql-server"));
        assertSame(SqlSyntaxOptions.ORACLE, CliArgParser.parseDialect("Oracle"));
        assertSame(SqlSyntaxOptions.MY_SQL, CliArgParser.parseDialect("mariadb"));
        assertSame(SqlSyntaxOptions.SQLITE, CliArgParser.parseDialect("sqlite"));
        assertSame(SqlSyntaxOptions.POSTGRE_SQL, CliArgParser.parseDialect("pg"));
        assertThrows(IllegalArgumentException.class, () -> CliArgParser.parseDialect("db2"));
    }
}
