package domain.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlSyntaxOptionsTest {

    @Test
    void presets_expose_their_prefixes() {
        assertTrue(SqlSyntaxOptions.SQL_SERVER.isIdentifierPrefix('#'));
        assertEquals('@', SqlSyntaxOptions.SQL_SERVER.getAutoParameterPrefix());
        assertEquals(':', SqlSyntaxOptions.ORACLE.getAutoParameterPrefix());
        assertTrue(SqlSyntaxOptions.SQLITE.isIdentifierPrefix('?'));
        assertFalse(SqlSyntaxOptions.POSTGRE_SQL.isIdentifierPrefix('@'));
        assertSame(SqlSyntaxOptions.SQL_SERVER, SqlSyntaxOptions.DEFAULT);
    }

    @Test
    void custom_options_always_include_the_auto_parameter_prefix() {
        SqlSyntaxOptions opts = new SqlSyntaxOptions(List.of('#'), '@');

        assertTrue(opts.isIdentifierPrefix('#'));
        assertTrue(opts.isIdentifierPrefix('@'));
        assertEquals(2, opts.getIdentifierPrefixes().size());
    }

    @Test
    void empty_prefix_set_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new SqlSyntaxOptions(List.of(), '@'));
    }

    @Test
    void prefix_set_is_read_only() {
        assertThrows(UnsupportedOperationException.class,
                () -> SqlSyntaxOptions.MY_SQL.getIdentifierPrefixes().add('!'));
    }
}
