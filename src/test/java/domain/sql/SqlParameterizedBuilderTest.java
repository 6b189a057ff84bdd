package domain.sql;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlParameterizedBuilderTest {

    @Test
    void sql_server_names_values_with_at_prefix_and_reuses_repeated_arguments() {
        SqlParameterizedBuilder b = new SqlParameterizedBuilder(SqlSyntaxOptions.SQL_SERVER)
                .appendLiteral("SELECT * FROM users WHERE id =").appendValue("id", 42)
                .appendLiteral("AND tenant =").appendValue("tenant", "acme")
                .appendLiteral("OR owner =").appendValue("id", 42);

        assertEquals("SELECT * FROM users WHERE id = @p0 AND tenant = @p1 OR owner = @p0 ", b.getSql());
        assertEquals(List.of("@p0", "@p1"), List.copyOf(b.getParameters().keySet()));
        assertEquals(42, b.getParameters().get("@p0"));
        assertEquals("acme", b.getParameters().get("@p1"));
        assertEquals("SELECT * FROM users WHERE id = @p0 AND tenant = @p1 OR owner = @p0", b.toQuery().toSql());
    }

    @Test
    void oracle_uses_colon_prefix() {
        SqlParameterizedBuilder b = new SqlParameterizedBuilder(SqlSyntaxOptions.ORACLE)
                .appendLiteral("SELECT a FROM t WHERE x =").appendValue("x", 1);

        assertEquals(Map.of(":p0", 1), b.getParameters());
        assertEquals("SELECT a FROM t WHERE x = :p0", b.toQuery().toSql());
    }

    @Test
    void each_dialect_uses_its_auto_parameter_prefix() {
        assertEquals("$p0", firstName(SqlSyntaxOptions.POSTGRE_SQL));
        assertEquals("@p0", firstName(SqlSyntaxOptions.MY_SQL));
        assertEquals("@p0", firstName(SqlSyntaxOptions.SQLITE));
        assertEquals("#p0", firstName(new SqlSyntaxOptions(List.of('#'), '#')));
        assertEquals("@p0", firstName(null));
    }

    private static String firstName(SqlSyntaxOptions options) {
        SqlParameterizedBuilder b = new SqlParameterizedBuilder(options).appendValue("v", "x");
        return b.getParameters().keySet().iterator().next();
    }

    @Test
    void explicitly_bound_names_are_skipped() {
        SqlParameterizedBuilder b = new SqlParameterizedBuilder(SqlSyntaxOptions.SQL_SERVER)
                .appendLiteral("UPDATE t SET a =").bind("@p0", "fixed")
                .appendLiteral("WHERE id =").appendValue("id", 7);

        assertEquals("UPDATE t SET a = @p0 WHERE id = @p1 ", b.getSql());
        assertEquals(List.of("@p0", "@p1"), List.copyOf(b.getParameters().keySet()));
        assertThrows(IllegalArgumentException.class, () -> b.bind("@p1", 1));
        assertThrows(IllegalArgumentException.class, () -> b.bind(" ", 1));
    }

    @Test
    void unnamed_values_always_get_a_new_placeholder() {
        SqlParameterizedBuilder b = new SqlParameterizedBuilder(SqlSyntaxOptions.SQL_SERVER)
                .appendLiteral("VALUES (").appendValue(null, 1).appendLiteral(",").appendValue(null, 1).appendLiteral(")");

        assertEquals(2, b.getParameters().size());
        assertEquals("VALUES ( @p0 , @p1 )", b.getSql());
    }

    @Test
    void parameters_are_read_only_and_keep_null_values() {
        SqlParameterizedBuilder b = new SqlParameterizedBuilder(SqlSyntaxOptions.SQL_SERVER)
                .appendLiteral("SELECT a FROM t WHERE b =").appendValue("b", null);

        Map<String, Object> params = b.getParameters();
        assertTrue(params.containsKey("@p0"));
        assertNull(params.get("@p0"));
        assertThrows(UnsupportedOperationException.class, () -> params.put("@p9", 1));
    }
}
