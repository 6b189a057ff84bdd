package domain.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlQueryAnalyzerDmlTest {

    @Test
    void insert_values_with_returning() {
        SqlQuery q = SqlQueryAnalyzer.parse(
                "INSERT INTO users (id, name) VALUES (1, 'a') RETURNING id", SqlSyntaxOptions.POSTGRE_SQL);
        SqlInsertStatement st = (SqlInsertStatement) q.getRootStatement();

        assertEquals(StatementKind.INSERT, st.getKind());
        assertEquals("users(id, name)", st.getTarget().toSql());
        assertEquals("(1, 'a')", st.getValues().toSql());
        assertEquals("id", st.getReturning().toSql());
        assertNull(st.getSourceQuery());
        assertEquals("INSERT INTO users(id, name) VALUES (1, 'a') RETURNING id", q.toSql());
    }

    @Test
    void insert_select_keeps_the_source_query_as_a_nested_statement() {
        SqlQuery q = SqlQueryAnalyzer.parse("INSERT INTO archive SELECT * FROM users WHERE active = 0");
        SqlInsertStatement st = (SqlInsertStatement) q.getRootStatement();

        assertNull(st.getValues());
        assertNotNull(st.getSourceQuery());
        assertEquals(StatementKind.SELECT, st.getSourceQuery().getKind());
        assertEquals(2, q.getAllStatements().size());
        assertEquals("INSERT INTO archive SELECT * FROM users WHERE active = 0", q.toSql());

        assertThrows(IllegalStateException.class, st::ensureValuesSegment);
    }

    @Test
    void insert_select_source_is_listed_before_returning_subqueries() {
        SqlQuery q = SqlQueryAnalyzer.parse(
                "INSERT INTO t SELECT a FROM u RETURNING (SELECT MAX(x) FROM v) m", SqlSyntaxOptions.POSTGRE_SQL);
        List<SqlStatement> all = q.getAllStatements();

        assertEquals(3, all.size());
        assertEquals(StatementKind.INSERT, all.get(0).getKind());
        assertEquals("SELECT a FROM u", all.get(1).toSql());
        assertEquals("SELECT MAX(x) FROM v", all.get(2).toSql());
    }

    @Test
    void insert_output_items_get_aliases() {
        SqlInsertStatement st = (SqlInsertStatement) SqlQueryAnalyzer.parse(
                "INSERT INTO t (a) OUTPUT inserted.id AS new_id VALUES (@a)").getRootStatement();

        List<SqlExpression> out = st.getOutput().getExpressions();
        assertEquals(1, out.size());
        assertEquals("new_id", out.get(0).getAlias());
        assertEquals("INSERT INTO t(a) OUTPUT inserted.id AS new_id VALUES (@a)", st.toSql());
    }

    @Test
    void insert_needs_values_or_select() {
        SqlParseException e = assertThrows(SqlParseException.class,
                () -> SqlQueryAnalyzer.parse("INSERT INTO t (a)"));
        assertEquals("Expected VALUES or SELECT clause in INSERT statement.", e.getMessage());
    }

    @Test
    void update_with_every_clause() {
        SqlUpdateStatement st = (SqlUpdateStatement) SqlQueryAnalyzer.parse(
                "UPDATE t SET a = 1, b = @b OUTPUT inserted.a FROM t JOIN u ON u.id = t.uid WHERE u.x = 1").getRootStatement();

        assertEquals(StatementKind.UPDATE, st.getKind());
        assertEquals("t", st.getTarget().toSql());
        assertEquals("a = 1, b = @b", st.getSet().toSql());
        assertEquals("inserted.a", st.getOutput().toSql());
        assertEquals("t JOIN u ON u.id = t.uid", st.getFrom().toSql());
        assertEquals("u.x = 1", st.getWhere().toSql());
        assertNull(st.getReturning());
    }

    @Test
    void update_without_set_is_rejected() {
        SqlParseException e = assertThrows(SqlParseException.class,
                () -> SqlQueryAnalyzer.parse("UPDATE t a = 1"));
        assertEquals("Expected keyword 'SET' but reached end of input.", e.getMessage());
    }

    @Test
    void update_with_subquery_in_set() {
        SqlQuery q = SqlQueryAnalyzer.parse("UPDATE t SET a = (SELECT MAX(b) FROM u) WHERE id = 1");
        assertEquals(2, q.getAllStatements().size());
        assertEquals("UPDATE t SET a = (SELECT MAX(b) FROM u) WHERE id = 1", q.toSql());
    }

    @Test
    void delete_without_target() {
        SqlDeleteStatement st = (SqlDeleteStatement) SqlQueryAnalyzer.parse("DELETE FROM t WHERE id = 1").getRootStatement();

        assertEquals(StatementKind.DELETE, st.getKind());
        assertNull(st.getTarget());
        assertEquals("t", st.getFrom().toSql());
        assertEquals("DELETE FROM t WHERE id = 1", st.toSql());
    }

    @Test
    void delete_with_target_and_join() {
        SqlDeleteStatement st = (SqlDeleteStatement) SqlQueryAnalyzer.parse(
                "DELETE t FROM t JOIN u ON u.id = t.uid WHERE u.x = 1").getRootStatement();

        assertEquals("t", st.getTarget().toSql());
        assertEquals("DELETE t FROM t JOIN u ON u.id = t.uid WHERE u.x = 1", st.toSql());
    }

    @Test
    void delete_using_returning() {
        SqlDeleteStatement st = (SqlDeleteStatement) SqlQueryAnalyzer.parse(
                "DELETE FROM t USING u WHERE t.id = u.id RETURNING t.id", SqlSyntaxOptions.POSTGRE_SQL).getRootStatement();

        assertEquals("u", st.getUsing().toSql());
        assertEquals("t.id", st.getReturning().toSql());
        assertEquals(List.of(SqlSegment.FROM, SqlSegment.USING, SqlSegment.WHERE, SqlSegment.RETURNING),
                st.getSegments().stream().map(SqlSegment::getName).toList());
    }

    @Test
    void with_clause_before_dml() {
        SqlQuery q = SqlQueryAnalyzer.parse("WITH old AS (SELECT id FROM t WHERE x < 0) DELETE FROM t WHERE id IN (SELECT id FROM old)");

        assertEquals(StatementKind.DELETE, q.getRootStatement().getKind());
        assertNotNull(q.getRootStatement().getWithClause());
        assertEquals(3, q.getAllStatements().size());
    }
}
