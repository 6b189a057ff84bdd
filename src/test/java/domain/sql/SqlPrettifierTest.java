package domain.sql;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlPrettifierTest {

    private static final SqlFormattingOptions PREFIXED = new SqlFormattingOptions(SqlFormattingMode.PREFIXED, 4);
    private static final SqlFormattingOptions SUFFIXED = new SqlFormattingOptions(SqlFormattingMode.SUFFIXED, 4);

    private static String format(String sql, SqlFormattingOptions options) {
        return SqlQueryAnalyzer.parse(sql).toSql(options);
    }

    @Test
    void prefixed_puts_commas_at_line_start() {
        assertEquals("SELECT\n    a\n   ,b\n   ,c\nFROM t", format("SELECT a, b, c FROM t", PREFIXED));
    }

    @Test
    void suffixed_puts_commas_at_line_end() {
        assertEquals("SELECT\n    a,\n    b,\n    c\nFROM t", format("SELECT a, b, c FROM t", SUFFIXED));
    }

    @Test
    void inline_returns_canonical_single_line() {
        SqlFormattingOptions inline = new SqlFormattingOptions(SqlFormattingMode.INLINE, 4);
        assertEquals("SELECT a, b FROM t WHERE x = 1", format("select a,b from t where x=1", inline));
        assertEquals("SELECT a, b FROM t WHERE x = 1", format("select a,b from t where x=1", SqlFormattingOptions.DEFAULT));
    }

    @Test
    void indent_size_drives_item_and_comma_columns() {
        assertEquals("SELECT\n  a\n ,b\nFROM t", format("SELECT a, b FROM t", new SqlFormattingOptions(SqlFormattingMode.PREFIXED, 2)));
        assertEquals("SELECT\na\n,b\nFROM t", format("SELECT a, b FROM t", new SqlFormattingOptions(SqlFormattingMode.PREFIXED, 0)));
    }

    @Test
    void negative_indent_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new SqlFormattingOptions(SqlFormattingMode.PREFIXED, -1));
    }

    @Test
    void span_clauses_stay_on_their_keyword_line() {
        assertEquals("SELECT\n    a\nFROM t\nWHERE x = 1\nORDER BY\n    a",
                format("SELECT a FROM t WHERE x = 1 ORDER BY a", PREFIXED));
    }

    @Test
    void distinct_stays_on_the_select_line() {
        assertEquals("SELECT DISTINCT\n    a\nFROM t", format("SELECT DISTINCT a FROM t", PREFIXED));
    }

    @Test
    void function_arguments_stay_inline() {
        assertEquals("SELECT\n    COUNT(*)\n   ,COALESCE(a, b)\nFROM t",
                format("SELECT COUNT(*), COALESCE(a, b) FROM t", PREFIXED));
    }

    @Test
    void join_lines() {
        assertEquals("SELECT\n    a\nFROM t\nLEFT OUTER JOIN u ON u.id = t.id\nJOIN v ON v.id = t.id\nWHERE x = 1",
                format("SELECT a FROM t LEFT OUTER JOIN u ON u.id = t.id JOIN v ON v.id = t.id WHERE x = 1", PREFIXED));
    }

    @Test
    void subquery_in_from_opens_an_indented_block() {
        assertEquals("SELECT\n    a\nFROM (\n    SELECT\n        b\n    FROM u\n) x",
                format("SELECT a FROM (SELECT b FROM u) x", PREFIXED));
    }

    @Test
    void subquery_in_where_opens_an_indented_block() {
        assertEquals("SELECT\n    a\nFROM t\nWHERE id IN (\n    SELECT\n        id\n    FROM u\n)",
                format("SELECT a FROM t WHERE id IN (SELECT id FROM u)", PREFIXED));
    }

    @Test
    void with_clause_layout() {
        assertEquals("WITH\ncte AS (\n    SELECT\n        a\n    FROM t\n)\nSELECT\n    a\nFROM cte",
                format("WITH cte AS (SELECT a FROM t) SELECT a FROM cte", PREFIXED));
    }

    @Test
    void set_operator_gets_its_own_line() {
        assertEquals("SELECT\n    a\nFROM t\nUNION ALL\nSELECT\n    b\nFROM u",
                format("SELECT a FROM t UNION ALL SELECT b FROM u", PREFIXED));
    }

    @Test
    void update_set_is_a_list_clause() {
        assertEquals("UPDATE t\nSET\n    a = 1\n   ,b = 2\nWHERE id = 3",
                format("UPDATE t SET a = 1, b = 2 WHERE id = 3", PREFIXED));
    }

    @Test
    void insert_value_rows_are_list_items() {
        assertEquals("INSERT INTO t(a, b)\nVALUES\n    (1, 2)\n   ,(3, 4)",
                format("INSERT INTO t (a, b) VALUES (1, 2), (3, 4)", PREFIXED));
    }
}
