package domain.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlTokenizerTest {

    private static List<String> texts(List<SqlToken> tokens) {
        return tokens.stream().map(SqlToken::getText).toList();
    }

    @Test
    void drops_whitespace_and_comments_and_keeps_quoted_runs_whole() {
        String sql = "SELECT [Order Id], \"x y\", 'it''s' FROM t -- tail;\n/* block */";

        List<SqlToken> tokens = SqlTokenizer.tokenize(sql, SqlSyntaxOptions.DEFAULT);

        assertEquals(List.of("SELECT", "[Order Id]", ",", "\"x y\"", ",", "'it''s'", "FROM", "t"), texts(tokens));
        assertTrue(tokens.get(1).isIdentifier());
        assertTrue(tokens.get(3).isIdentifier());
        assertFalse(tokens.get(5).isIdentifier());
    }

    @Test
    void keywords_are_matched_case_insensitively_but_keep_source_text() {
        List<SqlToken> tokens = SqlTokenizer.tokenize("select a From t", SqlSyntaxOptions.DEFAULT);

        assertTrue(tokens.get(0).isKeyword());
        assertEquals("select", tokens.get(0).getText());
        assertEquals("SELECT", tokens.get(0).getNormalized());
        assertTrue(tokens.get(2).isKeyword("FROM"));
        assertTrue(tokens.get(1).isIdentifier());
    }

    @Test
    void two_char_operators_are_single_tokens() {
        List<SqlToken> tokens = SqlTokenizer.tokenize("a>=1 AND b<>c AND d!=e AND x::int", SqlSyntaxOptions.DEFAULT);

        List<String> t = texts(tokens);
        assertTrue(t.contains(">="), t.toString());
        assertTrue(t.contains("<>"), t.toString());
        assertTrue(t.contains("!="), t.toString());
        assertTrue(t.contains("::"), t.toString());
        assertEquals(List.of("x", "::", "int"), t.subList(t.size() - 3, t.size()));
    }

    @Test
    void parameter_prefix_depends_on_dialect() {
        List<SqlToken> sqlServer = SqlTokenizer.tokenize("@id :id", SqlSyntaxOptions.SQL_SERVER);
        assertEquals(List.of("@id", ":", "id"), texts(sqlServer));
        assertTrue(sqlServer.get(0).isIdentifier());

        List<SqlToken> oracle = SqlTokenizer.tokenize(":id", SqlSyntaxOptions.ORACLE);
        assertEquals(List.of(":id"), texts(oracle));
        assertTrue(oracle.get(0).isIdentifier());
    }

    @Test
    void numbers_with_decimal_point_are_one_literal() {
        List<SqlToken> tokens = SqlTokenizer.tokenize("1.5 + 20", SqlSyntaxOptions.DEFAULT);
        assertEquals(List.of("1.5", "+", "20"), texts(tokens));
    }

    @Test
    void tokens_carry_their_character_offset() {
        List<SqlToken> tokens = SqlTokenizer.tokenize("SELECT  a", SqlSyntaxOptions.DEFAULT);
        assertEquals(0, tokens.get(0).getPosition());
        assertEquals(8, tokens.get(1).getPosition());
    }

    @Test
    void unterminated_literal_is_consumed_to_end_and_flagged() {
        SqlTokenizer tokenizer = new SqlTokenizer("SELECT 'abc FROM t", SqlSyntaxOptions.DEFAULT);
        List<SqlToken> tokens = tokenizer.tokenize();

        assertTrue(tokenizer.isTruncated());
        assertEquals(List.of("SELECT", "'abc FROM t"), texts(tokens));
    }

    @Test
    void terminated_input_is_not_flagged() {
        SqlTokenizer tokenizer = new SqlTokenizer("SELECT 'abc' /* x */", SqlSyntaxOptions.DEFAULT);
        tokenizer.tokenize();
        assertFalse(tokenizer.isTruncated());
    }
}
