package domain.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClauseKeywordRegistryTest {

    private static List<SqlToken> tokens(String sql) {
        return SqlTokenizer.tokenize(sql, SqlSyntaxOptions.DEFAULT);
    }

    @Test
    void multi_word_clause_needs_every_word() {
        assertTrue(ClauseKeywordRegistry.matches(tokens("GROUP BY a"), 0, ClauseStart.GROUP_BY));
        assertFalse(ClauseKeywordRegistry.matches(tokens("GROUP a"), 0, ClauseStart.GROUP_BY));
        assertFalse(ClauseKeywordRegistry.matches(tokens("GROUP"), 0, ClauseStart.GROUP_BY));
    }

    @Test
    void with_opens_a_select() {
        assertTrue(ClauseKeywordRegistry.matches(tokens("WITH x AS (SELECT 1) SELECT 1"), 0, ClauseStart.SELECT));
    }

    @Test
    void set_operators_share_one_clause_start() {
        assertTrue(ClauseKeywordRegistry.matches(tokens("union all"), 0, ClauseStart.SET_OPERATOR));
        assertTrue(ClauseKeywordRegistry.matches(tokens("EXCEPT"), 0, ClauseStart.SET_OPERATOR));
        assertTrue(ClauseKeywordRegistry.matches(tokens("INTERSECT"), 0, ClauseStart.SET_OPERATOR));
    }

    @Test
    void statement_end_is_end_of_input_or_semicolon() {
        List<SqlToken> t = tokens("a ; b");
        assertFalse(ClauseKeywordRegistry.matches(t, 0, ClauseStart.STATEMENT_END));
        assertTrue(ClauseKeywordRegistry.matches(t, 1, ClauseStart.STATEMENT_END));
        assertTrue(ClauseKeywordRegistry.matches(t, 3, ClauseStart.STATEMENT_END));
    }

    @Test
    void identifier_named_like_a_clause_does_not_match() {
        assertFalse(ClauseKeywordRegistry.matches(tokens("[FROM]"), 0, ClauseStart.FROM));
    }
}
