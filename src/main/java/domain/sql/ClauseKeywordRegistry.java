package domain.sql;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword sequences that open each {@link ClauseStart}. Read-only after class initialization.
 */
final class ClauseKeywordRegistry {

    private static final Map<ClauseStart, List<List<String>>> SEQUENCES = build();

    private ClauseKeywordRegistry() {
    }

    private static Map<ClauseStart, List<List<String>>> build() {
        Map<ClauseStart, List<List<String>>> m = new EnumMap<>(ClauseStart.class);
        m.put(ClauseStart.SELECT, List.of(List.of("SELECT"), List.of("WITH")));
        m.put(ClauseStart.FROM, List.of(List.of("FROM")));
        m.put(ClauseStart.WHERE, List.of(List.of("WHERE")));
        m.put(ClauseStart.GROUP_BY, List.of(List.of("GROUP", "BY")));
        m.put(ClauseStart.HAVING, List.of(List.of("HAVING")));
        m.put(ClauseStart.ORDER_BY, List.of(List.of("ORDER", "BY")));
        m.put(ClauseStart.LIMIT, List.of(List.of("LIMIT")));
        m.put(ClauseStart.OFFSET, List.of(List.of("OFFSET")));
        m.put(ClauseStart.INTO, List.of(List.of("INTO")));
        m.put(ClauseStart.VALUES, List.of(List.of("VALUES")));
        m.put(ClauseStart.OUTPUT, List.of(List.of("OUTPUT")));
        m.put(ClauseStart.RETURNING, List.of(List.of("RETURNING")));
        m.put(ClauseStart.USING, List.of(List.of("USING")));
        m.put(ClauseStart.SET, List.of(List.of("SET")));
        m.put(ClauseStart.UPDATE, List.of(List.of("UPDATE")));
        m.put(ClauseStart.DELETE, List.of(List.of("DELETE")));
        m.put(ClauseStart.SET_OPERATOR, List.of(List.of("UNION"), List.of("EXCEPT"), List.of("INTERSECT")));
        m.put(ClauseStart.STATEMENT_END, List.of());
        return Collections.unmodifiableMap(m);
    }

    static List<List<String>> sequences(ClauseStart clause) {
        return SEQUENCES.getOrDefault(clause, List.of());
    }

    /**
     * Whether any of {@code candidates} starts at {@code position}.
     */
    static boolean matches(List<SqlToken> tokens, int position, ClauseStart... candidates) {
        if (candidates == null) return false;
        for (ClauseStart c : candidates) {
            if (c == ClauseStart.STATEMENT_END) {
                if (position >= tokens.size() || tokens.get(position).isSymbol(";")) return true;
                continue;
            }
            for (List<String> seq : sequences(c)) {
                if (matchesSequence(tokens, position, seq)) return true;
            }
        }
        return false;
    }

    private static boolean matchesSequence(List<SqlToken> tokens, int position, List<String> seq) {
        if (seq.isEmpty() || position + seq.size() > tokens.size()) return false;
        for (int i = 0; i < seq.size(); i++) {
            if (!tokens.get(position + i).isKeyword(seq.get(i))) return false;
        }
        return true;
    }
}
