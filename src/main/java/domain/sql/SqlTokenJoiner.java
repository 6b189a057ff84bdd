package domain.sql;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Joins token texts back into single-line SQL with conventional spacing.
 */
final class SqlTokenJoiner {

    private static final Set<String> NO_SPACE_BEFORE = Set.of(",", ")", ".", ";", ":", "]", "::");

    /** Words after which an opening parenthesis is separated by a space ({@code IN (}, {@code AS (}). */
    private static final Set<String> SPACE_BEFORE_PAREN = Set.of(
            "SELECT", "FROM", "WHERE", "GROUP", "HAVING", "ORDER", "LIMIT", "OFFSET", "VALUES",
            "IN", "EXISTS", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "ON", "USING",
            "RETURNING", "UPDATE", "INSERT", "DELETE", "SET", "AS", "DISTINCT", "WITH", "UNION",
            "INTERSECT", "EXCEPT", "CASE", "WHEN", "THEN", "ELSE", "AND", "OR", "NOT", "OUTPUT"
    );

    private SqlTokenJoiner() {
    }

    static String join(List<String> tokens) {
        return join(tokens, false);
    }

    /**
     * @param suppressSpaceAfterLeadingComma render a leading {@code ,} glued to the next token ({@code ,b})
     */
    static String join(List<String> tokens, boolean suppressSpaceAfterLeadingComma) {
        StringBuilder sb = new StringBuilder();
        String prev = null;
        int index = 0;

        for (String t : tokens) {
            if (t == null || t.isEmpty()) continue;

            if (prev != null) {
                boolean glued = suppressSpaceAfterLeadingComma && index == 1 && ",".equals(prev);
                if (!glued && needsSpace(prev, t)) sb.append(' ');
            }
            sb.append(t);
            prev = t;
            index++;
        }
        return sb.toString();
    }

    static boolean needsSpace(String prev, String token) {
        if (NO_SPACE_BEFORE.contains(token)) return false;
        if ("::".equals(prev)) return false;

        char last = prev.charAt(prev.length() - 1);
        boolean opener = last == '(' || last == '[' || last == '.';

        if ("(".equals(token)) {
            if (SPACE_BEFORE_PAREN.contains(prev.toUpperCase(Locale.ROOT))) return true;
            if (opener) return false;
            return !Character.isLetterOrDigit(last);
        }
        return !opener;
    }
}
