package domain.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a script into statements at top-level semicolons, ignoring strings, quoted and
 * bracketed identifiers, comments and parentheses. Blank pieces are dropped.
 */
public final class SqlScriptSplitter {
    private SqlScriptSplitter() {
    }

    public static List<String> split(String script) {
        List<String> out = new ArrayList<>();
        if (script == null || script.isBlank()) return out;

        StringBuilder cur = new StringBuilder();
        SqlScan st = new SqlScan(script);
        int depth = 0;

        while (st.hasNext()) {
            if (st.peekIsLineComment()) {
                cur.append(st.readLineComment());
                continue;
            }
            if (st.peekIsBlockComment()) {
                cur.append(st.readBlockComment());
                continue;
            }
            if (st.peekIsQuote()) {
                cur.append(st.readQuoted());
                continue;
            }
            if (st.peekIsBracket()) {
                cur.append(st.readBracketed());
                continue;
            }

            char ch = st.read();
            if (ch == '(') depth++;
            else if (ch == ')') depth = Math.max(0, depth - 1);

            if (ch == ';' && depth == 0) {
                addIfNotBlank(out, cur);
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }

        addIfNotBlank(out, cur);
        return out;
    }

    private static void addIfNotBlank(List<String> out, StringBuilder cur) {
        String piece = cur.toString().trim();
        if (!piece.isEmpty() && !isCommentOnly(piece)) out.add(piece);
    }

    /** A trailing piece holding only comments is not a statement. */
    private static boolean isCommentOnly(String piece) {
        SqlScan st = new SqlScan(piece);
        while (st.hasNext()) {
            st.readSpaces();
            if (!st.hasNext()) break;
            if (st.peekIsLineComment()) {
                st.readLineComment();
            } else if (st.peekIsBlockComment()) {
                st.readBlockComment();
            } else {
                return false;
            }
        }
        return true;
    }
}
