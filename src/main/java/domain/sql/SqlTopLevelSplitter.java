package domain.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits segment parts by top-level commas.
 * <p>
 * Commas nested in parentheses or inside {@code CASE ... END} do not split. Subquery parts are
 * atomic.
 */
final class SqlTopLevelSplitter {

    private SqlTopLevelSplitter() {
    }

    static List<List<SqlSegmentPart>> splitTopLevelByComma(List<SqlSegmentPart> parts) {
        List<List<SqlSegmentPart>> out = new ArrayList<>();
        if (parts == null || parts.isEmpty()) return out;

        List<SqlSegmentPart> cur = new ArrayList<>();
        int depth = 0;
        int caseDepth = 0;

        for (SqlSegmentPart part : parts) {
            if (part instanceof SqlTokenPart tp) {
                SqlToken t = tp.getToken();
                if (depth == 0 && caseDepth == 0 && t.isSymbol(",")) {
                    out.add(cur);
                    cur = new ArrayList<>();
                    continue;
                }
                if (t.isSymbol("(")) depth++;
                else if (t.isSymbol(")")) depth = Math.max(0, depth - 1);
                else if (t.isKeyword("CASE")) caseDepth++;
                else if (t.isKeyword("END") && caseDepth > 0) caseDepth--;
            }
            cur.add(part);
        }
        out.add(cur);
        return out;
    }
}
