package domain.sql;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Clause-aware multi-line SQL layout.
 *
 * <p>Works on tokens only, so formatting already formatted SQL gives the same text back.
 * Rules:
 * <ul>
 *   <li>clause keywords start a new line at the current nesting indent</li>
 *   <li>list clauses (SELECT, GROUP BY, ORDER BY, VALUES, SET, OUTPUT, RETURNING) put each
 *   top-level item on its own line, one indent deeper</li>
 *   <li>a parenthesis whose direct content holds a clause keyword opens a nested block</li>
 *   <li>JOIN starts a line unless a join modifier already did</li>
 * </ul>
 */
final class SqlPrettifier {

    /** Keywords whose presence directly inside parentheses makes the parentheses a block. */
    private static final Set<String> CLAUSE_KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "GROUP", "HAVING", "ORDER", "LIMIT", "OFFSET", "VALUES",
            "RETURNING", "OUTPUT", "SET", "INSERT", "UPDATE", "DELETE", "UNION", "INTERSECT", "EXCEPT"
    );

    private static final Set<String> JOIN_MODIFIERS = Set.of("INNER", "LEFT", "RIGHT", "FULL", "CROSS");

    private enum ClauseContext {
        NONE,
        SELECT_LIST,
        GROUP_BY_LIST,
        ORDER_BY_LIST,
        VALUES_LIST,
        SET_LIST,
        OUTPUT_LIST,
        RETURNING_LIST
    }

    private SqlPrettifier() {
    }

    static String format(String sql, SqlFormattingOptions options, SqlSyntaxOptions syntaxOptions) {
        if (sql == null || sql.isEmpty()) return sql;

        SqlFormattingOptions opts = (options == null) ? SqlFormattingOptions.DEFAULT : options;
        if (opts.getMode() == SqlFormattingMode.INLINE) return sql;

        List<SqlToken> tokens = SqlTokenizer.tokenize(sql, syntaxOptions);
        boolean commaAtLineStart = opts.getMode() == SqlFormattingMode.PREFIXED;
        return new Layout(tokens, opts.getIndentSize(), commaAtLineStart).run();
    }

    private static final class Line {
        final int indent;
        final List<String> tokens = new ArrayList<>();
        boolean leadingComma;

        Line(int indent) {
            this.indent = indent;
        }
    }

    /** Enclosing list-clause state, restored when the parenthesis closes. */
    private static final class ParenFrame {
        final boolean multiline;
        final ClauseContext clause;
        final int clauseIndent;
        final int clauseDepth;
        final boolean firstItem;
        final boolean pendingComma;

        ParenFrame(boolean multiline, ClauseContext clause, int clauseIndent, int clauseDepth,
                   boolean firstItem, boolean pendingComma) {
            this.multiline = multiline;
            this.clause = clause;
            this.clauseIndent = clauseIndent;
            this.clauseDepth = clauseDepth;
            this.firstItem = firstItem;
            this.pendingComma = pendingComma;
        }
    }

    private static final class Layout {
        private final List<SqlToken> tokens;
        private final int indentSize;
        private final boolean commaAtLineStart;

        private final List<Line> lines = new ArrayList<>();
        private final Deque<ParenFrame> parens = new ArrayDeque<>();
        private Line current;
        private int indentLevel;

        private ClauseContext clause = ClauseContext.NONE;
        private int clauseIndent;
        private int clauseDepth;
        private boolean firstItem;
        private boolean pendingComma;

        Layout(List<SqlToken> tokens, int indentSize, boolean commaAtLineStart) {
            this.tokens = tokens;
            this.indentSize = indentSize;
            this.commaAtLineStart = commaAtLineStart;
        }

        String run() {
            for (int i = 0; i < tokens.size(); i++) {
                int consumed = handleClauseStart(i);
                if (consumed > 0) {
                    i += consumed - 1;
                    continue;
                }

                SqlToken t = tokens.get(i);

                if (t.isSymbol(",") && clause != ClauseContext.NONE && indentLevel == clauseDepth) {
                    if (commaAtLineStart) {
                        pendingComma = true;
                    } else {
                        append(",");
                        commit();
                        firstItem = true;
                    }
                    continue;
                }

                if (t.isSymbol(")")) {
                    closeParenthesis();
                    continue;
                }

                prepareClauseLine();

                if (t.isSymbol("(")) {
                    append("(");
                    boolean multiline = shouldExpand(i + 1);
                    parens.push(new ParenFrame(multiline, clause, clauseIndent, clauseDepth, firstItem, pendingComma));
                    indentLevel++;
                    if (multiline) commit();
                    continue;
                }

                append(t.getText());
            }
            commit();
            return render();
        }

        private void closeParenthesis() {
            ParenFrame frame = parens.isEmpty() ? null : parens.pop();
            indentLevel = Math.max(0, indentLevel - 1);
            if (frame != null) {
                clause = frame.clause;
                clauseIndent = frame.clauseIndent;
                clauseDepth = frame.clauseDepth;
                firstItem = frame.firstItem;
                pendingComma = frame.pendingComma;
                if (frame.multiline) commit();
            }
            append(")");
        }

        /** Returns the number of tokens consumed as a clause start, or 0. */
        private int handleClauseStart(int i) {
            SqlToken t = tokens.get(i);
            if (!t.isKeyword()) return 0;

            int base = indentLevel * indentSize;
            switch (t.getNormalized()) {
                case "WITH":
                    return ownLine(i, keywordAt(i + 1, "RECURSIVE") ? 2 : 1);
                case "UNION":
                case "INTERSECT":
                case "EXCEPT":
                    return ownLine(i, (keywordAt(i + 1, "ALL") || keywordAt(i + 1, "DISTINCT")) ? 2 : 1);
                case "SELECT":
                    return openList(ClauseContext.SELECT_LIST, i, keywordAt(i + 1, "DISTINCT") ? 2 : 1);
                case "VALUES":
                    return openList(ClauseContext.VALUES_LIST, i, 1);
                case "SET":
                    return openList(ClauseContext.SET_LIST, i, 1);
                case "OUTPUT":
                    return openList(ClauseContext.OUTPUT_LIST, i, 1);
                case "RETURNING":
                    return openList(ClauseContext.RETURNING_LIST, i, 1);
                case "GROUP":
                    return keywordAt(i + 1, "BY") ? openList(ClauseContext.GROUP_BY_LIST, i, 2) : 0;
                case "ORDER":
                    return keywordAt(i + 1, "BY") ? openList(ClauseContext.ORDER_BY_LIST, i, 2) : 0;
                case "FROM":
                case "WHERE":
                case "HAVING":
                case "LIMIT":
                case "OFFSET":
                case "USING":
                case "INSERT":
                case "UPDATE":
                case "DELETE":
                    resetClause();
                    startNewLine(base);
                    append(t.getText());
                    return 1;
                case "OUTER":
                    if (!keywordAt(i + 1, "JOIN")) return 0;
                    resetClause();
                    append(t.getText());
                    return 1;
                case "JOIN":
                    resetClause();
                    if (current == null || current.tokens.isEmpty() || !endsWithJoinModifier(current)) {
                        startNewLine(base);
                    }
                    append(t.getText());
                    return 1;
                default:
                    if (JOIN_MODIFIERS.contains(t.getNormalized()) && leadsToJoin(i + 1)) {
                        resetClause();
                        startNewLine(base);
                        append(t.getText());
                        return 1;
                    }
                    return 0;
            }
        }

        private int ownLine(int i, int count) {
            resetClause();
            startNewLine(indentLevel * indentSize);
            for (int k = 0; k < count; k++) append(tokens.get(i + k).getText());
            commit();
            return count;
        }

        private int openList(ClauseContext ctx, int i, int count) {
            int base = indentLevel * indentSize;
            clause = ctx;
            firstItem = true;
            pendingComma = false;
            clauseIndent = base;
            clauseDepth = indentLevel;
            startNewLine(base);
            for (int k = 0; k < count; k++) append(tokens.get(i + k).getText());
            commit();
            return count;
        }

        private void resetClause() {
            clause = ClauseContext.NONE;
            firstItem = false;
            pendingComma = false;
            clauseIndent = indentLevel * indentSize;
            clauseDepth = indentLevel;
        }

        private void prepareClauseLine() {
            if (clause == ClauseContext.NONE) return;

            if (firstItem) {
                startNewLine(clauseIndent + indentSize);
                firstItem = false;
                pendingComma = false;
                return;
            }
            if (commaAtLineStart && pendingComma) {
                startNewLine(clauseIndent + Math.max(indentSize - 1, 0));
                current.tokens.add(",");
                current.leadingComma = true;
                pendingComma = false;
                return;
            }
            if (current == null) startNewLine(clauseIndent + indentSize);
        }

        private boolean shouldExpand(int start) {
            int depth = 1;
            for (int j = start; j < tokens.size(); j++) {
                SqlToken t = tokens.get(j);
                if (t.isSymbol("(")) {
                    depth++;
                } else if (t.isSymbol(")")) {
                    depth--;
                    if (depth == 0) return false;
                } else if (depth == 1 && t.isKeyword() && CLAUSE_KEYWORDS.contains(t.getNormalized())) {
                    return true;
                }
            }
            return false;
        }

        private boolean keywordAt(int j, String keyword) {
            return j < tokens.size() && tokens.get(j).isKeyword(keyword);
        }

        private boolean leadsToJoin(int j) {
            if (keywordAt(j, "JOIN")) return true;
            return keywordAt(j, "OUTER") && keywordAt(j + 1, "JOIN");
        }

        private static boolean endsWithJoinModifier(Line line) {
            String last = line.tokens.get(line.tokens.size() - 1).toUpperCase(Locale.ROOT);
            return JOIN_MODIFIERS.contains(last) || last.equals("OUTER");
        }

        private int effectiveIndent() {
            if (current != null) return current.indent;
            if (clause != ClauseContext.NONE) return clauseIndent + indentSize;
            return indentLevel * indentSize;
        }

        private void append(String text) {
            if (current == null) current = new Line(effectiveIndent());
            current.tokens.add(text);
        }

        private void startNewLine(int indent) {
            commit();
            current = new Line(indent);
        }

        private void commit() {
            if (current != null && !current.tokens.isEmpty()) lines.add(current);
            current = null;
        }

        private String render() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < lines.size(); i++) {
                Line line = lines.get(i);
                if (i > 0) sb.append('\n');
                sb.append(" ".repeat(line.indent));
                sb.append(SqlTokenJoiner.join(line.tokens, line.leadingComma));
            }
            return sb.toString();
        }
    }
}
