package domain.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One top-level item of a list segment, with its alias split off.
 *
 * <p>Alias inference: {@code expr AS name} is an explicit alias. Without {@code AS}, a trailing
 * identifier that is not a keyword and not preceded by {@code .} or {@code ::} is taken as an
 * implicit alias. The implicit rule is a heuristic and can misfire, e.g. {@code a + b} gives
 * alias {@code b}.</p>
 */
public final class SqlExpression {

    private final List<SqlSegmentPart> parts;
    private final String alias;
    private final boolean explicitAlias;

    private SqlExpression(List<SqlSegmentPart> parts, String alias, boolean explicitAlias) {
        this.parts = Collections.unmodifiableList(parts);
        this.alias = alias;
        this.explicitAlias = explicitAlias;
    }

    static SqlExpression of(List<SqlSegmentPart> item, boolean inferAlias) {
        List<SqlSegmentPart> parts = new ArrayList<>(item);
        int n = parts.size();
        if (!inferAlias || n < 2) return new SqlExpression(parts, null, false);

        SqlToken last = tokenOf(parts.get(n - 1));
        SqlToken beforeLast = tokenOf(parts.get(n - 2));
        if (last == null || !last.isIdentifier()) return new SqlExpression(parts, null, false);

        if (beforeLast != null && beforeLast.isKeyword("AS")) {
            if (n == 2) return new SqlExpression(parts, null, false);
            return new SqlExpression(new ArrayList<>(parts.subList(0, n - 2)), last.getText(), true);
        }
        if (beforeLast != null && (beforeLast.isSymbol(".") || beforeLast.isSymbol("::"))) {
            return new SqlExpression(parts, null, false);
        }
        return new SqlExpression(new ArrayList<>(parts.subList(0, n - 1)), last.getText(), false);
    }

    private static SqlToken tokenOf(SqlSegmentPart part) {
        return (part instanceof SqlTokenPart tp) ? tp.getToken() : null;
    }

    public List<SqlSegmentPart> getParts() {
        return parts;
    }

    /** Alias text, or {@code null} when none. */
    public String getAlias() {
        return alias;
    }

    public boolean hasAlias() {
        return alias != null;
    }

    public boolean isExplicitAlias() {
        return explicitAlias;
    }

    /** The expression without its alias. */
    public String getExpressionSql() {
        List<String> tokens = new ArrayList<>();
        for (SqlSegmentPart p : parts) p.appendTokens(tokens);
        return SqlTokenJoiner.join(tokens);
    }

    public String toSql() {
        String expr = getExpressionSql();
        if (alias == null) return expr;
        return expr + (explicitAlias ? " AS " : " ") + alias;
    }

    @Override
    public String toString() {
        return toSql();
    }
}
