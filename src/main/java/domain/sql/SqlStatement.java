package domain.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base of the four statement kinds. A statement owns its segments, its optional WITH clause and
 * (through them) every nested statement.
 *
 * <p>Canonical SQL is rebuilt on every {@link #toSql()} call from the current segment contents;
 * absent or empty optional clauses are left out.</p>
 */
public abstract class SqlStatement {

    private final SqlSyntaxOptions syntaxOptions;
    private WithClause withClause;

    SqlStatement(SqlSyntaxOptions syntaxOptions) {
        this.syntaxOptions = (syntaxOptions == null) ? SqlSyntaxOptions.DEFAULT : syntaxOptions;
    }

    public abstract StatementKind getKind();

    /** Present segments in grammar order. */
    public abstract List<SqlSegment> getSegments();

    abstract void appendBody(StringBuilder sb);

    /** Directly nested statements in text order; segment subqueries by default. */
    List<SqlStatement> nestedStatements() {
        List<SqlStatement> out = new ArrayList<>();
        for (SqlSegment seg : getSegments()) out.addAll(seg.getSubqueries());
        return out;
    }

    public SqlSyntaxOptions getSyntaxOptions() {
        return syntaxOptions;
    }

    /** The WITH clause, or {@code null}. */
    public WithClause getWithClause() {
        return withClause;
    }

    void setWithClause(WithClause withClause) {
        this.withClause = withClause;
    }

    /**
     * This statement followed by every nested statement, depth-first: CTE bodies first, then
     * the nested statements in the order they appear in the text.
     */
    public List<SqlStatement> getAllStatements() {
        List<SqlStatement> out = new ArrayList<>();
        collect(out);
        return Collections.unmodifiableList(out);
    }

    private void collect(List<SqlStatement> out) {
        out.add(this);
        if (withClause != null) {
            for (CteDefinition d : withClause.getDefinitions()) d.getStatement().collect(out);
        }
        for (SqlStatement sub : nestedStatements()) sub.collect(out);
    }

    public String toSql() {
        StringBuilder sb = new StringBuilder(128);
        if (withClause != null) sb.append(withClause.toSql()).append(' ');
        appendBody(sb);
        return sb.toString();
    }

    public String toSql(SqlFormattingOptions options) {
        return SqlPrettifier.format(toSql(), options, syntaxOptions);
    }

    @Override
    public String toString() {
        return toSql();
    }

    SqlSegment newSegment(String name) {
        return new SqlSegment(name, syntaxOptions);
    }

    static boolean hasContent(SqlSegment seg) {
        return seg != null && !seg.isEmpty();
    }

    static void appendClause(StringBuilder sb, String keyword, SqlSegment seg) {
        if (!hasContent(seg)) return;
        sb.append(' ').append(keyword).append(' ').append(seg.toSql());
    }

    static List<SqlSegment> present(SqlSegment... segments) {
        List<SqlSegment> out = new ArrayList<>(segments.length);
        for (SqlSegment s : segments) {
            if (s != null) out.add(s);
        }
        return out;
    }
}
