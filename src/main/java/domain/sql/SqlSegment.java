package domain.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named clause body ("Select", "From", "Where", ...) holding the clause's tokens and owned
 * subqueries in source order. The clause keyword itself is not part of the segment.
 */
public final class SqlSegment {

    public static final String SELECT = "Select";
    public static final String FROM = "From";
    public static final String WHERE = "Where";
    public static final String GROUP_BY = "GroupBy";
    public static final String HAVING = "Having";
    public static final String ORDER_BY = "OrderBy";
    public static final String LIMIT = "Limit";
    public static final String OFFSET = "Offset";
    public static final String TAIL = "Tail";
    public static final String TARGET = "Target";
    public static final String OUTPUT = "Output";
    public static final String VALUES = "Values";
    public static final String RETURNING = "Returning";
    public static final String SET = "Set";
    public static final String USING = "Using";

    /** Segments whose items may carry an alias. */
    private static final Set<String> ALIASED = Set.of(SELECT, OUTPUT);

    private final String name;
    private final SqlSyntaxOptions syntaxOptions;
    private final List<SqlSegmentPart> parts;

    SqlSegment(String name, SqlSyntaxOptions syntaxOptions) {
        this(name, syntaxOptions, List.of());
    }

    SqlSegment(String name, SqlSyntaxOptions syntaxOptions, List<SqlSegmentPart> parts) {
        this.name = Objects.requireNonNull(name, "name");
        this.syntaxOptions = (syntaxOptions == null) ? SqlSyntaxOptions.DEFAULT : syntaxOptions;
        this.parts = new ArrayList<>(parts);
    }

    public String getName() {
        return name;
    }

    public List<SqlSegmentPart> getParts() {
        return Collections.unmodifiableList(parts);
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    /** Statements owned by this segment, in source order. */
    public List<SqlStatement> getSubqueries() {
        List<SqlStatement> out = new ArrayList<>();
        for (SqlSegmentPart p : parts) {
            if (p instanceof SqlSubqueryPart sp) out.add(sp.getStatement());
        }
        return out;
    }

    /**
     * Top-level comma-separated items of this segment. Aliases are inferred for the select list
     * and OUTPUT only. Recomputed on every call.
     */
    public List<SqlExpression> getExpressions() {
        boolean inferAlias = ALIASED.contains(name);
        List<SqlExpression> out = new ArrayList<>();
        for (List<SqlSegmentPart> item : SqlTopLevelSplitter.splitTopLevelByComma(parts)) {
            if (!item.isEmpty()) out.add(SqlExpression.of(item, inferAlias));
        }
        return out;
    }

    /**
     * Appends a SQL fragment. Parenthesized statements in the fragment become subqueries.
     *
     * @throws IllegalArgumentException when {@code sql} is blank
     */
    public void addRaw(String sql) {
        requireText(sql, "sql");
        parts.addAll(SqlParser.lowerFragment(sql, syntaxOptions));
    }

    /** Appends {@code element}, preceded by a comma when the segment already has content. */
    public void addCommaSeparatedElement(String element) {
        requireText(element, "element");
        if (!isEmpty()) parts.add(new SqlTokenPart(SqlToken.symbol(",", -1)));
        addRaw(element);
    }

    /**
     * Appends {@code expression}, joined with {@code conjunction} (e.g. AND, OR) when the segment
     * already has content.
     *
     * @throws IllegalArgumentException when {@code expression} is blank, or when the segment is
     *                                  non-empty and {@code conjunction} is blank
     */
    public void addConjunction(String conjunction, String expression) {
        requireText(expression, "expression");
        if (!isEmpty()) {
            requireText(conjunction, "conjunction");
            addRaw(conjunction);
        }
        addRaw(expression);
    }

    public String toSql() {
        List<String> tokens = new ArrayList<>(parts.size() + 4);
        for (SqlSegmentPart p : parts) p.appendTokens(tokens);
        return SqlTokenJoiner.join(tokens);
    }

    @Override
    public String toString() {
        return name + ": " + toSql();
    }

    private static void requireText(String s, String label) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException(label + " is blank");
    }
}
