package domain.sql;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds parameterized SQL text from literal pieces and values.
 *
 * <p>Each value becomes a placeholder named {@code <autoParameterPrefix>p<N>} ({@code @p0} on
 * SQL Server, {@code :p0} on Oracle). Names already bound through {@link #bind} are skipped.
 * A value appended again under the same argument name reuses its placeholder.</p>
 *
 * <pre>
 * SqlParameterizedBuilder b = new SqlParameterizedBuilder(SqlSyntaxOptions.SQL_SERVER);
 * b.appendLiteral("SELECT * FROM users WHERE id =").appendValue("id", 42);
 * b.getSql();        // "SELECT * FROM users WHERE id = @p0 "
 * b.getParameters(); // @p0 -&gt; 42
 * </pre>
 */
public final class SqlParameterizedBuilder {

    private final SqlSyntaxOptions syntaxOptions;
    private final StringBuilder sql = new StringBuilder(128);
    private final Map<String, Object> parameters = new LinkedHashMap<>();
    private final Map<String, String> placeholderByArgument = new HashMap<>();
    private int parameterIndex;

    public SqlParameterizedBuilder(SqlSyntaxOptions syntaxOptions) {
        this.syntaxOptions = (syntaxOptions == null) ? SqlSyntaxOptions.DEFAULT : syntaxOptions;
    }

    public SqlSyntaxOptions getSyntaxOptions() {
        return syntaxOptions;
    }

    public SqlParameterizedBuilder appendLiteral(String text) {
        if (text != null) sql.append(text);
        return this;
    }

    /**
     * Appends a placeholder for {@code value}.
     *
     * @param argumentName name of the interpolated argument; {@code null} always allocates a new
     *                     placeholder
     */
    public SqlParameterizedBuilder appendValue(String argumentName, Object value) {
        String placeholder = (argumentName == null) ? null : placeholderByArgument.get(argumentName);
        if (placeholder == null) {
            placeholder = nextPlaceholder();
            parameters.put(placeholder, value);
            if (argumentName != null) placeholderByArgument.put(argumentName, placeholder);
        }
        appendPlaceholder(placeholder);
        return this;
    }

    /**
     * Binds an explicitly named parameter and appends it.
     *
     * @throws IllegalArgumentException when the name is blank or already bound
     */
    public SqlParameterizedBuilder bind(String parameterName, Object value) {
        if (parameterName == null || parameterName.isBlank()) {
            throw new IllegalArgumentException("parameterName is blank");
        }
        String name = parameterName.trim();
        if (parameters.containsKey(name)) {
            throw new IllegalArgumentException("parameter already bound: " + name);
        }
        parameters.put(name, value);
        appendPlaceholder(name);
        return this;
    }

    private String nextPlaceholder() {
        String name;
        do {
            name = syntaxOptions.getAutoParameterPrefix() + "p" + parameterIndex++;
        } while (parameters.containsKey(name));
        return name;
    }

    private void appendPlaceholder(String name) {
        sql.append(' ').append(name).append(' ');
    }

    /** SQL text built so far, placeholders padded with a space on each side. */
    public String getSql() {
        return sql.toString();
    }

    /** Parameters in first-use order. */
    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /** Parses the built text with this builder's syntax options. */
    public SqlQuery toQuery() {
        return SqlQueryAnalyzer.parse(getSql(), syntaxOptions);
    }

    @Override
    public String toString() {
        return getSql();
    }
}
