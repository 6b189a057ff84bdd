package domain.sql;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Dialect-specific lexical settings: which characters may begin (and continue) an identifier,
 * e.g. {@code @p}, {@code :p}, {@code #temp}, {@code $1}.
 *
 * <p>The auto-parameter prefix is always part of the identifier prefix set.</p>
 */
public final class SqlSyntaxOptions {

    public static final SqlSyntaxOptions SQL_SERVER = new SqlSyntaxOptions("SqlServer", List.of('@', '#', '$'), '@');
    public static final SqlSyntaxOptions ORACLE = new SqlSyntaxOptions("Oracle", List.of(':'), ':');
    public static final SqlSyntaxOptions MY_SQL = new SqlSyntaxOptions("MySql", List.of('@'), '@');
    public static final SqlSyntaxOptions SQLITE = new SqlSyntaxOptions("Sqlite", List.of('@', ':', '$', '?'), '@');
    public static final SqlSyntaxOptions POSTGRE_SQL = new SqlSyntaxOptions("PostgreSql", List.of('$'), '$');

    public static final SqlSyntaxOptions DEFAULT = SQL_SERVER;

    private final String name;
    private final Set<Character> identifierPrefixes;
    private final char autoParameterPrefix;

    public SqlSyntaxOptions(Collection<Character> identifierPrefixes, char autoParameterPrefix) {
        this("Custom", identifierPrefixes, autoParameterPrefix);
    }

    private SqlSyntaxOptions(String name, Collection<Character> identifierPrefixes, char autoParameterPrefix) {
        if (identifierPrefixes == null || identifierPrefixes.isEmpty()) {
            throw new IllegalArgumentException("identifierPrefixes must contain at least one character");
        }
        Set<Character> prefixes = new LinkedHashSet<>(identifierPrefixes);
        prefixes.add(autoParameterPrefix);

        this.name = name;
        this.identifierPrefixes = Collections.unmodifiableSet(prefixes);
        this.autoParameterPrefix = autoParameterPrefix;
    }

    public Set<Character> getIdentifierPrefixes() {
        return identifierPrefixes;
    }

    public char getAutoParameterPrefix() {
        return autoParameterPrefix;
    }

    public boolean isIdentifierPrefix(char c) {
        return identifierPrefixes.contains(c);
    }

    @Override
    public String toString() {
        return name + identifierPrefixes;
    }
}
