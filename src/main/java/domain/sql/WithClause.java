package domain.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class WithClause {

    private final boolean recursive;
    private final List<CteDefinition> definitions;

    WithClause(boolean recursive, List<CteDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("WITH clause needs at least one definition");
        }
        this.recursive = recursive;
        this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
    }

    public boolean isRecursive() {
        return recursive;
    }

    public List<CteDefinition> getDefinitions() {
        return definitions;
    }

    public String toSql() {
        StringBuilder sb = new StringBuilder("WITH ");
        if (recursive) sb.append("RECURSIVE ");
        for (int i = 0; i < definitions.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(definitions.get(i).toSql());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toSql();
    }
}
