package domain.sql;

import java.util.Objects;

public final class SqlFormattingOptions {

    public static final SqlFormattingOptions DEFAULT = new SqlFormattingOptions(SqlFormattingMode.INLINE, 4);

    private final SqlFormattingMode mode;
    private final int indentSize;

    /**
     * @throws IllegalArgumentException when {@code indentSize} is negative
     */
    public SqlFormattingOptions(SqlFormattingMode mode, int indentSize) {
        if (indentSize < 0) throw new IllegalArgumentException("indentSize must be >= 0: " + indentSize);
        this.mode = Objects.requireNonNull(mode, "mode");
        this.indentSize = indentSize;
    }

    public SqlFormattingMode getMode() {
        return mode;
    }

    public int getIndentSize() {
        return indentSize;
    }

    @Override
    public String toString() {
        return mode + "(indent=" + indentSize + ")";
    }
}
