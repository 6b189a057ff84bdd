package domain.sql;

import java.util.Objects;

/**
 * A single lexical token.
 *
 * <p>{@code normalized} is the upper-cased text for keywords and the verbatim text for
 * everything else, so clause matching never depends on source casing.</p>
 */
public final class SqlToken {

    private final String text;
    private final String normalized;
    private final boolean identifier;
    private final boolean keyword;
    private final int position;

    private SqlToken(String text, String normalized, boolean identifier, boolean keyword, int position) {
        this.text = Objects.requireNonNull(text, "text");
        this.normalized = Objects.requireNonNull(normalized, "normalized");
        this.identifier = identifier;
        this.keyword = keyword;
        this.position = position;
    }

    static SqlToken keyword(String text, String upper, int position) {
        return new SqlToken(text, upper, false, true, position);
    }

    static SqlToken identifier(String text, int position) {
        return new SqlToken(text, text, true, false, position);
    }

    static SqlToken literal(String text, int position) {
        return new SqlToken(text, text, false, false, position);
    }

    static SqlToken symbol(String text, int position) {
        return new SqlToken(text, text, false, false, position);
    }

    public String getText() {
        return text;
    }

    public String getNormalized() {
        return normalized;
    }

    public boolean isIdentifier() {
        return identifier;
    }

    public boolean isKeyword() {
        return keyword;
    }

    /** Character offset in the tokenized text, or -1 for synthesized tokens. */
    public int getPosition() {
        return position;
    }

    boolean isKeyword(String upper) {
        return keyword && normalized.equals(upper);
    }

    boolean isSymbol(String sym) {
        return !identifier && !keyword && text.equals(sym);
    }

    @Override
    public String toString() {
        return text;
    }
}
