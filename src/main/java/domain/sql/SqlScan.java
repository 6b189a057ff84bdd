package domain.sql;

/**
 * Character cursor shared by the tokenizer and the script splitter.
 *
 * <p>Readers for quoted text, brackets and block comments never fail: when the closing
 * delimiter is missing they consume the rest of the input and raise {@link #truncated}.</p>
 */
final class SqlScan {
    final String s;
    int pos = 0;
    boolean truncated = false;

    SqlScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    char peekAt(int offset) {
        int p = pos + offset;
        return (p >= 0 && p < s.length()) ? s.charAt(p) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    String readSpaces() {
        int start = pos;
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    boolean peekIsLineComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '-' && s.charAt(pos + 1) == '-';
    }

    boolean peekIsBlockComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '/' && s.charAt(pos + 1) == '*';
    }

    boolean peekIsQuote() {
        char c = peek();
        return c == '\'' || c == '"';
    }

    boolean peekIsBracket() {
        return peek() == '[';
    }

    String readLineComment() {
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\n') break;
        }
        return s.substring(start, pos);
    }

    String readBlockComment() {
        int start = pos;
        pos += 2; // /*
        while (pos + 1 < s.length()) {
            if (s.charAt(pos) == '*' && s.charAt(pos + 1) == '/') {
                pos += 2;
                return s.substring(start, pos);
            }
            pos++;
        }
        pos = s.length();
        truncated = true;
        return s.substring(start);
    }

    /**
     * Reads a quoted run starting at the current quote character. A doubled delimiter is an
     * escaped delimiter and does not close the run.
     */
    String readQuoted() {
        int start = pos;
        char delimiter = s.charAt(pos++);
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == delimiter) {
                if (pos < s.length() && s.charAt(pos) == delimiter) {
                    pos++;
                    continue;
                }
                return s.substring(start, pos);
            }
        }
        truncated = true;
        return s.substring(start);
    }

    String readBracketed() {
        int start = pos;
        pos++; // [
        while (pos < s.length()) {
            if (s.charAt(pos++) == ']') return s.substring(start, pos);
        }
        truncated = true;
        return s.substring(start);
    }
}
