package domain.sql;

import java.util.List;
import java.util.Objects;

public final class SqlTokenPart implements SqlSegmentPart {

    private final SqlToken token;

    SqlTokenPart(SqlToken token) {
        this.token = Objects.requireNonNull(token, "token");
    }

    public SqlToken getToken() {
        return token;
    }

    @Override
    public void appendTokens(List<String> out) {
        out.add(token.getText());
    }

    @Override
    public String toString() {
        return token.getText();
    }
}
