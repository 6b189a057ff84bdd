package domain.sql;

import java.util.List;

/**
 * One element of a {@link SqlSegment}: either a raw token ({@link SqlTokenPart}) or an owned
 * nested statement ({@link SqlSubqueryPart}).
 */
public interface SqlSegmentPart {

    /** Appends the canonical token texts of this part. */
    void appendTokens(List<String> out);
}
