package domain.output;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlFileNamePolicyTest {

    @Test
    void keeps_directories_and_replaces_unsafe_characters() {
        assertEquals(List.of("billing", "monthly_close.sql"), SqlFileNamePolicy.build("billing/monthly close.sql"));
    }

    @Test
    void parent_references_cannot_escape() {
        assertEquals(List.of("_", "etc", "x.sql"), SqlFileNamePolicy.build("../etc/x.sql"));
        assertEquals(List.of("a", "b.sql"), SqlFileNamePolicy.build("./a//b.sql"));
    }

    @Test
    void backslashes_are_separators() {
        assertEquals(List.of("a", "b.sql"), SqlFileNamePolicy.build("a\\b.sql"));
    }

    @Test
    void sql_extension_is_added_when_missing() {
        assertEquals(List.of("report.sql"), SqlFileNamePolicy.build("report"));
        assertEquals(List.of("UPPER.SQL"), SqlFileNamePolicy.build("UPPER.SQL"));
    }

    @Test
    void hidden_and_reserved_names_are_prefixed() {
        assertEquals(List.of("_CON.sql"), SqlFileNamePolicy.build("CON.sql"));
        assertEquals(List.of("_lpt1.sql"), SqlFileNamePolicy.build("lpt1.sql"));
        assertEquals(List.of("_hidden.sql"), SqlFileNamePolicy.build(".hidden.sql"));
    }

    @Test
    void empty_path_falls_back_to_unknown() {
        assertEquals(List.of("unknown.sql"), SqlFileNamePolicy.build(null));
        assertEquals(List.of("unknown.sql"), SqlFileNamePolicy.build("  "));
    }

    @Test
    void long_segments_are_cut() {
        String longName = "x".repeat(300);
        List<String> parts = SqlFileNamePolicy.build(longName + "/a.sql");
        assertEquals(180, parts.get(0).length());
    }
}
