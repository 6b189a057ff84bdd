package domain.sql;

public enum StatementKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE
}
