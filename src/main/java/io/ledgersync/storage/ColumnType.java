package io.ledgersync.storage;

import io.ledgersync.model.Variant;

public enum ColumnType {
    TEXT("TEXT"),
    INTEGER("INTEGER"),
    REAL("REAL"),
    BOOLEAN("INTEGER");

    private final String sqlType;

    ColumnType(String sqlType) {
        this.sqlType = sqlType;
    }

    public String sqlType() {
        return sqlType;
    }

    /**
     * Value as bound to a statement. SQLite column affinity handles the remaining conversions.
     */
    public Object toSql(Variant value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (this == BOOLEAN && value.kind() == Variant.Kind.BOOLEAN) {
            return ((Boolean) value.value()) ? 1L : 0L;
        }
        if (this == TEXT && value.kind() != Variant.Kind.STRING) {
            return value.asText();
        }
        return value.value();
    }
}
