package io.ledgersync.storage;

public record ColumnDef(String name, ColumnType type) {
    public static ColumnDef text(String name) {
        return new ColumnDef(name, ColumnType.TEXT);
    }

    public static ColumnDef integer(String name) {
        return new ColumnDef(name, ColumnType.INTEGER);
    }

    public static ColumnDef real(String name) {
        return new ColumnDef(name, ColumnType.REAL);
    }

    public static ColumnDef bool(String name) {
        return new ColumnDef(name, ColumnType.BOOLEAN);
    }
}
