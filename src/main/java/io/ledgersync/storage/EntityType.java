package io.ledgersync.storage;

import java.util.List;
import java.util.Optional;

/**
 * A replicated dataset with a fixed set of columns. The row id column {@code id} is implicit.
 */
public interface EntityType {
    String dataset();

    List<ColumnDef> columns();

    default Optional<ColumnDef> column(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ColumnDef column : columns()) {
            if (column.name().equals(name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    default boolean hasColumn(String name) {
        return column(name).isPresent();
    }
}
