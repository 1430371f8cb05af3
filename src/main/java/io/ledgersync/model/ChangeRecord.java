package io.ledgersync.model;

import io.ledgersync.clock.LogicalTimestamp;

import java.util.Objects;

/**
 * Last-writer-wins assignment of one column on one entity row.
 */
public record ChangeRecord(
        String dataset,
        String row,
        String column,
        Variant value,
        LogicalTimestamp timestamp
) {
    public static final String PREFS_DATASET = "prefs";

    public ChangeRecord {
        requireText(dataset, "dataset");
        requireText(row, "row");
        requireText(column, "column");
        value = value == null ? Variant.ofNull() : value;
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public boolean isPreference() {
        return PREFS_DATASET.equals(dataset);
    }

    public CellKey cell() {
        return new CellKey(dataset, row, column);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
