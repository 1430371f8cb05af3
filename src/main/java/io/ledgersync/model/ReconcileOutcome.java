package io.ledgersync.model;

public enum ReconcileOutcome {
    CREATED,
    MATCHED,
    UPDATED,
    UNCHANGED
}
