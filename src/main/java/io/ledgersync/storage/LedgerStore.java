package io.ledgersync.storage;

import io.ledgersync.clock.ReplicaClock;
import io.ledgersync.clock.LogicalTimestamp;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.model.EntityRow;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Keyed table store addressed by {@code (dataset, row)}. Writes go through a
 * {@link LedgerTransaction}.
 */
public interface LedgerStore {
    Optional<EntityType> resolveDataset(String dataset);

    /**
     * Column of a known dataset; empty for an unknown dataset or column.
     */
    Optional<ColumnDef> resolveColumn(String dataset, String name);

    LedgerTransaction begin();

    /**
     * Persisted replica clock, created with a fresh client id on first use.
     */
    ReplicaClock loadClock();

    /**
     * Reads one row outside of any open transaction.
     */
    Optional<EntityRow> find(String dataset, String id);

    /**
     * Physically deletes tombstoned rows. Returns the number of rows removed. Cell clocks and a
     * purge marker per row are kept; a row written again after the purge is re-created tombstoned.
     */
    int cleanup();

    /**
     * Committed local records not yet accepted by the relay, oldest first.
     */
    List<ChangeRecord> pendingOutgoing();

    void removeOutgoing(Collection<LogicalTimestamp> timestamps);
}
