package io.ledgersync.storage;

import io.ledgersync.clock.LogicalTimestamp;
import io.ledgersync.clock.ReplicaClock;
import io.ledgersync.model.CellKey;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.model.EntityRow;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One local unit of work. Closing without {@link #commit()} rolls back.
 */
public interface LedgerTransaction extends AutoCloseable {
    EntityRow getOrCreate(String dataset, String id);

    Optional<EntityRow> find(String dataset, String id);

    /**
     * Rows whose columns equal every filter value; a null filter value matches SQL NULL.
     */
    List<EntityRow> query(String dataset, Map<String, Object> equalsFilter);

    /**
     * Upserts the row and writes the given columns. Values may be plain Java values or
     * {@link io.ledgersync.model.Variant}s.
     */
    void update(String dataset, String id, Map<String, Object> attributes);

    Optional<LogicalTimestamp> cellTimestamp(CellKey cell);

    void recordCellTimestamp(CellKey cell, LogicalTimestamp timestamp);

    void saveClock(ReplicaClock clock);

    /**
     * Queues locally produced records for the relay. They stay queued until
     * {@link LedgerStore#removeOutgoing} drops them.
     */
    void enqueueOutgoing(List<ChangeRecord> records);

    void commit();

    boolean isOpen();

    @Override
    void close();
}
