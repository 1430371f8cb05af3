package io.ledgersync.sync;

import io.ledgersync.clock.ReplicaClock;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.model.EntityRow;
import io.ledgersync.model.Variant;
import io.ledgersync.storage.LedgerTransaction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Local editing session. Edits are written to the open transaction and buffered; they become
 * change records only when {@link #commit()} succeeds, and are handed to the commit listener after
 * the local transaction is durable.
 */
public final class LedgerSession implements AutoCloseable {
    private final LedgerTransaction tx;
    private final SyncSession sync;
    private final ChangeBuffer buffer = new ChangeBuffer();
    private final Consumer<List<ChangeRecord>> onCommitted;
    private final Runnable onFinished;
    private boolean finished;

    public LedgerSession(LedgerTransaction tx, SyncSession sync, Consumer<List<ChangeRecord>> onCommitted) {
        this(tx, sync, onCommitted, null);
    }

    /**
     * @param onFinished runs once when the session commits or aborts, after the commit listener
     */
    public LedgerSession(
            LedgerTransaction tx,
            SyncSession sync,
            Consumer<List<ChangeRecord>> onCommitted,
            Runnable onFinished
    ) {
        this.tx = tx;
        this.sync = sync;
        this.onCommitted = onCommitted == null ? records -> { } : onCommitted;
        this.onFinished = onFinished == null ? () -> { } : onFinished;
    }

    public EntityRow getOrCreate(String dataset, String id) {
        return tx.getOrCreate(dataset, id);
    }

    public Optional<EntityRow> find(String dataset, String id) {
        return tx.find(dataset, id);
    }

    public List<EntityRow> query(String dataset, Map<String, Object> equalsFilter) {
        return tx.query(dataset, equalsFilter);
    }

    public void update(String dataset, String id, Map<String, Object> attributes) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : attributes.entrySet()) {
            values.put(e.getKey(), Variant.from(e.getValue()));
        }
        tx.update(dataset, id, values);
        for (Map.Entry<String, Object> e : values.entrySet()) {
            buffer.record(dataset, id, e.getKey(), (Variant) e.getValue());
        }
    }

    /**
     * Creates a row with a fresh id and returns the id.
     */
    public String insert(String dataset, Map<String, Object> attributes) {
        String id = UUID.randomUUID().toString();
        update(dataset, id, attributes);
        return id;
    }

    public int pendingChanges() {
        return buffer.size();
    }

    public boolean isOpen() {
        return tx.isOpen();
    }

    /**
     * Stamps the buffered edits, commits them with the clock checkpoint and the outgoing queue, then
     * notifies the commit listener.
     */
    public List<ChangeRecord> commit() {
        List<ChangeRecord> records;
        try {
            try {
                records = buffer.flush(sync);
                for (ChangeRecord record : records) {
                    tx.recordCellTimestamp(record.cell(), record.timestamp());
                }
                tx.enqueueOutgoing(records);
                ReplicaClock clock = sync.context().clock();
                tx.saveClock(clock);
                tx.commit();
            } finally {
                buffer.discard();
                tx.close();
            }
            if (!records.isEmpty()) {
                onCommitted.accept(records);
            }
        } finally {
            finish();
        }
        return records;
    }

    public void abort() {
        buffer.discard();
        try {
            tx.close();
        } finally {
            finish();
        }
    }

    @Override
    public void close() {
        if (tx.isOpen()) {
            abort();
        } else {
            finish();
        }
    }

    private void finish() {
        if (!finished) {
            finished = true;
            onFinished.run();
        }
    }
}
