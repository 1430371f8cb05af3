package io.ledgersync.sync;

import io.ledgersync.clock.LogicalTimestamp;
import io.ledgersync.model.ChangeRecord;

import java.util.List;

/**
 * Decoded remote change sets, records sorted by timestamp.
 *
 * @param maxObserved highest record timestamp, null when {@code records} is empty
 */
public record Backlog(List<String> payloadIds, List<ChangeRecord> records, LogicalTimestamp maxObserved) {
    public Backlog {
        payloadIds = payloadIds == null ? List.of() : List.copyOf(payloadIds);
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static Backlog empty() {
        return new Backlog(List.of(), List.of(), null);
    }

    public boolean isEmpty() {
        return payloadIds.isEmpty();
    }
}
