package io.ledgersync.sync;

import io.ledgersync.clock.ReplicaClock;

public record SyncOutcome(
        boolean cancelled,
        SendOutcome sent,
        int payloadsReceived,
        ApplySummary applied,
        ReplicaClock clock
) {
    public static SyncOutcome cancelled(SendOutcome sent, ReplicaClock clock) {
        return new SyncOutcome(true, sent == null ? SendOutcome.none() : sent, 0, ApplySummary.empty(), clock);
    }

    public int recordsApplied() {
        return applied == null ? 0 : applied.applied();
    }
}
