package io.ledgersync.clock;

import java.util.Objects;

/**
 * Persisted clock checkpoint of one replica.
 *
 * @param clientId         this replica's client id
 * @param lastTimestamp    last timestamp issued or merged locally
 * @param lastAcknowledged highest remote timestamp durably applied, used as the backlog cursor
 */
public record ReplicaClock(String clientId, LogicalTimestamp lastTimestamp, LogicalTimestamp lastAcknowledged) {
    public ReplicaClock {
        Objects.requireNonNull(lastTimestamp, "lastTimestamp");
        Objects.requireNonNull(lastAcknowledged, "lastAcknowledged");
        if (clientId != null && !clientId.equalsIgnoreCase(lastTimestamp.clientId())) {
            throw new IllegalArgumentException("clientId does not match lastTimestamp: " + clientId);
        }
        clientId = lastTimestamp.clientId();
    }

    public static ReplicaClock create() {
        return initial(LogicalTimestamp.randomClientId());
    }

    public static ReplicaClock initial(String clientId) {
        LogicalTimestamp zero = LogicalTimestamp.zero(clientId);
        return new ReplicaClock(zero.clientId(), zero, zero);
    }

    public ReplicaClock withLastTimestamp(LogicalTimestamp next) {
        return new ReplicaClock(clientId, next, lastAcknowledged);
    }

    public ReplicaClock acknowledge(LogicalTimestamp merged, LogicalTimestamp observed) {
        return new ReplicaClock(clientId, merged, LogicalTimestamp.max(lastAcknowledged, observed));
    }
}
