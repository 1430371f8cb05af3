package io.ledgersync.clock;

import java.time.Clock;
import java.util.Objects;

/**
 * Issues and merges {@link LogicalTimestamp}s. Holds no replica state: callers pass the last
 * timestamp they issued and keep the result.
 */
public final class HybridLogicalClock {
    private final Clock wallClock;

    public HybridLogicalClock(Clock wallClock) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public LogicalTimestamp now(String clientId) {
        return now(LogicalTimestamp.zero(clientId));
    }

    /**
     * Next local timestamp after {@code last}. A wall clock behind {@code last} is ignored.
     */
    public LogicalTimestamp now(LogicalTimestamp last) {
        Objects.requireNonNull(last, "last");
        long millis = Math.max(wallMillis(), last.millis());
        int counter = millis == last.millis() ? next(last.counter()) : 0;
        return new LogicalTimestamp(millis, counter, last.clientId());
    }

    /**
     * Merges an observed remote timestamp into the local one. The result keeps the local client id
     * and orders after both inputs' (millis, counter).
     */
    public LogicalTimestamp receive(LogicalTimestamp local, LogicalTimestamp remote) {
        Objects.requireNonNull(local, "local");
        Objects.requireNonNull(remote, "remote");
        long millis = Math.max(Math.max(local.millis(), remote.millis()), wallMillis());
        int counter;
        if (millis == local.millis()) {
            counter = next(Math.max(local.counter(), remote.counter()));
        } else if (millis == remote.millis()) {
            counter = next(remote.counter());
        } else {
            counter = 0;
        }
        return new LogicalTimestamp(millis, counter, local.clientId());
    }

    public long wallMillis() {
        return Math.max(0L, wallClock.millis());
    }

    private static int next(int counter) {
        if (counter >= LogicalTimestamp.MAX_COUNTER) {
            throw new IllegalStateException("Logical clock counter overflow");
        }
        return counter + 1;
    }
}
