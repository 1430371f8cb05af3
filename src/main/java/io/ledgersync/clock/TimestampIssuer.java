package io.ledgersync.clock;

@FunctionalInterface
public interface TimestampIssuer {
    /**
     * Returns a timestamp strictly greater than every timestamp previously issued by this issuer.
     */
    LogicalTimestamp issue();
}
