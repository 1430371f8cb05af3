package io.ledgersync.sync;

/**
 * @param payloadId relay id of the sent change set, null when nothing was sent
 */
public record SendOutcome(boolean skipped, String payloadId, int records, boolean encrypted) {
    public static SendOutcome none() {
        return new SendOutcome(true, null, 0, false);
    }
}
