package io.ledgersync;

/**
 * Root of the typed failures raised by the replication engine.
 */
public class LedgerSyncException extends RuntimeException {
    public LedgerSyncException(String message) {
        super(message);
    }

    public LedgerSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
