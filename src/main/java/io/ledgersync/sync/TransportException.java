package io.ledgersync.sync;

import io.ledgersync.LedgerSyncException;

/**
 * The relay could not be reached or refused a request.
 */
public class TransportException extends LedgerSyncException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
