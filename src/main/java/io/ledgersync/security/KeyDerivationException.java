package io.ledgersync.security;

import io.ledgersync.LedgerSyncException;

public class KeyDerivationException extends LedgerSyncException {
    public KeyDerivationException(String message) {
        super(message);
    }

    public KeyDerivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
