package io.ledgersync.security;

import io.ledgersync.LedgerSyncException;

/**
 * Authenticated decryption failed: corrupted payload, wrong key or wrong associated key id.
 */
public class DecryptionException extends LedgerSyncException {
    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
