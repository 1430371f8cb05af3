package io.ledgersync.storage;

import io.ledgersync.LedgerSyncException;

/**
 * A dataset or column is not part of the declared ledger schema.
 */
public class UnsupportedSchemaException extends LedgerSyncException {
    public UnsupportedSchemaException(String message) {
        super(message);
    }
}
