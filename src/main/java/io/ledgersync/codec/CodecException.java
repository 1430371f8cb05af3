package io.ledgersync.codec;

import io.ledgersync.LedgerSyncException;

public class CodecException extends LedgerSyncException {
    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
