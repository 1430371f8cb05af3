package io.ledgersync.reconcile;

import io.ledgersync.LedgerSyncException;

/**
 * A bank feed provider reported an error for an account.
 */
public class BankSyncException extends LedgerSyncException {
    private final String errorType;
    private final String status;
    private final String reason;

    public BankSyncException(String errorType, String status, String reason) {
        super("Bank sync failed: " + errorType + " (" + status + "): " + reason);
        this.errorType = errorType;
        this.status = status;
        this.reason = reason;
    }

    public String errorType() {
        return errorType;
    }

    public String status() {
        return status;
    }

    public String reason() {
        return reason;
    }
}
