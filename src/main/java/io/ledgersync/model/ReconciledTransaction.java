package io.ledgersync.model;

public record ReconciledTransaction(EntityRow transaction, ReconcileOutcome outcome) {
    public boolean changed() {
        return outcome != ReconcileOutcome.UNCHANGED;
    }

    public String id() {
        return transaction.id();
    }
}
