package io.ledgersync.reconcile;

import io.ledgersync.model.BankFeed;

import java.time.LocalDate;

/**
 * Source of external bank transactions, one implementation per aggregation service.
 */
public interface BankFeedProvider {
    boolean isConfigured(String syncSource);

    /**
     * Transactions of {@code accountId} since {@code startDate}, newest first.
     *
     * @throws BankSyncException when the provider reports an error
     */
    BankFeed fetch(String syncSource, String accountId, LocalDate startDate);
}
