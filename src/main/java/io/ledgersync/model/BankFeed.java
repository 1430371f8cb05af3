package io.ledgersync.model;

import java.util.List;

/**
 * Result of one bank feed fetch. Transactions usually arrive newest first.
 *
 * @param balance     balance in cents
 * @param balanceKind whether {@code balance} is the balance before or after the listed transactions
 */
public record BankFeed(List<ExternalTransaction> transactions, long balance, BalanceKind balanceKind) {
    public enum BalanceKind {
        STARTING,
        CURRENT
    }

    public BankFeed {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        balanceKind = balanceKind == null ? BalanceKind.STARTING : balanceKind;
    }
}
