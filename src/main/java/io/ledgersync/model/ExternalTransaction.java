package io.ledgersync.model;

import java.time.LocalDate;

/**
 * One transaction as delivered by a bank feed. Amounts are in cents.
 */
public record ExternalTransaction(
        LocalDate date,
        String payeeName,
        long amount,
        String importedId,
        boolean booked,
        String notes
) {
}
