package io.ledgersync.ledger;

import io.ledgersync.model.EntityRow;
import io.ledgersync.sync.LedgerSession;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ledger-level reads and writes on top of a {@link LedgerSession}. Dates are stored as
 * {@code YYYYMMDD} integers and amounts in cents.
 */
public final class LedgerQueries {
    public static final String TRANSACTIONS = "transactions";
    public static final String ACCOUNTS = "accounts";
    public static final String PAYEES = "payees";
    public static final String PAYEE_MAPPING = "payee_mapping";

    private LedgerQueries() {
    }

    public static long toDateInt(LocalDate date) {
        return date.getYear() * 10_000L + date.getMonthValue() * 100L + date.getDayOfMonth();
    }

    public static LocalDate fromDateInt(long value) {
        return LocalDate.of((int) (value / 10_000L), (int) (value / 100L % 100L), (int) (value % 100L));
    }

    /**
     * Like {@link #fromDateInt(long)}, but empty for zero, negative or impossible dates such as
     * {@code 20251399}.
     */
    public static Optional<LocalDate> parseDateInt(long value) {
        if (value <= 0L) {
            return Optional.empty();
        }
        try {
            return Optional.of(fromDateInt(value));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public static boolean isLive(EntityRow row) {
        return !row.flag("tombstone");
    }

    public static Optional<EntityRow> findPayeeByName(LedgerSession session, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (EntityRow payee : session.query(PAYEES, Map.of())) {
            String payeeName = payee.text("name");
            if (isLive(payee)
                    && payee.text("transfer_acct") == null
                    && payeeName != null
                    && payeeName.trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(payee);
            }
        }
        return Optional.empty();
    }

    /**
     * Payee named {@code name}, created together with its mapping row when missing.
     */
    public static EntityRow getOrCreatePayee(LedgerSession session, String name) {
        Optional<EntityRow> existing = findPayeeByName(session, name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("name", name.trim());
        String id = session.insert(PAYEES, attributes);
        session.update(PAYEE_MAPPING, id, Map.of("targetId", id));
        return session.find(PAYEES, id).orElseThrow();
    }

    /**
     * Name of the payee a transaction points at, following the payee mapping.
     */
    public static Optional<String> payeeName(LedgerSession session, EntityRow transaction) {
        String payeeRef = transaction.text("description");
        if (payeeRef == null) {
            return Optional.empty();
        }
        String target = session.find(PAYEE_MAPPING, payeeRef)
                .map(mapping -> mapping.text("targetId"))
                .orElse(payeeRef);
        return session.find(PAYEES, target).map(payee -> payee.text("name"));
    }

    public static EntityRow createTransaction(LedgerSession session, NewTransaction draft) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("acct", draft.accountId());
        attributes.put("date", toDateInt(draft.date()));
        attributes.put("amount", draft.amount());
        attributes.put("description", draft.payeeId());
        attributes.put("notes", draft.notes());
        attributes.put("financial_id", draft.importedId());
        attributes.put("imported_description", draft.importedPayee());
        attributes.put("cleared", draft.cleared());
        attributes.put("starting_balance_flag", draft.startingBalance());
        attributes.put("sort_order", (double) draft.sortOrder());
        attributes.put("isParent", false);
        attributes.put("isChild", false);
        attributes.put("tombstone", false);
        String id = session.insert(TRANSACTIONS, attributes);
        return session.find(TRANSACTIONS, id).orElseThrow();
    }

    /**
     * Transactions of an account, newest date first. Tombstoned rows are included.
     */
    public static List<EntityRow> accountTransactions(LedgerSession session, String accountId) {
        List<EntityRow> rows = new ArrayList<>(session.query(TRANSACTIONS, Map.of("acct", accountId)));
        rows.sort(Comparator.comparingLong((EntityRow row) -> row.longValue("date", 0L)).reversed());
        return rows;
    }

    public record NewTransaction(
            String accountId,
            LocalDate date,
            long amount,
            String payeeId,
            String notes,
            String importedId,
            String importedPayee,
            boolean cleared,
            boolean startingBalance,
            long sortOrder
    ) {
    }
}
