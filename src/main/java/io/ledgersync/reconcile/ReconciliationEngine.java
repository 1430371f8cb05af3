package io.ledgersync.reconcile;

import io.ledgersync.ledger.LedgerQueries;
import io.ledgersync.ledger.LedgerQueries.NewTransaction;
import io.ledgersync.model.BankFeed;
import io.ledgersync.model.EntityRow;
import io.ledgersync.model.ExternalTransaction;
import io.ledgersync.model.ReconcileOutcome;
import io.ledgersync.model.ReconciledTransaction;
import io.ledgersync.sync.LedgerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Imports bank feed transactions into an account so that each imported id maps to exactly one
 * ledger transaction, however often the same feed is replayed.
 */
public final class ReconciliationEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final int fuzzyMatchWindowDays;
    private final String startingBalancePayee;
    private final Clock clock;

    public ReconciliationEngine(int fuzzyMatchWindowDays, String startingBalancePayee, Clock clock) {
        this.fuzzyMatchWindowDays = Math.max(0, fuzzyMatchWindowDays);
        this.startingBalancePayee = startingBalancePayee;
        this.clock = clock;
    }

    public List<ReconciledTransaction> reconcile(
            LedgerSession session,
            EntityRow account,
            BankFeed feed,
            boolean isFirstSync
    ) {
        List<ExternalTransaction> ordered = new ArrayList<>(feed.transactions());
        // feed is newest first; reverse before the stable sort so same-day entries keep arrival order
        Collections.reverse(ordered);
        ordered.sort(Comparator.comparing(ExternalTransaction::date));

        List<ReconciledTransaction> out = new ArrayList<>();
        Set<String> matched = new HashSet<>();
        if (isFirstSync) {
            startingBalance(session, account, feed, ordered).ifPresent(created -> {
                out.add(created);
                matched.add(created.id());
            });
        }
        for (ExternalTransaction external : ordered) {
            if (!external.booked()) {
                continue;
            }
            ReconciledTransaction result = reconcileOne(session, account, external, matched);
            matched.add(result.id());
            out.add(result);
        }
        LOG.debug("Reconciled {} feed transactions into account {}", out.size(), account.id());
        return out;
    }

    private Optional<ReconciledTransaction> startingBalance(
            LedgerSession session,
            EntityRow account,
            BankFeed feed,
            List<ExternalTransaction> ordered
    ) {
        long bookedSum = 0L;
        LocalDate oldest = null;
        for (ExternalTransaction external : ordered) {
            if (!external.booked()) {
                continue;
            }
            bookedSum += external.amount();
            if (oldest == null || external.date().isBefore(oldest)) {
                oldest = external.date();
            }
        }
        long balance = feed.balanceKind() == BankFeed.BalanceKind.CURRENT
                ? feed.balance() - bookedSum
                : feed.balance();
        if (balance == 0L) {
            return Optional.empty();
        }
        for (EntityRow existing : LedgerQueries.accountTransactions(session, account.id())) {
            if (existing.flag("starting_balance_flag") && LedgerQueries.isLive(existing)) {
                return Optional.empty();
            }
        }
        String payeeId = account.flag("offbudget")
                ? null
                : LedgerQueries.getOrCreatePayee(session, startingBalancePayee).id();
        LocalDate date = oldest == null ? LocalDate.now(clock) : oldest;
        EntityRow created = LedgerQueries.createTransaction(session, new NewTransaction(
                account.id(), date, balance, payeeId, null, null, null, true, true, clock.millis()
        ));
        return Optional.of(new ReconciledTransaction(created, ReconcileOutcome.CREATED));
    }

    private ReconciledTransaction reconcileOne(
            LedgerSession session,
            EntityRow account,
            ExternalTransaction external,
            Set<String> matched
    ) {
        List<EntityRow> local = LedgerQueries.accountTransactions(session, account.id());
        String importedId = blankToNull(external.importedId());
        String payee = external.payeeName() == null ? "" : external.payeeName().trim();

        if (importedId != null) {
            for (EntityRow row : local) {
                if (importedId.equals(row.text("financial_id"))) {
                    return refresh(session, row, external, payee);
                }
            }
        }

        Optional<EntityRow> fuzzy = fuzzyMatch(session, local, external, payee, matched);
        if (fuzzy.isPresent()) {
            EntityRow row = fuzzy.get();
            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put("financial_id", importedId);
            changes.put("imported_description", payee);
            changes.put("cleared", true);
            if (row.text("notes") == null && external.notes() != null) {
                changes.put("notes", external.notes());
            }
            session.update(LedgerQueries.TRANSACTIONS, row.id(), changes);
            return new ReconciledTransaction(
                    session.find(LedgerQueries.TRANSACTIONS, row.id()).orElseThrow(), ReconcileOutcome.MATCHED);
        }

        String payeeId = payee.isEmpty() ? null : LedgerQueries.getOrCreatePayee(session, payee).id();
        EntityRow created = LedgerQueries.createTransaction(session, new NewTransaction(
                account.id(), external.date(), external.amount(), payeeId, external.notes(),
                importedId, payee, true, false, clock.millis()
        ));
        return new ReconciledTransaction(created, ReconcileOutcome.CREATED);
    }

    private ReconciledTransaction refresh(LedgerSession session, EntityRow row, ExternalTransaction external, String payee) {
        if (!LedgerQueries.isLive(row)) {
            return new ReconciledTransaction(row, ReconcileOutcome.UNCHANGED);
        }
        Map<String, Object> changes = new LinkedHashMap<>();
        if (!row.flag("cleared")) {
            changes.put("cleared", true);
        }
        if (!payee.equals(row.text("imported_description") == null ? "" : row.text("imported_description"))) {
            changes.put("imported_description", payee);
        }
        if (row.text("notes") == null && external.notes() != null) {
            changes.put("notes", external.notes());
        }
        if (changes.isEmpty()) {
            return new ReconciledTransaction(row, ReconcileOutcome.UNCHANGED);
        }
        session.update(LedgerQueries.TRANSACTIONS, row.id(), changes);
        return new ReconciledTransaction(
                session.find(LedgerQueries.TRANSACTIONS, row.id()).orElseThrow(), ReconcileOutcome.UPDATED);
    }

    private Optional<EntityRow> fuzzyMatch(
            LedgerSession session,
            List<EntityRow> local,
            ExternalTransaction external,
            String payee,
            Set<String> matched
    ) {
        if (payee.isEmpty()) {
            return Optional.empty();
        }
        String wanted = payee.toLowerCase(Locale.ROOT);
        EntityRow best = null;
        long bestDistance = Long.MAX_VALUE;
        boolean tie = false;
        for (EntityRow row : local) {
            if (row.text("financial_id") != null
                    || !LedgerQueries.isLive(row)
                    || row.flag("starting_balance_flag")
                    || matched.contains(row.id())
                    || row.longValue("amount", Long.MIN_VALUE) != external.amount()) {
                continue;
            }
            Optional<LocalDate> date = LedgerQueries.parseDateInt(row.longValue("date", 0L));
            if (date.isEmpty()) {
                continue;
            }
            long distance = Math.abs(ChronoUnit.DAYS.between(external.date(), date.get()));
            if (distance > fuzzyMatchWindowDays || !payeeMatches(session, row, wanted)) {
                continue;
            }
            if (distance < bestDistance) {
                best = row;
                bestDistance = distance;
                tie = false;
            } else if (distance == bestDistance) {
                tie = true;
            }
        }
        if (tie) {
            LOG.debug("Ambiguous match for imported transaction {}, creating a new one", external.importedId());
            return Optional.empty();
        }
        return Optional.ofNullable(best);
    }

    private static boolean payeeMatches(LedgerSession session, EntityRow row, String wanted) {
        String imported = row.text("imported_description");
        if (imported != null && imported.trim().toLowerCase(Locale.ROOT).equals(wanted)) {
            return true;
        }
        return LedgerQueries.payeeName(session, row)
                .map(name -> Objects.equals(name.trim().toLowerCase(Locale.ROOT), wanted))
                .orElse(false);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
