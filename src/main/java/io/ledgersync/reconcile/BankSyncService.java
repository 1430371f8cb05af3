package io.ledgersync.reconcile;

import io.ledgersync.ledger.LedgerQueries;
import io.ledgersync.model.BankFeed;
import io.ledgersync.model.EntityRow;
import io.ledgersync.model.ReconciledTransaction;
import io.ledgersync.sync.LedgerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Pulls bank feeds for linked accounts and reconciles them, one ledger session per account.
 */
public final class BankSyncService {
    private static final Logger LOG = LoggerFactory.getLogger(BankSyncService.class);

    private final Supplier<LedgerSession> sessions;
    private final BankFeedProvider provider;
    private final ReconciliationEngine engine;
    private final int lookbackDays;
    private final Clock clock;

    public BankSyncService(
            Supplier<LedgerSession> sessions,
            BankFeedProvider provider,
            ReconciliationEngine engine,
            int lookbackDays,
            Clock clock
    ) {
        this.sessions = sessions;
        this.provider = provider;
        this.engine = engine;
        this.lookbackDays = lookbackDays;
        this.clock = clock;
    }

    /**
     * Syncs every linked account, or only {@code account} (row id or name) when given. Returns the
     * transactions that were created or changed.
     */
    public List<ReconciledTransaction> run(String account, LocalDate startDate) {
        List<EntityRow> accounts = accounts(account);
        List<ReconciledTransaction> imported = new ArrayList<>();
        for (EntityRow acct : accounts) {
            String accountId = acct.text("account_id");
            String source = acct.text("account_sync_source");
            if (accountId == null || accountId.isBlank() || source == null || source.isBlank()) {
                continue;
            }
            if (!provider.isConfigured(source)) {
                LOG.info("Skipping account {}: sync source {} is not configured", acct.id(), source);
                continue;
            }
            imported.addAll(syncAccount(acct, source, startDate));
        }
        return imported;
    }

    private List<ReconciledTransaction> syncAccount(EntityRow acct, String source, LocalDate requestedStart) {
        try (LedgerSession session = sessions.get()) {
            LocalDate start = requestedStart;
            boolean firstSync = false;
            if (start == null) {
                Optional<LocalDate> latest = Optional.empty();
                for (EntityRow row : LedgerQueries.accountTransactions(session, acct.id())) {
                    latest = LedgerQueries.parseDateInt(row.longValue("date", 0L));
                    if (latest.isPresent()) {
                        break;
                    }
                }
                if (latest.isPresent()) {
                    start = latest.get();
                } else {
                    firstSync = true;
                    start = LocalDate.now(clock).minusDays(lookbackDays);
                }
            }
            BankFeed feed = provider.fetch(source, acct.text("account_id"), start);
            List<ReconciledTransaction> results = engine.reconcile(session, acct, feed, firstSync);
            session.commit();
            List<ReconciledTransaction> changed = new ArrayList<>();
            for (ReconciledTransaction result : results) {
                if (result.changed()) {
                    changed.add(result);
                }
            }
            LOG.info("Bank sync of account {} from {}: {} changed of {}", acct.id(), start, changed.size(), results.size());
            return changed;
        }
    }

    private List<EntityRow> accounts(String account) {
        List<EntityRow> out = new ArrayList<>();
        try (LedgerSession session = sessions.get()) {
            for (EntityRow row : session.query(LedgerQueries.ACCOUNTS, Map.of())) {
                if (!LedgerQueries.isLive(row) || row.flag("closed")) {
                    continue;
                }
                if (account == null || account.equals(row.id()) || account.equalsIgnoreCase(row.text("name"))) {
                    out.add(row);
                }
            }
        }
        if (account != null && out.isEmpty()) {
            throw new IllegalArgumentException("Unknown account: " + account);
        }
        return out;
    }
}
