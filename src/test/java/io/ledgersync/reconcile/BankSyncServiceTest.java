package io.ledgersync.reconcile;

import io.ledgersync.ledger.LedgerQueries;
import io.ledgersync.ledger.LedgerQueries.NewTransaction;
import io.ledgersync.model.BankFeed;
import io.ledgersync.model.EntityRow;
import io.ledgersync.model.ExternalTransaction;
import io.ledgersync.model.ReconcileOutcome;
import io.ledgersync.model.ReconciledTransaction;
import io.ledgersync.support.ReplicaFixture;
import io.ledgersync.sync.LedgerSession;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class BankSyncServiceTest {
    private static final LocalDate OCT_5 = LocalDate.of(2025, 10, 5);

    @Test
    void startDateComesFromHistoryOrLookbackPerAccount() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create(null)) {
            ReconciliationEngineTest.createAccount(replica, "fresh", false);
            ReconciliationEngineTest.createAccount(replica, "known", false);
            try (LedgerSession session = replica.openSession()) {
                LedgerQueries.createTransaction(session, new NewTransaction(
                        "known", LocalDate.of(2025, 10, 1), -100L, null, null, "old-1", "Old", true, false, 1L));
                LedgerQueries.createTransaction(session, new NewTransaction(
                        "known", LocalDate.of(2025, 9, 1), -100L, null, null, "old-0", "Old", true, false, 1L));
                session.commit();
            }
            FakeProvider provider = new FakeProvider();
            provider.feeds.put("ext-fresh", new BankFeed(List.of(
                    new ExternalTransaction(OCT_5, "Coffee Shop", -1200L, "fin-1", true, null)
            ), 5000L, BankFeed.BalanceKind.CURRENT));
            provider.feeds.put("ext-known", new BankFeed(List.of(
                    new ExternalTransaction(OCT_5, "Rent", -90000L, "fin-2", true, null),
                    new ExternalTransaction(LocalDate.of(2025, 10, 1), "Old", -100L, "old-1", true, null)
            ), 123_456L, BankFeed.BalanceKind.CURRENT));

            List<ReconciledTransaction> changed = service(replica, provider).run(null, null);

            Assertions.assertEquals(LocalDate.of(2025, 7, 11), provider.starts.get("ext-fresh"));
            Assertions.assertEquals(LocalDate.of(2025, 10, 1), provider.starts.get("ext-known"));
            Assertions.assertEquals(3, changed.size());
            Assertions.assertTrue(changed.stream().allMatch(r -> r.outcome() == ReconcileOutcome.CREATED));
            try (LedgerSession session = replica.openSession()) {
                List<EntityRow> known = LedgerQueries.accountTransactions(session, "known");
                Assertions.assertEquals(3, known.size());
                Assertions.assertTrue(known.stream().noneMatch(row -> row.flag("starting_balance_flag")));
                List<EntityRow> fresh = LedgerQueries.accountTransactions(session, "fresh");
                Assertions.assertEquals(1, fresh.stream().filter(row -> row.flag("starting_balance_flag")).count());
            }
            Assertions.assertEquals(5, replica.store.pendingOutgoing().stream()
                    .filter(r -> r.dataset().equals("transactions") && r.column().equals("amount")).count());
        }
    }

    @Test
    void impossibleHistoryDateFallsBackToTheNextValidOne() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create(null)) {
            ReconciliationEngineTest.createAccount(replica, "known", false);
            try (LedgerSession session = replica.openSession()) {
                String broken = LedgerQueries.createTransaction(session, new NewTransaction(
                        "known", OCT_5, -100L, null, null, "bad-1", "Bad", true, false, 1L)).id();
                session.update("transactions", broken, Map.of("date", 20251399L));
                LedgerQueries.createTransaction(session, new NewTransaction(
                        "known", LocalDate.of(2025, 9, 1), -100L, null, null, "old-0", "Old", true, false, 1L));
                session.commit();
            }
            FakeProvider provider = new FakeProvider();
            provider.feeds.put("ext-known", new BankFeed(List.of(), 0L, BankFeed.BalanceKind.CURRENT));

            service(replica, provider).run("known", null);

            Assertions.assertEquals(LocalDate.of(2025, 9, 1), provider.starts.get("ext-known"));
        }
    }

    @Test
    void explicitAccountAndStartDate() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create(null)) {
            ReconciliationEngineTest.createAccount(replica, "a1", false);
            ReconciliationEngineTest.createAccount(replica, "a2", false);
            FakeProvider provider = new FakeProvider();
            provider.feeds.put("ext-a1", new BankFeed(List.of(), 0L, BankFeed.BalanceKind.STARTING));
            provider.feeds.put("ext-a2", new BankFeed(List.of(), 0L, BankFeed.BalanceKind.STARTING));
            BankSyncService service = service(replica, provider);

            service.run("Account a2", LocalDate.of(2025, 1, 1));
            Assertions.assertEquals(Map.of("ext-a2", LocalDate.of(2025, 1, 1)), provider.starts);

            Assertions.assertThrows(IllegalArgumentException.class, () -> service.run("Nope", null));
        }
    }

    @Test
    void unconfiguredAndClosedAccountsAreSkipped() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create(null)) {
            ReconciliationEngineTest.createAccount(replica, "closed", false);
            ReconciliationEngineTest.createAccount(replica, "manual", false);
            try (LedgerSession session = replica.openSession()) {
                session.update("accounts", "closed", Map.of("closed", true));
                Map<String, Object> unlinked = new HashMap<>();
                unlinked.put("account_sync_source", "goCardless");
                session.update("accounts", "manual", unlinked);
                session.commit();
            }
            FakeProvider provider = new FakeProvider();
            Assertions.assertTrue(service(replica, provider).run(null, null).isEmpty());
            Assertions.assertTrue(provider.starts.isEmpty());
        }
    }

    @Test
    void providerErrorLeavesAccountUntouched() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create(null)) {
            ReconciliationEngineTest.createAccount(replica, "a1", false);
            FakeProvider provider = new FakeProvider();
            provider.failure = new BankSyncException("ITEM_ERROR", "expired", "Re-authenticate");
            BankSyncException error = Assertions.assertThrows(BankSyncException.class,
                    () -> service(replica, provider).run(null, null));
            Assertions.assertEquals("ITEM_ERROR", error.errorType());
            try (LedgerSession session = replica.openSession()) {
                Assertions.assertTrue(LedgerQueries.accountTransactions(session, "a1").isEmpty());
            }
        }
    }

    private static BankSyncService service(ReplicaFixture replica, FakeProvider provider) {
        return new BankSyncService(
                replica::openSession,
                provider,
                new ReconciliationEngine(7, "Starting Balance", replica.clock),
                90,
                replica.clock
        );
    }

    private static final class FakeProvider implements BankFeedProvider {
        final Map<String, BankFeed> feeds = new HashMap<>();
        final Map<String, LocalDate> starts = new HashMap<>();
        BankSyncException failure;

        @Override
        public boolean isConfigured(String syncSource) {
            return "simplefin".equals(syncSource);
        }

        @Override
        public BankFeed fetch(String syncSource, String accountId, LocalDate startDate) {
            if (failure != null) {
                throw failure;
            }
            starts.put(accountId, startDate);
            return feeds.getOrDefault(accountId, new BankFeed(List.of(), 0L, BankFeed.BalanceKind.STARTING));
        }
    }
}
