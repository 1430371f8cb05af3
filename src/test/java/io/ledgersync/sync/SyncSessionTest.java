package io.ledgersync.sync;

import io.ledgersync.clock.HybridLogicalClock;
import io.ledgersync.clock.LogicalTimestamp;
import io.ledgersync.clock.ReplicaClock;
import io.ledgersync.codec.ChangeSetCodec;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.model.RelayPayload;
import io.ledgersync.model.SyncState;
import io.ledgersync.model.Variant;
import io.ledgersync.security.DecryptionException;
import io.ledgersync.security.EncryptedPayload;
import io.ledgersync.security.EncryptionContext;
import io.ledgersync.security.KeyDerivationException;
import io.ledgersync.storage.MetadataStore;
import io.ledgersync.support.ReplicaFixture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.util.List;
import java.util.Map;

final class SyncSessionTest {
    private static final String REMOTE = "FEDCBA9876543210";

    private final ChangeSetCodec codec = new ChangeSetCodec();

    @Test
    void replicaWithoutGroupSkipsRelay() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create(null)) {
            commitAccountName(replica, "a1", "Checking");

            SyncOutcome outcome = replica.session.sync();
            Assertions.assertFalse(outcome.cancelled());
            Assertions.assertTrue(outcome.sent().skipped());
            Assertions.assertEquals(0, outcome.payloadsReceived());
            Assertions.assertTrue(replica.relay.sent.isEmpty());
            Assertions.assertEquals(1, replica.store.pendingOutgoing().size());
            Assertions.assertEquals(SyncState.IDLE, replica.session.state());
        }
    }

    @Test
    void committedRecordsAreSentOnceAndDequeued() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create("group-1")) {
            List<ChangeRecord> committed = commitAccountName(replica, "a1", "Checking");

            SyncOutcome outcome = replica.session.sync();
            Assertions.assertEquals(1, outcome.sent().records());
            Assertions.assertEquals(1, replica.relay.sent.size());
            RelayPayload payload = replica.relay.sent.get(0);
            Assertions.assertFalse(payload.encrypted());
            Assertions.assertEquals(committed.get(0).timestamp().toString(), payload.timestamp());
            Assertions.assertEquals(committed, codec.decode(payload.value()));
            Assertions.assertTrue(replica.store.pendingOutgoing().isEmpty());

            Assertions.assertTrue(replica.session.pushOutgoing().skipped());
            Assertions.assertEquals(1, replica.relay.sent.size());
        }
    }

    @Test
    void failedSendKeepsRecordsQueuedAndNeedsRecovery() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create("group-1")) {
            commitAccountName(replica, "a1", "Checking");
            ReplicaClock before = replica.context.clock();
            replica.relay.failSends = true;

            Assertions.assertThrows(TransportException.class, replica.session::sync);
            Assertions.assertEquals(SyncState.ERROR, replica.session.state());
            Assertions.assertThrows(IllegalStateException.class, replica.session::sync);
            Assertions.assertThrows(IllegalStateException.class, replica.session::issue);
            Assertions.assertEquals(1, replica.store.pendingOutgoing().size());

            replica.session.recover();
            Assertions.assertEquals(SyncState.IDLE, replica.session.state());
            Assertions.assertEquals(before, replica.context.clock());

            replica.relay.failSends = false;
            Assertions.assertEquals(1, replica.session.sync().sent().records());
            Assertions.assertTrue(replica.store.pendingOutgoing().isEmpty());
        }
    }

    @Test
    void applyingBacklogAdvancesClockAndAcknowledges() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create("group-1")) {
            long ahead = replica.clock.millis() + 60_000L;
            LogicalTimestamp remoteTs = new LogicalTimestamp(ahead, 4, REMOTE);
            replica.relay.backlog.add(plainPayload("r1", List.of(
                    new ChangeRecord("accounts", "a9", "name", Variant.of("Savings"), remoteTs)
            )));

            SyncOutcome outcome = replica.session.sync();

            Assertions.assertEquals(1, outcome.payloadsReceived());
            Assertions.assertEquals(1, outcome.recordsApplied());
            Assertions.assertEquals(List.of("r1"), replica.relay.acknowledged);
            Assertions.assertEquals("Savings", replica.store.find("accounts", "a9").orElseThrow().text("name"));

            ReplicaClock clock = replica.context.clock();
            Assertions.assertEquals(remoteTs, clock.lastAcknowledged());
            Assertions.assertEquals(ahead, clock.lastTimestamp().millis());
            Assertions.assertEquals(5, clock.lastTimestamp().counter());
            Assertions.assertEquals(clock, replica.store.loadClock());

            LogicalTimestamp next = replica.session.issue();
            Assertions.assertTrue(next.isAfter(remoteTs));

            SyncOutcome again = replica.session.sync();
            Assertions.assertEquals(0, again.payloadsReceived());
            Assertions.assertEquals(remoteTs, replica.relay.lastSince);
        }
    }

    @Test
    void failedPreferencePatchIsRetriedOnRedelivery() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create("group-1")) {
            FlakyMetadata metadata = new FlakyMetadata(replica.metadata);
            SyncSession session = new SyncSession(
                    replica.context,
                    replica.store,
                    replica.relay,
                    new MergeApplier(replica.store, metadata),
                    new HybridLogicalClock(replica.clock),
                    codec,
                    replica.crypto
            );
            ReplicaClock before = replica.context.clock();
            LogicalTimestamp remoteTs = new LogicalTimestamp(replica.clock.millis(), 0, REMOTE);
            replica.relay.backlog.add(plainPayload("r1", List.of(
                    new ChangeRecord("prefs", "budgetName", "value", Variant.of("Household"), remoteTs))));

            Assertions.assertThrows(IllegalStateException.class, session::sync);
            Assertions.assertTrue(replica.relay.acknowledged.isEmpty());
            session.recover();
            Assertions.assertEquals(before, replica.context.clock());
            Assertions.assertEquals(before, replica.store.loadClock());

            SyncOutcome outcome = session.sync();
            Assertions.assertEquals(1, outcome.payloadsReceived());
            Assertions.assertEquals(1, outcome.recordsApplied());
            Assertions.assertEquals("Household", replica.metadata.text("budgetName"));
            Assertions.assertEquals(List.of("r1"), replica.relay.acknowledged);
        }
    }

    @Test
    void receiveThenApplyCanBeDrivenSeparately() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create("group-1")) {
            LogicalTimestamp early = new LogicalTimestamp(1_000L, 0, REMOTE);
            LogicalTimestamp late = new LogicalTimestamp(2_000L, 0, REMOTE);
            replica.relay.backlog.add(plainPayload("r2", List.of(
                    new ChangeRecord("transactions", "t1", "amount", Variant.of(200L), late))));
            replica.relay.backlog.add(plainPayload("r1", List.of(
                    new ChangeRecord("transactions", "t1", "amount", Variant.of(100L), early))));

            Backlog backlog = replica.session.receive();
            Assertions.assertEquals(List.of("r2", "r1"), backlog.payloadIds());
            Assertions.assertEquals(early, backlog.records().get(0).timestamp());
            Assertions.assertEquals(late, backlog.maxObserved());
            Assertions.assertTrue(replica.store.find("transactions", "t1").isEmpty());

            replica.session.apply(backlog);
            Assertions.assertEquals(200L, replica.store.find("transactions", "t1").orElseThrow().longValue("amount", 0L));
        }
    }

    @Test
    void encryptedPayloadWithoutKeyLeavesClockUntouched() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create("group-1")) {
            ReplicaClock before = replica.context.clock();
            SecretKey key = replica.crypto.deriveKey("pw", replica.crypto.makeSalt());
            replica.relay.backlog.add(encryptedPayload(replica, "r1", "key-1", key));

            Assertions.assertThrows(DecryptionException.class, replica.session::sync);
            Assertions.assertEquals(SyncState.ERROR, replica.session.state());
            Assertions.assertTrue(replica.relay.acknowledged.isEmpty());
            replica.session.recover();
            Assertions.assertEquals(before, replica.context.clock());
            Assertions.assertTrue(replica.store.find("accounts", "a1").isEmpty());
        }
    }

    @Test
    void unknownKeyIdIsRejected() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create("group-1")) {
            SecretKey mine = replica.crypto.deriveKey("pw", replica.crypto.makeSalt());
            replica.context.encryptKeyId("key-1");
            replica.context.encryption(new EncryptionContext("key-1", mine, new byte[]{1}));
            replica.relay.backlog.add(encryptedPayload(replica, "r1", "key-2", mine));

            Assertions.assertThrows(DecryptionException.class, replica.session::sync);
        }
    }

    @Test
    void encryptedReplicaRoundTripsWhenUnlocked() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create("group-1")) {
            SecretKey key = replica.crypto.deriveKey("pw", replica.crypto.makeSalt());
            replica.context.encryptKeyId("key-1");
            replica.context.encryption(new EncryptionContext("key-1", key, new byte[]{1}));
            replica.relay.backlog.add(encryptedPayload(replica, "r1", "key-1", key));
            commitAccountName(replica, "a2", "Card");

            SyncOutcome outcome = replica.session.sync();
            Assertions.assertTrue(outcome.sent().encrypted());
            RelayPayload sent = replica.relay.sent.get(0);
            Assertions.assertEquals("key-1", sent.keyId());
            Assertions.assertThrows(RuntimeException.class, () -> codec.decode(sent.value()));
            Assertions.assertEquals("Checking", replica.store.find("accounts", "a1").orElseThrow().text("name"));
        }
    }

    @Test
    void lockedReplicaCannotExchange() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create("group-1")) {
            commitAccountName(replica, "a1", "Checking");
            replica.context.encryptKeyId("key-1");
            ReplicaClock before = replica.context.clock();

            Assertions.assertThrows(KeyDerivationException.class, replica.session::sync);
            replica.session.recover();
            Assertions.assertThrows(KeyDerivationException.class, replica.session::receive);
            replica.session.recover();
            Assertions.assertEquals(before, replica.context.clock());
            Assertions.assertTrue(replica.relay.sent.isEmpty());
            Assertions.assertEquals(1, replica.store.pendingOutgoing().size());
        }
    }

    @Test
    void cancelStopsBeforeApplying() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create("group-1")) {
            replica.relay.backlog.add(plainPayload("r1", List.of(
                    new ChangeRecord("accounts", "a9", "name", Variant.of("Savings"), new LogicalTimestamp(1L, 0, REMOTE))
            )));
            ReplicaClock before = replica.context.clock();

            replica.session.requestCancel();
            SyncOutcome cancelled = replica.session.sync();
            Assertions.assertTrue(cancelled.cancelled());
            Assertions.assertEquals(before, cancelled.clock());
            Assertions.assertTrue(replica.store.find("accounts", "a9").isEmpty());
            Assertions.assertEquals(SyncState.IDLE, replica.session.state());

            Assertions.assertEquals(1, replica.session.sync().recordsApplied());
        }
    }

    @Test
    void issuedTimestampsAreStrictlyIncreasing() throws Exception {
        try (ReplicaFixture replica = ReplicaFixture.create(null)) {
            LogicalTimestamp previous = replica.session.issue();
            for (int i = 0; i < 100; i++) {
                if (i == 50) {
                    replica.clock.advance(-10_000L);
                }
                LogicalTimestamp next = replica.session.issue();
                Assertions.assertTrue(next.isAfter(previous));
                previous = next;
            }
            Assertions.assertEquals(replica.context.clientId(), previous.clientId());
        }
    }

    private static List<ChangeRecord> commitAccountName(ReplicaFixture replica, String id, String name) {
        try (LedgerSession session = replica.openSession()) {
            session.update("accounts", id, Map.of("name", name));
            return session.commit();
        }
    }

    private RelayPayload plainPayload(String id, List<ChangeRecord> records) {
        LogicalTimestamp highest = null;
        for (ChangeRecord record : records) {
            highest = LogicalTimestamp.max(highest, record.timestamp());
        }
        return new RelayPayload(id, "group-1", highest.toString(), null, codec.encode(records), null);
    }

    private RelayPayload encryptedPayload(ReplicaFixture replica, String id, String keyId, SecretKey key) {
        LogicalTimestamp ts = new LogicalTimestamp(5L, 0, REMOTE);
        byte[] plain = codec.encode(List.of(new ChangeRecord("accounts", "a1", "name", Variant.of("Checking"), ts)));
        EncryptedPayload sealed = replica.crypto.encrypt(keyId, key, plain);
        return new RelayPayload(id, "group-1", ts.toString(), keyId, sealed.value(), sealed.meta());
    }

    private static final class FlakyMetadata implements MetadataStore {
        private final MetadataStore delegate;
        private boolean failNext = true;

        private FlakyMetadata(MetadataStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public Map<String, Object> get() {
            return delegate.get();
        }

        @Override
        public void patch(Map<String, Object> patch) {
            if (failNext) {
                failNext = false;
                throw new IllegalStateException("metadata file is read-only");
            }
            delegate.patch(patch);
        }
    }
}
