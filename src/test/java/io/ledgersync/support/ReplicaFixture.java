package io.ledgersync.support;

import io.ledgersync.clock.HybridLogicalClock;
import io.ledgersync.codec.ChangeSetCodec;
import io.ledgersync.config.LedgerSyncConfig;
import io.ledgersync.security.PayloadCrypto;
import io.ledgersync.storage.Database;
import io.ledgersync.storage.JsonMetadataStore;
import io.ledgersync.storage.SqliteLedgerStore;
import io.ledgersync.sync.LedgerSession;
import io.ledgersync.sync.MergeApplier;
import io.ledgersync.sync.ReplicaContext;
import io.ledgersync.sync.SyncSession;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Store, metadata and sync session of one replica in a temp directory, wired to an
 * {@link InMemoryRelay}.
 */
public final class ReplicaFixture implements AutoCloseable {
    public final Path root;
    public final MutableClock clock;
    public final Database database;
    public final SqliteLedgerStore store;
    public final JsonMetadataStore metadata;
    public final InMemoryRelay relay;
    public final PayloadCrypto crypto;
    public final ReplicaContext context;
    public final SyncSession session;

    private ReplicaFixture(String groupId, long startMillis) throws IOException {
        this.root = Files.createTempDirectory("ledgersync-test-replica-");
        LedgerSyncConfig config = LedgerSyncConfig.fromRoot(root.toString());
        this.clock = new MutableClock(startMillis);
        this.database = new Database(config);
        database.init();
        this.store = new SqliteLedgerStore(database);
        this.metadata = new JsonMetadataStore(config.metadataFile());
        this.relay = new InMemoryRelay();
        this.crypto = new PayloadCrypto(1_000);
        this.context = new ReplicaContext(groupId, null, store.loadClock());
        this.session = new SyncSession(
                context,
                store,
                relay,
                new MergeApplier(store, metadata),
                new HybridLogicalClock(clock),
                new ChangeSetCodec(),
                crypto
        );
    }

    public static ReplicaFixture create(String groupId) throws IOException {
        return new ReplicaFixture(groupId, 1_760_000_000_000L);
    }

    public LedgerSession openSession() {
        return new LedgerSession(store.begin(), session, null);
    }

    @Override
    public void close() throws IOException {
        TestDirs.deleteRecursively(root);
    }
}
