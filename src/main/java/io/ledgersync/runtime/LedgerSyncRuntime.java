package io.ledgersync.runtime;

import io.ledgersync.clock.HybridLogicalClock;
import io.ledgersync.clock.ReplicaClock;
import io.ledgersync.codec.ChangeSetCodec;
import io.ledgersync.config.LedgerSyncConfig;
import io.ledgersync.config.SyncSettings;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.model.EntityRow;
import io.ledgersync.model.ReconciledTransaction;
import io.ledgersync.model.Variant;
import io.ledgersync.observability.AuditLogger;
import io.ledgersync.reconcile.BankFeedProvider;
import io.ledgersync.reconcile.BankSyncService;
import io.ledgersync.reconcile.ReconciliationEngine;
import io.ledgersync.relay.FileRelay;
import io.ledgersync.security.DecryptionException;
import io.ledgersync.security.EncryptedPayload;
import io.ledgersync.security.EncryptionContext;
import io.ledgersync.security.KeyDerivationException;
import io.ledgersync.security.PayloadCrypto;
import io.ledgersync.storage.Database;
import io.ledgersync.storage.JsonMetadataStore;
import io.ledgersync.storage.LedgerStore;
import io.ledgersync.storage.MetadataStore;
import io.ledgersync.storage.SqliteLedgerStore;
import io.ledgersync.sync.KeyRegistry;
import io.ledgersync.sync.LedgerSession;
import io.ledgersync.sync.MergeApplier;
import io.ledgersync.sync.ReplicaContext;
import io.ledgersync.sync.SendOutcome;
import io.ledgersync.sync.SyncOutcome;
import io.ledgersync.sync.SyncSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One replica rooted at a directory: local store, metadata, relay connection and the sync session
 * that ties them together. Sync rounds and post-commit sends are serialized by the replica lock.
 */
public final class LedgerSyncRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(LedgerSyncRuntime.class);
    public static final String METADATA_GROUP_ID = "groupId";
    public static final String METADATA_ENCRYPT_KEY_ID = "encryptKeyId";
    public static final String METADATA_BUDGET_NAME = "budgetName";

    private final LedgerSyncConfig config;
    private final SyncSettings settings;
    private final Database database;
    private final LedgerStore store;
    private final MetadataStore metadata;
    private final FileRelay relay;
    private final PayloadCrypto crypto;
    private final SyncSession syncSession;
    private final AuditLogger auditLogger;
    private final BankSyncService bankSync;
    private final ReentrantLock replicaLock = new ReentrantLock();

    public LedgerSyncRuntime(LedgerSyncConfig config) {
        this(config, null, Clock.systemUTC());
    }

    public LedgerSyncRuntime(LedgerSyncConfig config, BankFeedProvider bankFeeds, Clock clock) {
        this.config = config;
        this.settings = SyncSettings.load(config.settingsFile());
        this.database = new Database(config);
        this.database.init();
        this.store = new SqliteLedgerStore(database);
        this.metadata = new JsonMetadataStore(config.metadataFile());
        this.relay = new FileRelay(config.relayDir(), clock);
        this.crypto = new PayloadCrypto(settings.kdfIterations());

        ReplicaClock replicaClock = store.loadClock();
        ReplicaContext context = new ReplicaContext(
                metadata.text(METADATA_GROUP_ID),
                metadata.text(METADATA_ENCRYPT_KEY_ID),
                replicaClock
        );
        this.syncSession = new SyncSession(
                context,
                store,
                relay,
                new MergeApplier(store, metadata),
                new HybridLogicalClock(clock),
                new ChangeSetCodec(),
                crypto
        );
        this.auditLogger = new AuditLogger(config.auditFile(), replicaClock.clientId(), settings.auditSigningSecret());
        ReconciliationEngine engine = new ReconciliationEngine(
                settings.fuzzyMatchWindowDays(), settings.startingBalancePayee(), clock);
        this.bankSync = bankFeeds == null
                ? null
                : new BankSyncService(this::openSession, bankFeeds, engine, settings.bankSyncLookbackDays(), clock);

        auditLogger.log(AuditLogger.AuditEvent.of(
                "settings.load",
                "system",
                "settings/" + config.settingsFile().getFileName(),
                "ok",
                groupId(),
                Map.of(
                        "kdf_iterations", settings.kdfIterations(),
                        "fuzzy_match_window_days", settings.fuzzyMatchWindowDays(),
                        "bank_sync_lookback_days", settings.bankSyncLookbackDays()
                )
        ));
    }

    public LedgerSyncConfig config() {
        return config;
    }

    public SyncSettings settings() {
        return settings;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public String clientId() {
        return syncSession.context().clientId();
    }

    public String groupId() {
        return syncSession.context().groupId();
    }

    public ReplicaClock clock() {
        return syncSession.context().clock();
    }

    public ReplicaStatus init(String budgetName) {
        if (budgetName != null && !budgetName.isBlank()) {
            metadata.patch(Map.of(METADATA_BUDGET_NAME, budgetName.trim()));
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "replica.init",
                "cli",
                "replica/" + clientId(),
                "ok",
                groupId(),
                Map.of("root", config.rootDir().toString())
        ));
        return status();
    }

    /**
     * Creates a new sync group on the relay and makes this replica its first member.
     */
    public String registerGroup() {
        replicaLock.lock();
        try {
            String groupId = relay.registerGroup();
            joinLocked(groupId);
            return groupId;
        } finally {
            replicaLock.unlock();
        }
    }

    public void joinGroup(String groupId) {
        replicaLock.lock();
        try {
            if (!relay.groupExists(groupId)) {
                throw new IllegalArgumentException("Unknown sync group: " + groupId);
            }
            joinLocked(groupId);
        } finally {
            replicaLock.unlock();
        }
    }

    private void joinLocked(String groupId) {
        metadata.patch(Map.of(METADATA_GROUP_ID, groupId));
        syncSession.context().groupId(groupId);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "replica.init",
                "cli",
                "group/" + groupId,
                "joined",
                groupId,
                Map.of("client_id", clientId())
        ));
    }

    /**
     * Opens a local editing session. Its records are sent after a successful commit. The session
     * holds the replica lock until it commits or aborts, so it must be finished on the opening
     * thread.
     */
    public LedgerSession openSession() {
        replicaLock.lock();
        try {
            return new LedgerSession(store.begin(), syncSession, this::afterCommit, replicaLock::unlock);
        } catch (RuntimeException e) {
            replicaLock.unlock();
            throw e;
        }
    }

    public List<ChangeRecord> set(String dataset, String row, String column, Variant value) {
        try (LedgerSession session = openSession()) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(column, value);
            session.update(dataset, row, attributes);
            return session.commit();
        }
    }

    public Optional<EntityRow> get(String dataset, String row) {
        return store.find(dataset, row);
    }

    public SyncOutcome sync() {
        replicaLock.lock();
        try {
            SyncOutcome outcome = syncSession.sync();
            if (!outcome.sent().skipped()) {
                auditSend(outcome.sent());
            }
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "sync.apply",
                    "system",
                    "replica/" + clientId(),
                    outcome.cancelled() ? "cancelled" : "ok",
                    groupId(),
                    Map.of(
                            "payloads", outcome.payloadsReceived(),
                            "applied", outcome.recordsApplied(),
                            "skipped_stale", outcome.applied().skippedStale(),
                            "clock", outcome.clock().lastTimestamp().toString()
                    )
            ));
            return outcome;
        } catch (RuntimeException e) {
            failed("sync", e);
            throw e;
        } finally {
            replicaLock.unlock();
        }
    }

    public void requestCancel() {
        syncSession.requestCancel();
    }

    /**
     * Sets a password on the group: registers a new key with the relay and encrypts every change
     * set sent from now on.
     */
    public String enableEncryption(String password) {
        replicaLock.lock();
        try {
            String groupId = requireGroup();
            String keyId = UUID.randomUUID().toString();
            byte[] salt = crypto.makeSalt();
            SecretKey key = crypto.deriveKey(password, salt);
            EncryptedPayload test = crypto.encrypt(keyId, key, keyTestContent(keyId));
            relay.createKey(groupId, keyId, salt, test);
            metadata.patch(Map.of(METADATA_ENCRYPT_KEY_ID, keyId));
            syncSession.context().encryptKeyId(keyId);
            syncSession.context().encryption(new EncryptionContext(keyId, key, salt));
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "encryption.enable",
                    "cli",
                    "group/" + groupId,
                    "ok",
                    groupId,
                    Map.of("key_id", keyId)
            ));
            LOG.info("Encryption enabled for group {} with key {}", groupId, keyId);
            return keyId;
        } finally {
            replicaLock.unlock();
        }
    }

    /**
     * Derives the master key of the group's registered key and checks it against the key's test
     * payload.
     */
    public void unlock(String password) {
        replicaLock.lock();
        try {
            String groupId = requireGroup();
            KeyRegistry.KeyInfo info = relay.getKey(groupId)
                    .orElseThrow(() -> new KeyDerivationException("No encryption key registered for group " + groupId));
            SecretKey key = crypto.deriveKey(password, info.salt());
            try {
                crypto.decrypt(key, info.testContent().value(), info.testContent().meta());
            } catch (DecryptionException e) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "encryption.unlock", "cli", "group/" + groupId, "rejected", groupId,
                        Map.of("key_id", info.keyId())
                ));
                throw new KeyDerivationException("Password does not match the encryption key of group " + groupId, e);
            }
            metadata.patch(Map.of(METADATA_ENCRYPT_KEY_ID, info.keyId()));
            syncSession.context().encryptKeyId(info.keyId());
            syncSession.context().encryption(new EncryptionContext(info.keyId(), key, info.salt()));
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "encryption.unlock", "cli", "group/" + groupId, "ok", groupId,
                    Map.of("key_id", info.keyId())
            ));
        } finally {
            replicaLock.unlock();
        }
    }

    public List<ReconciledTransaction> runBankSync(String account, LocalDate startDate) {
        if (bankSync == null) {
            throw new IllegalStateException("No bank feed provider configured");
        }
        try {
            List<ReconciledTransaction> imported = bankSync.run(account, startDate);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "bank.sync",
                    "system",
                    account == null ? "accounts/*" : "accounts/" + account,
                    "ok",
                    groupId(),
                    Map.of("changed", imported.size())
            ));
            return imported;
        } catch (RuntimeException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "bank.sync",
                    "system",
                    account == null ? "accounts/*" : "accounts/" + account,
                    "failed",
                    groupId(),
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
            throw e;
        }
    }

    public int cleanup() {
        replicaLock.lock();
        try {
            int removed = store.cleanup();
            LOG.info("Removed {} tombstoned rows", removed);
            return removed;
        } finally {
            replicaLock.unlock();
        }
    }

    public ReplicaStatus status() {
        ReplicaClock clock = clock();
        return new ReplicaStatus(
                clientId(),
                groupId(),
                metadata.text(METADATA_BUDGET_NAME),
                syncSession.context().encrypted(),
                syncSession.context().unlocked(),
                syncSession.state().name(),
                clock.lastTimestamp().toString(),
                clock.lastAcknowledged().toString(),
                store.pendingOutgoing().size(),
                database.listSchemaMigrations(100).size()
        );
    }

    private void afterCommit(List<ChangeRecord> records) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                "session.commit",
                "system",
                "replica/" + clientId(),
                "ok",
                groupId(),
                Map.of("records", records.size())
        ));
        if (groupId() == null) {
            return;
        }
        replicaLock.lock();
        try {
            SendOutcome sent = syncSession.pushOutgoing();
            if (!sent.skipped()) {
                auditSend(sent);
            }
        } catch (RuntimeException e) {
            // the commit is durable; records stay queued and go out with the next round
            failed("send", e);
        } finally {
            replicaLock.unlock();
        }
    }

    private void auditSend(SendOutcome sent) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                "sync.send",
                "system",
                "changeset/" + sent.payloadId(),
                "ok",
                groupId(),
                Map.of("records", sent.records(), "encrypted", sent.encrypted())
        ));
    }

    private void failed(String phase, RuntimeException e) {
        LOG.warn("Sync {} failed for replica {}: {}", phase, clientId(), e.getMessage());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "sync.failed",
                "system",
                "replica/" + clientId(),
                "failed",
                groupId(),
                Map.of("phase", phase, "error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage()))
        ));
        syncSession.recover();
    }

    private String requireGroup() {
        String groupId = groupId();
        if (groupId == null) {
            throw new IllegalStateException("Replica is not registered with a sync group");
        }
        return groupId;
    }

    private static byte[] keyTestContent(String keyId) {
        return ("ledgersync-key-test:" + keyId + ":" + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
    }

    public record ReplicaStatus(
            String clientId,
            String groupId,
            String budgetName,
            boolean encrypted,
            boolean unlocked,
            String syncState,
            String lastTimestamp,
            String lastAcknowledged,
            int pendingOutgoing,
            int schemaMigrations
    ) {
    }
}
