package io.ledgersync.sync;

import io.ledgersync.clock.HybridLogicalClock;
import io.ledgersync.clock.LogicalTimestamp;
import io.ledgersync.clock.ReplicaClock;
import io.ledgersync.clock.TimestampIssuer;
import io.ledgersync.codec.ChangeSetCodec;
import io.ledgersync.model.ChangeRecord;
import io.ledgersync.model.RelayPayload;
import io.ledgersync.model.SendAck;
import io.ledgersync.model.SyncState;
import io.ledgersync.security.DecryptionException;
import io.ledgersync.security.EncryptedPayload;
import io.ledgersync.security.EncryptionContext;
import io.ledgersync.security.KeyDerivationException;
import io.ledgersync.security.PayloadCrypto;
import io.ledgersync.storage.LedgerStore;
import io.ledgersync.storage.LedgerTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Exchanges change sets with the relay for one replica.
 *
 * <p>A round moves {@code IDLE -> SENDING -> AWAITING_REMOTE -> APPLYING -> IDLE}. Any failure
 * leaves the session in {@code ERROR} until {@link #recover()} reloads the persisted clock.
 * Remote records and the advanced clock are committed in one local transaction, so the clock never
 * moves past records that were not stored.
 */
public final class SyncSession implements TimestampIssuer {
    private static final Logger LOG = LoggerFactory.getLogger(SyncSession.class);

    private final ReplicaContext context;
    private final LedgerStore store;
    private final RelayTransport transport;
    private final MergeApplier applier;
    private final HybridLogicalClock clock;
    private final ChangeSetCodec codec;
    private final PayloadCrypto crypto;
    private SyncState state = SyncState.IDLE;
    private volatile boolean cancelRequested;

    public SyncSession(
            ReplicaContext context,
            LedgerStore store,
            RelayTransport transport,
            MergeApplier applier,
            HybridLogicalClock clock,
            ChangeSetCodec codec,
            PayloadCrypto crypto
    ) {
        this.context = context;
        this.store = store;
        this.transport = transport;
        this.applier = applier;
        this.clock = clock;
        this.codec = codec;
        this.crypto = crypto;
    }

    public synchronized SyncState state() {
        return state;
    }

    public ReplicaContext context() {
        return context;
    }

    /**
     * Asks the running or next round to stop at the next phase boundary before applying.
     */
    public void requestCancel() {
        cancelRequested = true;
    }

    public synchronized void recover() {
        context.clock(store.loadClock());
        cancelRequested = false;
        state = SyncState.IDLE;
        LOG.info("Sync session recovered, clock={}", context.clock().lastTimestamp());
    }

    @Override
    public synchronized LogicalTimestamp issue() {
        ensureNotFailed();
        ReplicaClock current = context.clock();
        LogicalTimestamp next = clock.now(current.lastTimestamp());
        context.clock(current.withLastTimestamp(next));
        return next;
    }

    /**
     * Sends {@code records} as one change set. Skipped when the replica has no sync group or there is
     * nothing to send.
     */
    public synchronized SendOutcome send(List<ChangeRecord> records) {
        requireIdle();
        SendOutcome outcome = phase(SyncState.SENDING, () -> sendRecords(records));
        state = SyncState.IDLE;
        return outcome;
    }

    /**
     * Sends the committed records still queued in the store and drops them once the relay accepted
     * them.
     */
    public synchronized SendOutcome pushOutgoing() {
        requireIdle();
        SendOutcome outcome = phase(SyncState.SENDING, this::sendQueued);
        state = SyncState.IDLE;
        return outcome;
    }

    /**
     * Fetches and decodes the backlog. Leaves the clock and the store untouched.
     */
    public synchronized Backlog receive() {
        requireIdle();
        Backlog backlog = phase(SyncState.AWAITING_REMOTE, this::fetchBacklog);
        state = SyncState.IDLE;
        return backlog;
    }

    public synchronized SyncOutcome apply(Backlog backlog) {
        requireIdle();
        if (consumeCancel()) {
            return SyncOutcome.cancelled(null, context.clock());
        }
        SyncOutcome outcome = phase(SyncState.APPLYING, () -> applyBacklog(backlog, SendOutcome.none()));
        state = SyncState.IDLE;
        return outcome;
    }

    /**
     * One full round: queued local records out, remote backlog in.
     */
    public synchronized SyncOutcome sync() {
        requireIdle();
        if (consumeCancel()) {
            return SyncOutcome.cancelled(null, context.clock());
        }
        SendOutcome sent = phase(SyncState.SENDING, this::sendQueued);
        if (consumeCancel()) {
            state = SyncState.IDLE;
            return SyncOutcome.cancelled(sent, context.clock());
        }
        Backlog backlog = phase(SyncState.AWAITING_REMOTE, this::fetchBacklog);
        if (consumeCancel()) {
            state = SyncState.IDLE;
            return SyncOutcome.cancelled(sent, context.clock());
        }
        SyncOutcome outcome = phase(SyncState.APPLYING, () -> applyBacklog(backlog, sent));
        state = SyncState.IDLE;
        return outcome;
    }

    private SendOutcome sendQueued() {
        List<ChangeRecord> queued = store.pendingOutgoing();
        SendOutcome outcome = sendRecords(queued);
        if (!outcome.skipped()) {
            List<LogicalTimestamp> sent = new ArrayList<>(queued.size());
            for (ChangeRecord record : queued) {
                sent.add(record.timestamp());
            }
            store.removeOutgoing(sent);
        }
        return outcome;
    }

    private SendOutcome sendRecords(List<ChangeRecord> records) {
        String groupId = context.groupId();
        if (groupId == null || records == null || records.isEmpty()) {
            return SendOutcome.none();
        }
        requireUnlocked();
        LogicalTimestamp highest = null;
        for (ChangeRecord record : records) {
            highest = LogicalTimestamp.max(highest, record.timestamp());
        }
        byte[] encoded = codec.encode(records);
        EncryptionContext encryption = context.encrypted() ? context.encryption() : null;
        RelayPayload payload;
        if (encryption != null) {
            EncryptedPayload sealed = crypto.encrypt(encryption.keyId(), encryption.masterKey(), encoded);
            payload = new RelayPayload(null, groupId, highest.toString(), encryption.keyId(), sealed.value(), sealed.meta());
        } else {
            payload = new RelayPayload(null, groupId, highest.toString(), null, encoded, null);
        }
        SendAck ack = transport.sendChangeSet(groupId, payload.keyId(), payload);
        LOG.debug("Sent {} records to group {} as {}", records.size(), groupId, ack.payloadId());
        return new SendOutcome(false, ack.payloadId(), records.size(), encryption != null);
    }

    private Backlog fetchBacklog() {
        String groupId = context.groupId();
        if (groupId == null) {
            return Backlog.empty();
        }
        requireUnlocked();
        ReplicaClock current = context.clock();
        List<RelayPayload> payloads = transport.fetchBacklog(groupId, current.clientId(), current.lastAcknowledged());
        if (payloads == null || payloads.isEmpty()) {
            return Backlog.empty();
        }
        List<String> ids = new ArrayList<>(payloads.size());
        List<ChangeRecord> records = new ArrayList<>();
        for (RelayPayload payload : payloads) {
            records.addAll(codec.decode(open(payload)));
            ids.add(payload.id());
        }
        records.sort(Comparator.comparing(ChangeRecord::timestamp));
        LogicalTimestamp highest = records.isEmpty() ? null : records.get(records.size() - 1).timestamp();
        LOG.debug("Received {} change sets ({} records) for group {}", ids.size(), records.size(), groupId);
        return new Backlog(ids, records, highest);
    }

    private byte[] open(RelayPayload payload) {
        if (!payload.encrypted()) {
            return payload.value();
        }
        EncryptionContext encryption = context.encryption();
        if (encryption == null) {
            throw new DecryptionException("Change set " + payload.id() + " is encrypted but no key is unlocked");
        }
        if (!encryption.keyId().equals(payload.meta().keyId())) {
            throw new DecryptionException("Change set " + payload.id() + " uses unknown key " + payload.meta().keyId());
        }
        return crypto.decrypt(encryption.masterKey(), payload.value(), payload.meta());
    }

    private SyncOutcome applyBacklog(Backlog backlog, SendOutcome sent) {
        if (backlog == null || backlog.isEmpty()) {
            return new SyncOutcome(false, sent, 0, ApplySummary.empty(), context.clock());
        }
        ApplySummary summary;
        ReplicaClock next;
        try (LedgerTransaction tx = store.begin()) {
            summary = applier.apply(tx, backlog.records());
            ReplicaClock current = context.clock();
            LogicalTimestamp observed = backlog.maxObserved();
            next = observed == null
                    ? current
                    : current.acknowledge(clock.receive(current.lastTimestamp(), observed), observed);
            tx.saveClock(next);
            applier.publishPreferences(summary);
            tx.commit();
        }
        context.clock(next);
        transport.acknowledge(context.groupId(), next.clientId(), backlog.payloadIds());
        LOG.debug("Applied {} records, clock now {}", summary.applied(), next.lastTimestamp());
        return new SyncOutcome(false, sent, backlog.payloadIds().size(), summary, next);
    }

    private <T> T phase(SyncState phase, Supplier<T> body) {
        state = phase;
        try {
            return body.get();
        } catch (RuntimeException e) {
            state = SyncState.ERROR;
            LOG.warn("Sync phase {} failed: {}", phase, e.getMessage());
            throw e;
        }
    }

    private boolean consumeCancel() {
        if (!cancelRequested) {
            return false;
        }
        cancelRequested = false;
        LOG.info("Sync round cancelled in state {}", state);
        return true;
    }

    private void requireUnlocked() {
        if (context.encrypted() && !context.unlocked()) {
            throw new KeyDerivationException("Replica is encrypted with key " + context.encryptKeyId()
                    + " and has not been unlocked");
        }
    }

    private void requireIdle() {
        ensureNotFailed();
        if (state != SyncState.IDLE) {
            throw new IllegalStateException("Sync session is busy: " + state);
        }
    }

    private void ensureNotFailed() {
        if (state == SyncState.ERROR) {
            throw new IllegalStateException("Sync session failed; call recover() first");
        }
    }
}
