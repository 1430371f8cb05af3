package io.ledgersync.sync;

import io.ledgersync.clock.ReplicaClock;
import io.ledgersync.security.EncryptionContext;

import java.util.Objects;

/**
 * Mutable state of one replica: sync group, clock checkpoint and unlocked key.
 */
public final class ReplicaContext {
    private String groupId;
    private String encryptKeyId;
    private ReplicaClock clock;
    private EncryptionContext encryption;

    public ReplicaContext(String groupId, String encryptKeyId, ReplicaClock clock) {
        this.groupId = blankToNull(groupId);
        this.encryptKeyId = blankToNull(encryptKeyId);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String groupId() {
        return groupId;
    }

    public void groupId(String groupId) {
        this.groupId = blankToNull(groupId);
    }

    public String clientId() {
        return clock.clientId();
    }

    public ReplicaClock clock() {
        return clock;
    }

    public void clock(ReplicaClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Key id the replica's data is encrypted under, or null for a plaintext replica.
     */
    public String encryptKeyId() {
        return encryptKeyId;
    }

    public void encryptKeyId(String encryptKeyId) {
        this.encryptKeyId = blankToNull(encryptKeyId);
    }

    public EncryptionContext encryption() {
        return encryption;
    }

    public void encryption(EncryptionContext encryption) {
        this.encryption = encryption;
    }

    public boolean encrypted() {
        return encryptKeyId != null;
    }

    public boolean unlocked() {
        return encryption != null && encryption.keyId().equals(encryptKeyId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
