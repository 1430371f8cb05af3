package io.ledgersync.security;

import javax.crypto.SecretKey;
import java.util.Objects;

/**
 * Unlocked key material of an encrypted replica. Lives only in memory.
 */
public final class EncryptionContext {
    private final String keyId;
    private final SecretKey masterKey;
    private final byte[] salt;

    public EncryptionContext(String keyId, SecretKey masterKey, byte[] salt) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId must not be blank");
        }
        this.keyId = keyId;
        this.masterKey = Objects.requireNonNull(masterKey, "masterKey");
        this.salt = salt == null ? new byte[0] : salt.clone();
    }

    public String keyId() {
        return keyId;
    }

    public SecretKey masterKey() {
        return masterKey;
    }

    public byte[] salt() {
        return salt.clone();
    }

    @Override
    public String toString() {
        return "EncryptionContext[keyId=" + keyId + ", masterKey=***]";
    }
}
