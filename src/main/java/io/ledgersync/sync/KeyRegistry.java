package io.ledgersync.sync;

import io.ledgersync.security.EncryptedPayload;

import java.util.Optional;

/**
 * Remote store of the group's key parameters. Only the key id, salt and an encrypted test payload
 * are kept; the password and master key never leave the client.
 */
public interface KeyRegistry {
    void createKey(String groupId, String keyId, byte[] salt, EncryptedPayload testContent);

    Optional<KeyInfo> getKey(String groupId);

    record KeyInfo(String keyId, byte[] salt, EncryptedPayload testContent) {
    }
}
