package io.ledgersync.model;

import io.ledgersync.security.EncryptionMeta;

/**
 * One change set as stored by the relay. {@code timestamp} is the highest record timestamp in the
 * set and stays readable even when {@code value} is encrypted.
 *
 * @param id   relay-assigned id, null before the relay accepted the payload
 * @param meta encryption metadata, null for plaintext payloads
 */
public record RelayPayload(
        String id,
        String groupId,
        String timestamp,
        String keyId,
        byte[] value,
        EncryptionMeta meta
) {
    public boolean encrypted() {
        return meta != null;
    }

    public RelayPayload withId(String assignedId) {
        return new RelayPayload(assignedId, groupId, timestamp, keyId, value, meta);
    }
}
