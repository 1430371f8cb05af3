package io.ledgersync.security;

public record EncryptedPayload(byte[] value, EncryptionMeta meta) {
}
