package io.ledgersync.security;

/**
 * Metadata travelling next to an encrypted payload. {@code iv} and {@code authTag} are base64.
 */
public record EncryptionMeta(String keyId, String algorithm, String iv, String authTag) {
}
