package io.ledgersync.security;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

public final class PayloadCrypto {
    public static final String ALGORITHM = "aes-256-gcm";
    public static final int DEFAULT_KDF_ITERATIONS = 10_000;
    private static final String KDF = "PBKDF2WithHmacSHA512";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_TAG_BYTES = GCM_TAG_BITS / 8;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;
    private static final int SALT_BYTES = 32;

    private final SecureRandom secureRandom;
    private final int kdfIterations;

    public PayloadCrypto() {
        this(DEFAULT_KDF_ITERATIONS);
    }

    public PayloadCrypto(int kdfIterations) {
        if (kdfIterations < 1) {
            throw new IllegalArgumentException("kdfIterations must be positive");
        }
        this.secureRandom = new SecureRandom();
        this.kdfIterations = kdfIterations;
    }

    public byte[] makeSalt() {
        byte[] salt = new byte[SALT_BYTES];
        secureRandom.nextBytes(salt);
        return salt;
    }

    /**
     * Derives the 256-bit master key for {@code password}. Same password and salt always give the
     * same key.
     */
    public SecretKey deriveKey(String password, byte[] salt) {
        if (password == null || password.isEmpty()) {
            throw new KeyDerivationException("Encryption password must not be empty");
        }
        if (salt == null || salt.length == 0) {
            throw new KeyDerivationException("Key salt must not be empty");
        }
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, kdfIterations, KEY_BYTES * 8);
        try {
            byte[] raw = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
            return new SecretKeySpec(raw, "AES");
        } catch (GeneralSecurityException e) {
            throw new KeyDerivationException("Failed to derive master key", e);
        } finally {
            spec.clearPassword();
        }
    }

    public EncryptedPayload encrypt(String keyId, SecretKey masterKey, byte[] plaintext) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId must not be blank");
        }
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, masterKey, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(keyId.getBytes(StandardCharsets.UTF_8));
            byte[] sealed = cipher.doFinal(plaintext == null ? new byte[0] : plaintext);
            byte[] value = Arrays.copyOfRange(sealed, 0, sealed.length - GCM_TAG_BYTES);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - GCM_TAG_BYTES, sealed.length);
            EncryptionMeta meta = new EncryptionMeta(
                    keyId,
                    ALGORITHM,
                    Base64.getEncoder().encodeToString(iv),
                    Base64.getEncoder().encodeToString(tag)
            );
            return new EncryptedPayload(value, meta);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt payload", e);
        }
    }

    public byte[] decrypt(SecretKey masterKey, byte[] ciphertext, EncryptionMeta meta) {
        if (masterKey == null) {
            throw new DecryptionException("No master key available for encrypted payload");
        }
        if (meta == null || meta.keyId() == null || meta.iv() == null || meta.authTag() == null) {
            throw new DecryptionException("Invalid encrypted payload format: missing keyId/iv/authTag");
        }
        if (!ALGORITHM.equalsIgnoreCase(meta.algorithm())) {
            throw new DecryptionException("Unsupported encryption algorithm: " + meta.algorithm());
        }
        byte[] iv;
        byte[] tag;
        try {
            iv = Base64.getDecoder().decode(meta.iv());
            tag = Base64.getDecoder().decode(meta.authTag());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Invalid encrypted payload format: bad base64", e);
        }
        if (iv.length != GCM_IV_BYTES || tag.length != GCM_TAG_BYTES) {
            throw new DecryptionException("Invalid encrypted payload format: iv/authTag length");
        }
        byte[] body = ciphertext == null ? new byte[0] : ciphertext;
        byte[] sealed = new byte[body.length + tag.length];
        System.arraycopy(body, 0, sealed, 0, body.length);
        System.arraycopy(tag, 0, sealed, body.length, tag.length);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, masterKey, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(meta.keyId().getBytes(StandardCharsets.UTF_8));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Failed to decrypt payload: authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt payload", e);
        }
    }
}
