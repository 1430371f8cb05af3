package io.ledgersync.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

final class PayloadCryptoTest {
    private final PayloadCrypto crypto = new PayloadCrypto(1_000);

    @Test
    void derivationIsDeterministicPerPasswordAndSalt() {
        byte[] salt = crypto.makeSalt();
        SecretKey first = crypto.deriveKey("correct horse", salt);
        SecretKey second = crypto.deriveKey("correct horse", salt);
        Assertions.assertArrayEquals(first.getEncoded(), second.getEncoded());
        Assertions.assertEquals(32, first.getEncoded().length);

        SecretKey otherPassword = crypto.deriveKey("battery staple", salt);
        Assertions.assertFalse(Arrays.equals(first.getEncoded(), otherPassword.getEncoded()));
        SecretKey otherSalt = crypto.deriveKey("correct horse", crypto.makeSalt());
        Assertions.assertFalse(Arrays.equals(first.getEncoded(), otherSalt.getEncoded()));
    }

    @Test
    void emptyPasswordIsRejected() {
        Assertions.assertThrows(KeyDerivationException.class, () -> crypto.deriveKey("", crypto.makeSalt()));
        Assertions.assertThrows(KeyDerivationException.class, () -> crypto.deriveKey(null, crypto.makeSalt()));
        Assertions.assertThrows(KeyDerivationException.class, () -> crypto.deriveKey("pw", new byte[0]));
    }

    @Test
    void roundTripsAndBindsKeyId() {
        SecretKey key = crypto.deriveKey("pw", crypto.makeSalt());
        byte[] plaintext = "change set bytes".getBytes(StandardCharsets.UTF_8);

        EncryptedPayload sealed = crypto.encrypt("key-1", key, plaintext);
        Assertions.assertEquals(PayloadCrypto.ALGORITHM, sealed.meta().algorithm());
        Assertions.assertEquals("key-1", sealed.meta().keyId());
        Assertions.assertArrayEquals(plaintext, crypto.decrypt(key, sealed.value(), sealed.meta()));

        EncryptionMeta otherKeyId = new EncryptionMeta("key-2", sealed.meta().algorithm(),
                sealed.meta().iv(), sealed.meta().authTag());
        Assertions.assertThrows(DecryptionException.class, () -> crypto.decrypt(key, sealed.value(), otherKeyId));
    }

    @Test
    void tamperingIsDetected() {
        SecretKey key = crypto.deriveKey("pw", crypto.makeSalt());
        EncryptedPayload sealed = crypto.encrypt("key-1", key, "hello ledger".getBytes(StandardCharsets.UTF_8));

        byte[] flipped = sealed.value().clone();
        flipped[0] ^= 0x01;
        Assertions.assertThrows(DecryptionException.class, () -> crypto.decrypt(key, flipped, sealed.meta()));

        byte[] tag = Base64.getDecoder().decode(sealed.meta().authTag());
        tag[3] ^= 0x10;
        EncryptionMeta badTag = new EncryptionMeta("key-1", PayloadCrypto.ALGORITHM, sealed.meta().iv(),
                Base64.getEncoder().encodeToString(tag));
        Assertions.assertThrows(DecryptionException.class, () -> crypto.decrypt(key, sealed.value(), badTag));

        EncryptionMeta shortIv = new EncryptionMeta("key-1", PayloadCrypto.ALGORITHM,
                Base64.getEncoder().encodeToString(new byte[4]), sealed.meta().authTag());
        Assertions.assertThrows(DecryptionException.class, () -> crypto.decrypt(key, sealed.value(), shortIv));

        EncryptionMeta notBase64 = new EncryptionMeta("key-1", PayloadCrypto.ALGORITHM, "%%%", sealed.meta().authTag());
        Assertions.assertThrows(DecryptionException.class, () -> crypto.decrypt(key, sealed.value(), notBase64));

        EncryptionMeta otherAlgorithm = new EncryptionMeta("key-1", "rot13", sealed.meta().iv(), sealed.meta().authTag());
        Assertions.assertThrows(DecryptionException.class, () -> crypto.decrypt(key, sealed.value(), otherAlgorithm));
    }

    @Test
    void wrongKeyFails() {
        SecretKey key = crypto.deriveKey("pw", crypto.makeSalt());
        SecretKey other = crypto.deriveKey("not pw", crypto.makeSalt());
        EncryptedPayload sealed = crypto.encrypt("key-1", key, new byte[]{1, 2, 3});
        Assertions.assertThrows(DecryptionException.class, () -> crypto.decrypt(other, sealed.value(), sealed.meta()));
        Assertions.assertThrows(DecryptionException.class, () -> crypto.decrypt(null, sealed.value(), sealed.meta()));
    }
}
