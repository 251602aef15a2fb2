package io.etl4j.crypto;

import io.etl4j.core.EncryptedBlob;
import io.etl4j.core.SensitiveField;
import io.etl4j.error.CryptoException;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CredentialCipherTest {

    private final CredentialCipher cipher = new CredentialCipher("test-master-secret", 1_000);

    @Test
    void decryptShouldReturnOriginalPlaintext() {
        EncryptedBlob blob = cipher.encrypt("ya29.access-token-äöü");
        assertEquals("ya29.access-token-äöü", cipher.decrypt(blob));
    }

    @Test
    void encryptingSameValueTwiceShouldYieldDifferentBlobs() {
        EncryptedBlob a = cipher.encrypt("same");
        EncryptedBlob b = cipher.encrypt("same");

        assertNotEquals(a.ciphertext(), b.ciphertext());
        assertNotEquals(a.iv(), b.iv());
        assertNotEquals(a.salt(), b.salt());
        assertEquals(12, Base64.getDecoder().decode(a.iv()).length);
        assertEquals(64, Base64.getDecoder().decode(a.salt()).length);
        assertEquals(16, Base64.getDecoder().decode(a.tag()).length);
    }

    @Test
    void flippedByteInCiphertextShouldFailClosed() {
        EncryptedBlob blob = cipher.encrypt("refresh-token-value");
        byte[] ct = Base64.getDecoder().decode(blob.ciphertext());
        for (int i = 0; i < ct.length; i++) {
            byte[] copy = ct.clone();
            copy[i] ^= 0x01;
            EncryptedBlob tampered = new EncryptedBlob(Base64.getEncoder().encodeToString(copy), blob.iv(), blob.salt(), blob.tag());
            assertThrows(CryptoException.class, () -> cipher.decrypt(tampered));
        }
    }

    @Test
    void flippedByteInTagOrIvOrSaltShouldFailClosed() {
        EncryptedBlob blob = cipher.encrypt("client-secret");

        assertThrows(CryptoException.class, () -> cipher.decrypt(
                new EncryptedBlob(blob.ciphertext(), blob.iv(), blob.salt(), flipFirstByte(blob.tag()))));
        assertThrows(CryptoException.class, () -> cipher.decrypt(
                new EncryptedBlob(blob.ciphertext(), flipFirstByte(blob.iv()), blob.salt(), blob.tag())));
        assertThrows(CryptoException.class, () -> cipher.decrypt(
                new EncryptedBlob(blob.ciphertext(), blob.iv(), flipFirstByte(blob.salt()), blob.tag())));
    }

    @Test
    void wrongMasterSecretShouldFail() {
        EncryptedBlob blob = cipher.encrypt("value");
        CredentialCipher other = new CredentialCipher("another-secret", 1_000);
        assertThrows(CryptoException.class, () -> other.decrypt(blob));
    }

    @Test
    void malformedBase64ShouldFail() {
        EncryptedBlob blob = cipher.encrypt("value");
        assertThrows(CryptoException.class, () -> cipher.decrypt(
                new EncryptedBlob("%%%not-base64", blob.iv(), blob.salt(), blob.tag())));
    }

    @Test
    void missingMasterSecretShouldRefuseToStart() {
        assertThrows(CryptoException.class, () -> new CredentialCipher(null));
        assertThrows(CryptoException.class, () -> new CredentialCipher("  "));
    }

    @Test
    void decryptFieldsShouldOnlyTouchNamedFields() {
        Map<SensitiveField, EncryptedBlob> stored = cipher.encryptFields(Map.of(
                SensitiveField.ACCESS_TOKEN, "access",
                SensitiveField.REFRESH_TOKEN, "refresh",
                SensitiveField.CLIENT_SECRET, ""));

        assertFalse(stored.containsKey(SensitiveField.CLIENT_SECRET));

        Map<SensitiveField, String> plain = cipher.decryptFields(stored, EnumSet.of(SensitiveField.ACCESS_TOKEN));
        assertEquals(Map.of(SensitiveField.ACCESS_TOKEN, "access"), plain);
        assertTrue(stored.containsKey(SensitiveField.REFRESH_TOKEN));
    }

    private static String flipFirstByte(String b64) {
        byte[] bytes = Base64.getDecoder().decode(b64);
        bytes[0] ^= 0x01;
        return Base64.getEncoder().encodeToString(bytes);
    }
}
