package io.etl4j.crypto;

import io.etl4j.core.EncryptedBlob;
import io.etl4j.core.SensitiveField;
import io.etl4j.error.CryptoException;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * AES-256-GCM encryption of single credential values.
 *
 * <p>Each call draws a fresh 64-byte salt and 12-byte IV; the key is derived from the master
 * secret and that salt with PBKDF2WithHmacSHA512. The master secret alone therefore cannot
 * decrypt a value without its stored salt.
 *
 * <p>Decryption fails closed: any tampering, wrong secret or malformed input raises
 * {@link CryptoException}.
 */
public class CredentialCipher {

    public static final int DEFAULT_ITERATIONS = 100_000;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String KDF = "PBKDF2WithHmacSHA512";
    private static final int KEY_BITS = 256;
    private static final int IV_BYTES = 12;
    private static final int SALT_BYTES = 64;
    private static final int TAG_BYTES = 16;

    private final char[] masterSecret;
    private final int iterations;
    private final SecureRandom random = new SecureRandom();

    public CredentialCipher(String masterSecret) {
        this(masterSecret, DEFAULT_ITERATIONS);
    }

    public CredentialCipher(String masterSecret, int iterations) {
        if (masterSecret == null || masterSecret.isBlank()) {
            throw new CryptoException("master secret is not configured; refusing to start without it");
        }
        if (iterations < 1) {
            throw new CryptoException("key derivation iterations must be positive");
        }
        this.masterSecret = masterSecret.toCharArray();
        this.iterations = iterations;
    }

    public EncryptedBlob encrypt(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext must not be null");
        byte[] salt = randomBytes(SALT_BYTES);
        byte[] iv = randomBytes(IV_BYTES);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_BYTES * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            // JCE appends the tag to the ciphertext
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_BYTES);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_BYTES, sealed.length);
            Base64.Encoder b64 = Base64.getEncoder();
            return new EncryptedBlob(b64.encodeToString(ciphertext), b64.encodeToString(iv),
                    b64.encodeToString(salt), b64.encodeToString(tag));
        } catch (GeneralSecurityException e) {
            throw new CryptoException("encryption failed", Map.of(), e);
        }
    }

    public String decrypt(EncryptedBlob blob) {
        Objects.requireNonNull(blob, "blob must not be null");
        byte[] ciphertext;
        byte[] iv;
        byte[] salt;
        byte[] tag;
        try {
            Base64.Decoder b64 = Base64.getDecoder();
            ciphertext = b64.decode(blob.ciphertext());
            iv = b64.decode(blob.iv());
            salt = b64.decode(blob.salt());
            tag = b64.decode(blob.tag());
        } catch (IllegalArgumentException e) {
            throw new CryptoException("encrypted value is not valid Base64", Map.of(), e);
        }
        if (iv.length != IV_BYTES || tag.length != TAG_BYTES || salt.length == 0) {
            throw new CryptoException("encrypted value has invalid iv, salt or tag length");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_BYTES * 8, iv));
            byte[] sealed = new byte[ciphertext.length + tag.length];
            System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
            System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("decryption failed: value was tampered with or the key is wrong", Map.of(), e);
        }
    }

    /**
     * Encrypt every given value. Blank values are skipped.
     */
    public Map<SensitiveField, EncryptedBlob> encryptFields(Map<SensitiveField, String> values) {
        Map<SensitiveField, EncryptedBlob> out = new EnumMap<>(SensitiveField.class);
        values.forEach((field, value) -> {
            if (value != null && !value.isBlank()) {
                out.put(field, encrypt(value));
            }
        });
        return out;
    }

    /**
     * Decrypt only the named fields; fields that are not stored are absent from the result.
     */
    public Map<SensitiveField, String> decryptFields(Map<SensitiveField, EncryptedBlob> stored, Collection<SensitiveField> fields) {
        Map<SensitiveField, String> out = new EnumMap<>(SensitiveField.class);
        for (SensitiveField field : fields) {
            EncryptedBlob blob = stored.get(field);
            if (blob != null) {
                out.put(field, decrypt(blob));
            }
        }
        return out;
    }

    private SecretKeySpec deriveKey(byte[] salt) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(masterSecret, salt, iterations, KEY_BITS);
        try {
            byte[] key = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
            return new SecretKeySpec(key, "AES");
        } finally {
            spec.clearPassword();
        }
    }

    private byte[] randomBytes(int n) {
        byte[] b = new byte[n];
        random.nextBytes(b);
        return b;
    }
}
