package io.etl4j.error;

import java.util.Map;

/**
 * Encryption setup failure or a ciphertext that did not authenticate.
 */
public class CryptoException extends EtlException {

    public CryptoException(String message) {
        super(message, "CRYPTO_ERROR", Map.of(), false, null);
    }

    public CryptoException(String message, Map<String, Object> details) {
        super(message, "CRYPTO_ERROR", details, false, null);
    }

    public CryptoException(String message, Map<String, Object> details, Throwable cause) {
        super(message, "CRYPTO_ERROR", details, false, cause);
    }
}
