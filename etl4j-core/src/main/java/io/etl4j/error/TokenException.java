package io.etl4j.error;

import java.util.Map;

/**
 * A stored token is missing or was rejected by the provider.
 *
 * <p>Never retried: only a new authorization by the user can fix it.
 */
public class TokenException extends EtlException {

    public static final String REAUTHORIZATION_REQUIRED = "Reauthorization required";

    public TokenException(String message) {
        super(message, "TOKEN_ERROR", Map.of(), false, null);
    }

    public TokenException(String message, Map<String, Object> details) {
        super(message, "TOKEN_ERROR", details, false, null);
    }

    public TokenException(String message, Map<String, Object> details, Throwable cause) {
        super(message, "TOKEN_ERROR", details, false, cause);
    }
}
