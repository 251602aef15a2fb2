package io.etl4j.error;

import java.util.Map;

/**
 * OAuth state parameter missing, expired or already used. The user has to restart authorization.
 */
public class StateException extends EtlException {

    public StateException(String message) {
        super(message, "STATE_ERROR", Map.of(), false, null);
    }

    public StateException(String message, Map<String, Object> details) {
        super(message, "STATE_ERROR", details, false, null);
    }

    public StateException(String message, Map<String, Object> details, Throwable cause) {
        super(message, "STATE_ERROR", details, false, cause);
    }
}
