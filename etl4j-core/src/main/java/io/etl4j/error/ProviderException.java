package io.etl4j.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure talking to an external OAuth provider or destination service.
 *
 * <p>{@link #httpStatus()} is 0 when no response was received (timeout, connection reset).
 * Those, 5xx and 429 responses are retryable; other 4xx responses are not.
 */
public class ProviderException extends EtlException {

    private final int httpStatus;

    public ProviderException(String message, int httpStatus, Map<String, Object> details, Throwable cause) {
        super(message, "PROVIDER_ERROR", withStatus(details, httpStatus), isTransient(httpStatus), cause);
        this.httpStatus = httpStatus;
    }

    public static ProviderException noResponse(String message, Throwable cause) {
        return new ProviderException(message, 0, Map.of(), cause);
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean isUnauthorized() {
        return httpStatus == 401;
    }

    public static boolean isTransient(int httpStatus) {
        return httpStatus == 0 || httpStatus == 429 || httpStatus >= 500;
    }

    private static Map<String, Object> withStatus(Map<String, Object> details, int httpStatus) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (details != null) {
            out.putAll(details);
        }
        if (httpStatus > 0) {
            out.put("status", httpStatus);
        }
        return out;
    }
}
