package io.etl4j.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base type of every failure raised by etl4j.
 *
 * <p>Each subtype carries a stable {@link #code()} and a free-form {@link #details()} map. Lower
 * layers wrap the original failure as the cause instead of discarding it, so the execution record
 * can show the whole chain via {@link #toErrorDetails()}.
 */
public class EtlException extends RuntimeException {

    private final String code;
    private final Map<String, Object> details;
    private final boolean retryable;

    public EtlException(String message, String code) {
        this(message, code, Map.of(), false, null);
    }

    public EtlException(String message, String code, Map<String, Object> details, boolean retryable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.retryable = retryable;
    }

    public String code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }

    /**
     * Whether repeating the failed operation without user action may succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Structured error payload stored on a failed {@code JobExecution}.
     */
    public Map<String, Object> toErrorDetails() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", getClass().getSimpleName());
        out.put("code", code);
        out.put("message", String.valueOf(getMessage()));
        if (!details.isEmpty()) {
            out.put("details", details);
        }
        List<String> causes = new ArrayList<>();
        Throwable c = getCause();
        while (c != null && causes.size() < 10) {
            causes.add(c.getClass().getName() + ": " + c.getMessage());
            c = c.getCause();
        }
        if (!causes.isEmpty()) {
            out.put("causes", causes);
        }
        return out;
    }
}
