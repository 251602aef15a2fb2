package io.etl4j.error;

import java.util.Map;

/**
 * Unsupported output format or a converter failure.
 */
public class FormatException extends EtlException {

    public FormatException(String message) {
        super(message, "FORMAT_ERROR", Map.of(), false, null);
    }

    public FormatException(String message, Map<String, Object> details) {
        super(message, "FORMAT_ERROR", details, false, null);
    }

    public FormatException(String message, Map<String, Object> details, Throwable cause) {
        super(message, "FORMAT_ERROR", details, false, cause);
    }
}
