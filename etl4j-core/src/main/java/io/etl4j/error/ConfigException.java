package io.etl4j.error;

import java.util.Map;

/**
 * Missing or invalid OAuth or destination configuration. Needs an operator or user fix.
 */
public class ConfigException extends EtlException {

    public ConfigException(String message) {
        super(message, "CONFIG_ERROR", Map.of(), false, null);
    }

    public ConfigException(String message, Map<String, Object> details) {
        super(message, "CONFIG_ERROR", details, false, null);
    }

    public ConfigException(String message, Map<String, Object> details, Throwable cause) {
        super(message, "CONFIG_ERROR", details, false, cause);
    }
}
