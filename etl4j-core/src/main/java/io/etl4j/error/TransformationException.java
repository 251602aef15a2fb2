package io.etl4j.error;

import java.util.Map;

/**
 * A transformation definition could not be applied, typically an unknown operation type.
 */
public class TransformationException extends EtlException {

    public TransformationException(String message) {
        super(message, "TRANSFORMATION_ERROR", Map.of(), false, null);
    }

    public TransformationException(String message, Map<String, Object> details) {
        super(message, "TRANSFORMATION_ERROR", details, false, null);
    }

    public TransformationException(String message, Map<String, Object> details, Throwable cause) {
        super(message, "TRANSFORMATION_ERROR", details, false, cause);
    }
}
