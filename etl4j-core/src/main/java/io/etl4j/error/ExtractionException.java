package io.etl4j.error;

import java.util.Map;

/**
 * The source client failed to deliver records.
 */
public class ExtractionException extends EtlException {

    public ExtractionException(String message) {
        super(message, "EXTRACTION_ERROR", Map.of(), false, null);
    }

    public ExtractionException(String message, Map<String, Object> details) {
        super(message, "EXTRACTION_ERROR", details, false, null);
    }

    public ExtractionException(String message, Map<String, Object> details, Throwable cause) {
        super(message, "EXTRACTION_ERROR", details, false, cause);
    }
}
