package io.etl4j.error;

import java.util.Map;

/**
 * Upload to a destination failed, or the destination's credentials could not be read or updated.
 *
 * <p>When {@link #isReauthorizationRequired()} is set the user must authorize the destination again;
 * retrying cannot help.
 */
public class DestinationException extends EtlException {

    private final boolean reauthorizationRequired;

    public DestinationException(String message, Map<String, Object> details, Throwable cause) {
        this(message, details, false, cause);
    }

    public DestinationException(String message, Map<String, Object> details, boolean reauthorizationRequired, Throwable cause) {
        super(message, "DESTINATION_ERROR", details, false, cause);
        this.reauthorizationRequired = reauthorizationRequired;
    }

    public boolean isReauthorizationRequired() {
        return reauthorizationRequired;
    }
}
