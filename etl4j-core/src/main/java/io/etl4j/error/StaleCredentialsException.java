package io.etl4j.error;

import java.util.Map;

/**
 * A credential update lost an optimistic version check against a concurrent writer.
 */
public class StaleCredentialsException extends EtlException {

    public StaleCredentialsException(String destinationId, long expectedVersion) {
        super("credentials of destination " + destinationId + " changed concurrently", "STALE_CREDENTIALS",
                Map.of("destinationId", destinationId, "expectedVersion", expectedVersion), true, null);
    }
}
