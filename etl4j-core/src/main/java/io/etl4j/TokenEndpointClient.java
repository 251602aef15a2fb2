package io.etl4j;

import io.etl4j.core.TokenResponse;

import java.util.Map;

/**
 * Posts a form to an OAuth token endpoint.
 *
 * <p>Implementations must apply connect/read timeouts and report failures as
 * {@link io.etl4j.error.ProviderException} with the HTTP status (0 when there was no response).
 */
public interface TokenEndpointClient {

    TokenResponse exchange(String tokenUrl, Map<String, String> form);
}
