package io.etl4j.core;

import java.util.List;

/**
 * Provider endpoints and the scopes a destination type must request.
 */
public record OAuthProviderConfig(String provider, String authorizationUrl, String tokenUrl, List<String> scopes) {
    public OAuthProviderConfig {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }
}
