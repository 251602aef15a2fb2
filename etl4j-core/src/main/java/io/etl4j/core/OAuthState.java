package io.etl4j.core;

import java.time.Instant;

/**
 * Single-use CSRF token issued with an authorization URL.
 */
public record OAuthState(String state, String userId, String destinationId, String provider, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
