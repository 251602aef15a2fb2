package io.etl4j.oauth;

import java.time.Duration;
import java.util.Objects;

/**
 * @param refreshThreshold refresh when the access token expires within this window
 * @param stateTtl         lifetime of an issued authorization state
 */
public record OAuthSettings(Duration refreshThreshold, Duration stateTtl) {
    public OAuthSettings {
        Objects.requireNonNull(refreshThreshold, "refreshThreshold must not be null");
        Objects.requireNonNull(stateTtl, "stateTtl must not be null");
        if (stateTtl.isNegative() || stateTtl.isZero()) {
            throw new IllegalArgumentException("stateTtl must be a positive duration");
        }
    }

    public static OAuthSettings defaults() {
        return new OAuthSettings(Duration.ofMinutes(5), Duration.ofMinutes(10));
    }
}
