package io.etl4j.core;

/**
 * Token endpoint answer. {@code refreshToken} is null when the provider did not issue a new one.
 */
public record TokenResponse(String accessToken, String refreshToken, long expiresIn) {

    @Override
    public String toString() {
        return "TokenResponse[expiresIn=" + expiresIn + ", refreshToken=" + (refreshToken != null) + "]";
    }
}
