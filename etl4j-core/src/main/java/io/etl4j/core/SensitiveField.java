package io.etl4j.core;

import java.util.Arrays;
import java.util.Optional;

/**
 * Credential fields that are only ever stored encrypted.
 */
public enum SensitiveField {
    ACCESS_TOKEN("accessToken"),
    REFRESH_TOKEN("refreshToken"),
    CLIENT_SECRET("clientSecret");

    private final String wireName;

    SensitiveField(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SensitiveField> fromWireName(String name) {
        return Arrays.stream(values()).filter(f -> f.wireName.equals(name)).findFirst();
    }
}
