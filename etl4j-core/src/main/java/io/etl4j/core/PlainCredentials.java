package io.etl4j.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decrypted credentials handed to a {@link io.etl4j.DestinationClient} for a single upload.
 * Never persisted; {@link #toString()} does not print secret values.
 */
public final class PlainCredentials {

    private final Map<String, String> config;
    private final Map<SensitiveField, String> secrets;

    public PlainCredentials(Map<String, String> config, Map<SensitiveField, String> secrets) {
        this.config = config == null ? Map.of() : Map.copyOf(config);
        EnumMap<SensitiveField, String> copy = new EnumMap<>(SensitiveField.class);
        if (secrets != null) {
            copy.putAll(secrets);
        }
        this.secrets = Collections.unmodifiableMap(copy);
    }

    public Map<String, String> config() {
        return config;
    }

    public String config(String key) {
        return config.get(key);
    }

    public String secret(SensitiveField field) {
        return secrets.get(field);
    }

    public String accessToken() {
        return secrets.get(SensitiveField.ACCESS_TOKEN);
    }

    public boolean has(SensitiveField field) {
        return secrets.containsKey(field);
    }

    @Override
    public String toString() {
        return "PlainCredentials{config=" + config + ", secrets=" + secrets.keySet() + "=[REDACTED]}";
    }
}
