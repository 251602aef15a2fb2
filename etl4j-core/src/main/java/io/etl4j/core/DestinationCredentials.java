package io.etl4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stored credentials of a destination.
 *
 * <p>{@code config} holds public values (client id, redirect uri, host, folder path) in plaintext.
 * Anything listed in {@link SensitiveField} can only live in {@code secrets}, which holds
 * ciphertext.
 */
public record DestinationCredentials(
        Map<String, String> config,
        Map<SensitiveField, EncryptedBlob> secrets,
        Instant tokenExpiresAt,
        CredentialState state
) {
    public DestinationCredentials {
        config = config == null ? Map.of() : Map.copyOf(config);
        for (String key : config.keySet()) {
            if (SensitiveField.fromWireName(key).isPresent()) {
                throw new IllegalArgumentException("sensitive field must not be stored in plaintext config: " + key);
            }
        }
        EnumMap<SensitiveField, EncryptedBlob> copy = new EnumMap<>(SensitiveField.class);
        if (secrets != null) {
            copy.putAll(secrets);
        }
        secrets = Collections.unmodifiableMap(copy);
        state = state == null ? CredentialState.UNAUTHORIZED : state;
    }

    public static DestinationCredentials empty() {
        return new DestinationCredentials(Map.of(), Map.of(), null, CredentialState.UNAUTHORIZED);
    }

    public Optional<String> configValue(String key) {
        return Optional.ofNullable(config.get(key)).filter(v -> !v.isBlank());
    }

    public boolean has(SensitiveField field) {
        return secrets.containsKey(field);
    }

    public DestinationCredentials withSecrets(Map<SensitiveField, EncryptedBlob> replaced,
                                              Instant expiresAt, CredentialState newState) {
        EnumMap<SensitiveField, EncryptedBlob> merged = new EnumMap<>(SensitiveField.class);
        merged.putAll(secrets);
        merged.putAll(replaced);
        return new DestinationCredentials(config, merged, expiresAt, newState);
    }

    public DestinationCredentials withState(CredentialState newState) {
        return new DestinationCredentials(config, secrets, tokenExpiresAt, newState);
    }

    /**
     * Drops the access and refresh tokens and the expiry. The client secret is kept.
     */
    public DestinationCredentials revoked() {
        EnumMap<SensitiveField, EncryptedBlob> kept = new EnumMap<>(SensitiveField.class);
        EncryptedBlob clientSecret = secrets.get(SensitiveField.CLIENT_SECRET);
        if (clientSecret != null) {
            kept.put(SensitiveField.CLIENT_SECRET, clientSecret);
        }
        return new DestinationCredentials(config, kept, null, CredentialState.REVOKED);
    }
}
