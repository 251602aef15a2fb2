package io.etl4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * One credential mutation. Old and new values are already redacted.
 */
public record CredentialAuditRecord(
        String destinationId,
        AuditAction action,
        Map<String, Object> oldCredentials,
        Map<String, Object> newCredentials,
        Instant recordedAt
) {
    public CredentialAuditRecord {
        oldCredentials = oldCredentials == null ? Map.of() : Map.copyOf(oldCredentials);
        newCredentials = newCredentials == null ? Map.of() : Map.copyOf(newCredentials);
    }
}
