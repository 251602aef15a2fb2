package io.etl4j.oauth;

import io.etl4j.core.DestinationCredentials;
import io.etl4j.core.SensitiveField;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces the audit view of stored credentials. Sensitive fields appear only as {@value #REDACTED}.
 */
public final class CredentialRedactor {

    public static final String REDACTED = "[REDACTED]";

    private CredentialRedactor() {
    }

    public static Map<String, Object> redact(DestinationCredentials credentials) {
        Map<String, Object> out = new LinkedHashMap<>(credentials.config());
        for (SensitiveField field : credentials.secrets().keySet()) {
            out.put(field.wireName(), REDACTED);
        }
        if (credentials.tokenExpiresAt() != null) {
            out.put("tokenExpiresAt", credentials.tokenExpiresAt().toString());
        }
        out.put("state", credentials.state().name());
        return out;
    }
}
