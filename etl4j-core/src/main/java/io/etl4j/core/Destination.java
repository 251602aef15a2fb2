package io.etl4j.core;

import java.util.Objects;

/**
 * Upload target. {@code oauth} is null for destination types that do not use OAuth (e.g. SFTP).
 */
public record Destination(
        String id,
        String ownerId,
        String type,
        String fileFormat,
        OAuthProviderConfig oauth,
        DestinationCredentials credentials,
        long credentialsVersion,
        boolean active
) {
    public Destination {
        Objects.requireNonNull(type, "type must not be null");
        credentials = credentials == null ? DestinationCredentials.empty() : credentials;
    }

    public boolean requiresOAuth() {
        return oauth != null;
    }

    public Destination withCredentials(DestinationCredentials updated, long version) {
        return new Destination(id, ownerId, type, fileFormat, oauth, updated, version, active);
    }
}
