package io.etl4j.store;

import io.etl4j.core.CredentialAuditRecord;
import io.etl4j.core.Destination;
import io.etl4j.core.DestinationCredentials;
import io.etl4j.core.OAuthState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Destination credentials, OAuth states and the credential audit log.
 */
public interface TokenStore {

    Optional<Destination> findDestination(String destinationId);

    void saveState(OAuthState state);

    /**
     * Delete and return the state if it exists and has not expired at {@code now}. Concurrent
     * callers with the same value get it at most once.
     */
    Optional<OAuthState> consumeState(String state, Instant now);

    /**
     * Replace the credentials and append the audit record in one transaction.
     *
     * @return the new credentials version
     * @throws io.etl4j.error.StaleCredentialsException if the stored version is not {@code expectedVersion}
     */
    long updateCredentials(String destinationId, long expectedVersion, DestinationCredentials updated, CredentialAuditRecord audit);

    /**
     * Oldest first.
     */
    List<CredentialAuditRecord> findAudit(String destinationId);

    long purgeExpiredStates(Instant now);
}
