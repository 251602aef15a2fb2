package io.etl4j.testing;

import io.etl4j.core.CredentialAuditRecord;
import io.etl4j.core.Destination;
import io.etl4j.core.DestinationCredentials;
import io.etl4j.core.OAuthState;
import io.etl4j.error.StaleCredentialsException;
import io.etl4j.store.TokenStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryTokenStore implements TokenStore {

    private final Map<String, Destination> destinations = new ConcurrentHashMap<>();
    private final Map<String, OAuthState> states = new ConcurrentHashMap<>();
    private final List<CredentialAuditRecord> audit = new ArrayList<>();
    private final AtomicReference<RuntimeException> nextUpdateFailure = new AtomicReference<>();

    public void put(Destination destination) {
        destinations.put(destination.id(), destination);
    }

    public Destination get(String id) {
        return destinations.get(id);
    }

    public Map<String, OAuthState> states() {
        return states;
    }

    public void failNextUpdate(RuntimeException e) {
        nextUpdateFailure.set(e);
    }

    @Override
    public Optional<Destination> findDestination(String destinationId) {
        return Optional.ofNullable(destinations.get(destinationId));
    }

    @Override
    public void saveState(OAuthState state) {
        states.put(state.state(), state);
    }

    @Override
    public Optional<OAuthState> consumeState(String state, Instant now) {
        OAuthState removed = states.remove(state);
        if (removed == null || removed.isExpired(now)) {
            return Optional.empty();
        }
        return Optional.of(removed);
    }

    @Override
    public synchronized long updateCredentials(String destinationId, long expectedVersion,
                                               DestinationCredentials updated, CredentialAuditRecord record) {
        RuntimeException failure = nextUpdateFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
        Destination current = destinations.get(destinationId);
        if (current == null || current.credentialsVersion() != expectedVersion) {
            throw new StaleCredentialsException(destinationId, expectedVersion);
        }
        long version = expectedVersion + 1;
        destinations.put(destinationId, current.withCredentials(updated, version));
        audit.add(record);
        return version;
    }

    @Override
    public synchronized List<CredentialAuditRecord> findAudit(String destinationId) {
        return audit.stream().filter(a -> a.destinationId().equals(destinationId)).toList();
    }

    @Override
    public long purgeExpiredStates(Instant now) {
        long before = states.size();
        states.values().removeIf(s -> s.isExpired(now));
        return before - states.size();
    }
}
