package io.etl4j.oauth;

import io.etl4j.TokenEndpointClient;
import io.etl4j.core.AuditAction;
import io.etl4j.core.AuthorizationResult;
import io.etl4j.core.CredentialAuditRecord;
import io.etl4j.core.CredentialState;
import io.etl4j.core.Destination;
import io.etl4j.core.DestinationCredentials;
import io.etl4j.core.EncryptedBlob;
import io.etl4j.core.OAuthProviderConfig;
import io.etl4j.core.OAuthState;
import io.etl4j.core.PlainCredentials;
import io.etl4j.core.SensitiveField;
import io.etl4j.core.TokenResponse;
import io.etl4j.crypto.CredentialCipher;
import io.etl4j.error.ConfigException;
import io.etl4j.error.DestinationException;
import io.etl4j.error.ErrorLogger;
import io.etl4j.error.EtlException;
import io.etl4j.error.ProviderException;
import io.etl4j.error.StaleCredentialsException;
import io.etl4j.error.StateException;
import io.etl4j.error.TokenException;
import io.etl4j.retry.RetryPolicy;
import io.etl4j.store.TokenStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * OAuth credential lifecycle of destinations: authorization URL, callback, refresh-ahead,
 * decryption for upload and revocation.
 *
 * <p>Credential state moves {@code UNAUTHORIZED -> AUTHORIZING -> AUTHORIZED -> REVOKED}; a refresh
 * keeps it {@code AUTHORIZED}. Every credential change is written together with a redacted
 * {@link CredentialAuditRecord}.
 *
 * <p>Refreshes of one destination are serialized within the process by a per-destination lock;
 * across processes the store's optimistic {@code credentialsVersion} check decides the winner.
 *
 * <p>A failure of any public operation is recorded through the {@link ErrorLogger} and rethrown.
 */
public class OAuthManager {
    private static final Logger log = LoggerFactory.getLogger(OAuthManager.class);

    public static final String CLIENT_ID = "clientId";
    public static final String REDIRECT_URI = "redirectUri";

    private static final int STATE_BYTES = 32;
    private static final int MAX_REVOKE_ATTEMPTS = 3;

    private final TokenStore tokenStore;
    private final CredentialCipher cipher;
    private final TokenEndpointClient tokenClient;
    private final RetryPolicy retryPolicy;
    private final OAuthSettings settings;
    private final ErrorLogger errorLogger;
    private final Clock clock;

    private final SecureRandom random = new SecureRandom();
    private final ConcurrentHashMap<String, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    public OAuthManager(TokenStore tokenStore, CredentialCipher cipher, TokenEndpointClient tokenClient,
                        RetryPolicy retryPolicy, OAuthSettings settings, ErrorLogger errorLogger, Clock clock) {
        this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore must not be null");
        this.cipher = Objects.requireNonNull(cipher, "cipher must not be null");
        this.tokenClient = Objects.requireNonNull(tokenClient, "tokenClient must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.errorLogger = Objects.requireNonNull(errorLogger, "errorLogger must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Issue a single-use state and build the provider's authorization URL for it.
     *
     * @throws ConfigException if the destination's OAuth configuration is incomplete
     */
    public String getAuthorizationUrl(String userId, String destinationId) {
        return reported("getAuthorizationUrl", destinationId, () -> authorizationUrl(userId, destinationId));
    }

    private String authorizationUrl(String userId, String destinationId) {
        Destination destination = loadDestination(destinationId);
        validateOAuthConfig(destination);
        OAuthProviderConfig provider = destination.oauth();
        DestinationCredentials credentials = destination.credentials();

        Instant now = clock.instant();
        String state = HexFormat.of().formatHex(randomBytes());
        tokenStore.saveState(new OAuthState(state, userId, destinationId, provider.provider(), now.plus(settings.stateTtl())));

        if (credentials.state() != CredentialState.AUTHORIZED && credentials.state() != CredentialState.AUTHORIZING) {
            DestinationCredentials authorizing = credentials.withState(CredentialState.AUTHORIZING);
            tokenStore.updateCredentials(destinationId, destination.credentialsVersion(), authorizing,
                    audit(destinationId, AuditAction.AUTHORIZATION_REQUESTED, credentials, authorizing, now));
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", credentials.config().get(CLIENT_ID));
        params.put("response_type", "code");
        params.put("redirect_uri", credentials.config().get(REDIRECT_URI));
        params.put("scope", String.join(" ", provider.scopes()));
        params.put("state", state);
        params.put("access_type", "offline");
        params.put("prompt", "consent");

        String base = provider.authorizationUrl();
        String query = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));

        log.info("etl4j oauth authorization requested destinationId={} provider={} userId={}",
                destinationId, provider.provider(), userId);
        return base + (base.contains("?") ? "&" : "?") + query;
    }

    /**
     * Consume the state, exchange the code and store the encrypted tokens.
     *
     * @throws StateException       if the state is unknown, expired or already used
     * @throws DestinationException if the tokens could not be stored; authorization must restart
     */
    public AuthorizationResult handleCallback(String code, String state) {
        return reported("handleCallback", null, () -> callback(code, state));
    }

    private AuthorizationResult callback(String code, String state) {
        if (state == null || state.isBlank()) {
            throw new StateException("Missing authorization state");
        }
        Instant now = clock.instant();
        OAuthState consumed = tokenStore.consumeState(state, now)
                .orElseThrow(() -> new StateException("Invalid or expired authorization state"));
        if (code == null || code.isBlank()) {
            throw new StateException("Missing authorization code", Map.of("destinationId", consumed.destinationId()));
        }

        String destinationId = consumed.destinationId();
        Destination destination = loadDestination(destinationId);
        validateOAuthConfig(destination);
        DestinationCredentials credentials = destination.credentials();

        Map<String, String> form = new LinkedHashMap<>();
        form.put("code", code);
        form.put("client_id", credentials.config().get(CLIENT_ID));
        form.put("client_secret", cipher.decrypt(credentials.secrets().get(SensitiveField.CLIENT_SECRET)));
        form.put("redirect_uri", credentials.config().get(REDIRECT_URI));
        form.put("grant_type", "authorization_code");

        TokenResponse tokens = callTokenEndpoint(destination, form);
        if (tokens.accessToken() == null || tokens.accessToken().isBlank()) {
            throw new TokenException("Provider returned no access token", Map.of("destinationId", destinationId));
        }

        Map<SensitiveField, String> plain = new EnumMap<>(SensitiveField.class);
        plain.put(SensitiveField.ACCESS_TOKEN, tokens.accessToken());
        plain.put(SensitiveField.REFRESH_TOKEN, tokens.refreshToken());
        Instant completedAt = clock.instant();
        DestinationCredentials authorized = credentials.withSecrets(cipher.encryptFields(plain),
                completedAt.plusSeconds(tokens.expiresIn()), CredentialState.AUTHORIZED);

        try {
            tokenStore.updateCredentials(destinationId, destination.credentialsVersion(), authorized,
                    audit(destinationId, AuditAction.AUTHORIZED, credentials, authorized, completedAt));
        } catch (RuntimeException e) {
            throw new DestinationException("Failed to store authorized credentials; restart authorization",
                    Map.of("destinationId", destinationId), e);
        }

        log.info("etl4j oauth authorized destinationId={} provider={} expiresIn={}",
                destinationId, consumed.provider(), tokens.expiresIn());
        return new AuthorizationResult(destinationId, tokens.expiresIn());
    }

    /**
     * Refresh the tokens when they expire within the refresh threshold.
     *
     * @return the destination with its current (possibly refreshed) encrypted credentials
     */
    public Destination checkAndRefreshTokens(String destinationId) {
        return reported("checkAndRefreshTokens", destinationId, () -> checkAndRefresh(destinationId));
    }

    private Destination checkAndRefresh(String destinationId) {
        Destination destination = loadDestination(destinationId);
        if (!needsRefresh(destination)) {
            return destination;
        }
        ReentrantLock lock = refreshLocks.computeIfAbsent(destinationId, id -> new ReentrantLock());
        lock.lock();
        try {
            // another run may have refreshed while we waited
            Destination current = loadDestination(destinationId);
            if (!needsRefresh(current)) {
                log.debug("etl4j oauth refresh already done destinationId={}", destinationId);
                return current;
            }
            return refresh(current);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Exchange the stored refresh token for a new access token.
     *
     * @throws TokenException    if no refresh token is stored or the provider rejects it
     * @throws ProviderException if the provider stays unreachable after all attempts
     */
    public Destination refreshTokens(String destinationId) {
        return reported("refreshTokens", destinationId, () -> lockedRefresh(destinationId));
    }

    private Destination lockedRefresh(String destinationId) {
        ReentrantLock lock = refreshLocks.computeIfAbsent(destinationId, id -> new ReentrantLock());
        lock.lock();
        try {
            return refresh(loadDestination(destinationId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refresh-check, then decrypt the sensitive fields for one upload.
     *
     * @throws TokenException if the credentials are revoked or hold no access token
     */
    public PlainCredentials getDecryptedCredentials(String destinationId) {
        return reported("getDecryptedCredentials", destinationId, () -> decryptedCredentials(destinationId));
    }

    private PlainCredentials decryptedCredentials(String destinationId) {
        Destination destination = loadDestination(destinationId);
        DestinationCredentials stored = destination.credentials();
        if (stored.state() == CredentialState.REVOKED || !stored.has(SensitiveField.ACCESS_TOKEN)) {
            throw new TokenException(TokenException.REAUTHORIZATION_REQUIRED + ": destination " + destinationId
                    + " has no valid tokens", Map.of("destinationId", destinationId, "state", stored.state().name()));
        }
        Destination current = checkAndRefresh(destinationId);
        DestinationCredentials credentials = current.credentials();
        return new PlainCredentials(credentials.config(),
                cipher.decryptFields(credentials.secrets(), EnumSet.allOf(SensitiveField.class)));
    }

    /**
     * Drop the stored tokens. Later uploads fail with "reauthorization required".
     */
    public void revokeTokens(String destinationId) {
        reported("revokeTokens", destinationId, () -> {
            revoke(destinationId);
            return null;
        });
    }

    private void revoke(String destinationId) {
        for (int attempt = 1; ; attempt++) {
            Destination destination = loadDestination(destinationId);
            DestinationCredentials credentials = destination.credentials();
            DestinationCredentials revoked = credentials.revoked();
            try {
                tokenStore.updateCredentials(destinationId, destination.credentialsVersion(), revoked,
                        audit(destinationId, AuditAction.REVOKED, credentials, revoked, clock.instant()));
                log.info("etl4j oauth tokens revoked destinationId={}", destinationId);
                return;
            } catch (StaleCredentialsException e) {
                if (attempt >= MAX_REVOKE_ATTEMPTS) {
                    throw e;
                }
                log.debug("etl4j oauth revoke raced a concurrent update destinationId={} attempt={}", destinationId, attempt);
            }
        }
    }

    /**
     * Check that the destination has provider endpoints, scopes, client id, client secret and
     * redirect URI.
     *
     * @throws ConfigException listing every missing item
     */
    public void validateOAuthConfig(Destination destination) {
        OAuthProviderConfig provider = destination.oauth();
        if (provider == null) {
            throw new ConfigException("Destination type " + destination.type() + " does not use OAuth",
                    Map.of("destinationId", String.valueOf(destination.id())));
        }
        DestinationCredentials credentials = destination.credentials();
        List<String> missing = new ArrayList<>();
        if (isBlank(provider.authorizationUrl())) {
            missing.add("authorizationUrl");
        }
        if (isBlank(provider.tokenUrl())) {
            missing.add("tokenUrl");
        }
        if (provider.scopes().isEmpty()) {
            missing.add("scopes");
        }
        if (credentials.configValue(CLIENT_ID).isEmpty()) {
            missing.add(CLIENT_ID);
        }
        if (!credentials.has(SensitiveField.CLIENT_SECRET)) {
            missing.add(SensitiveField.CLIENT_SECRET.wireName());
        }
        if (credentials.configValue(REDIRECT_URI).isEmpty()) {
            missing.add(REDIRECT_URI);
        }
        if (!missing.isEmpty()) {
            throw new ConfigException("Missing required OAuth configuration: " + String.join(", ", missing),
                    Map.of("destinationId", String.valueOf(destination.id()), "missing", missing));
        }
    }

    private Destination refresh(Destination destination) {
        String destinationId = destination.id();
        DestinationCredentials credentials = destination.credentials();
        if (!credentials.has(SensitiveField.REFRESH_TOKEN)) {
            throw new TokenException("No refresh token available. " + TokenException.REAUTHORIZATION_REQUIRED,
                    Map.of("destinationId", destinationId));
        }
        validateOAuthConfig(destination);

        Map<String, String> form = new LinkedHashMap<>();
        form.put("refresh_token", cipher.decrypt(credentials.secrets().get(SensitiveField.REFRESH_TOKEN)));
        form.put("client_id", credentials.config().get(CLIENT_ID));
        form.put("client_secret", cipher.decrypt(credentials.secrets().get(SensitiveField.CLIENT_SECRET)));
        form.put("grant_type", "refresh_token");

        TokenResponse tokens;
        try {
            tokens = callTokenEndpoint(destination, form);
        } catch (ProviderException e) {
            if (e.isUnauthorized()) {
                throw new TokenException("Refresh token rejected by provider. " + TokenException.REAUTHORIZATION_REQUIRED,
                        Map.of("destinationId", destinationId), e);
            }
            throw e;
        }

        Map<SensitiveField, String> plain = new EnumMap<>(SensitiveField.class);
        plain.put(SensitiveField.ACCESS_TOKEN, tokens.accessToken());
        // providers that do not rotate refresh tokens omit it; the stored one stays valid
        plain.put(SensitiveField.REFRESH_TOKEN, tokens.refreshToken());
        Map<SensitiveField, EncryptedBlob> encrypted = cipher.encryptFields(plain);
        if (!encrypted.containsKey(SensitiveField.ACCESS_TOKEN)) {
            throw new TokenException("Provider returned no access token on refresh", Map.of("destinationId", destinationId));
        }

        Instant now = clock.instant();
        DestinationCredentials refreshed = credentials.withSecrets(encrypted,
                now.plusSeconds(tokens.expiresIn()), CredentialState.AUTHORIZED);
        long version;
        try {
            version = tokenStore.updateCredentials(destinationId, destination.credentialsVersion(), refreshed,
                    audit(destinationId, AuditAction.REFRESHED, credentials, refreshed, now));
        } catch (StaleCredentialsException e) {
            log.info("etl4j oauth refresh lost to a concurrent writer destinationId={}; using stored credentials", destinationId);
            return loadDestination(destinationId);
        } catch (RuntimeException e) {
            throw new DestinationException("Failed to store refreshed credentials", Map.of("destinationId", destinationId), e);
        }

        log.info("etl4j oauth tokens refreshed destinationId={} expiresAt={} refreshTokenRotated={}",
                destinationId, refreshed.tokenExpiresAt(), tokens.refreshToken() != null);
        return destination.withCredentials(refreshed, version);
    }

    private <T> T reported(String operation, String destinationId, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            Map<String, String> context = new LinkedHashMap<>();
            context.put("operation", operation);
            if (destinationId != null) {
                context.put("destinationId", destinationId);
            }
            errorLogger.logError(e, context);
            throw e;
        }
    }

    private TokenResponse callTokenEndpoint(Destination destination, Map<String, String> form) {
        String tokenUrl = destination.oauth().tokenUrl();
        try {
            return retryPolicy.execute(() -> tokenClient.exchange(tokenUrl, form),
                    (attempt, max, delay, failure) -> log.warn(
                            "etl4j oauth token request failed destinationId={} attempt={}/{} retryIn={} msg={}",
                            destination.id(), attempt, max, delay, failure.getMessage()));
        } catch (EtlException e) {
            throw e;
        } catch (Exception e) {
            throw ProviderException.noResponse("Token request to " + destination.oauth().provider() + " failed", e);
        }
    }

    private boolean needsRefresh(Destination destination) {
        Instant expiresAt = destination.credentials().tokenExpiresAt();
        if (expiresAt == null) {
            return false;
        }
        return Duration.between(clock.instant(), expiresAt).compareTo(settings.refreshThreshold()) < 0;
    }

    private Destination loadDestination(String destinationId) {
        return tokenStore.findDestination(destinationId)
                .orElseThrow(() -> new ConfigException("Destination not found: " + destinationId,
                        Map.of("destinationId", String.valueOf(destinationId))));
    }

    private static CredentialAuditRecord audit(String destinationId, AuditAction action,
                                               DestinationCredentials before, DestinationCredentials after, Instant at) {
        return new CredentialAuditRecord(destinationId, action,
                CredentialRedactor.redact(before), CredentialRedactor.redact(after), at);
    }

    private byte[] randomBytes() {
        byte[] b = new byte[STATE_BYTES];
        random.nextBytes(b);
        return b;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
