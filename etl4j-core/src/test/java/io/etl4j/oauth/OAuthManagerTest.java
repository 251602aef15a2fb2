package io.etl4j.oauth;

import io.etl4j.TokenEndpointClient;
import io.etl4j.core.AuditAction;
import io.etl4j.core.AuthorizationResult;
import io.etl4j.core.CredentialAuditRecord;
import io.etl4j.core.CredentialState;
import io.etl4j.core.Destination;
import io.etl4j.core.DestinationCredentials;
import io.etl4j.core.OAuthProviderConfig;
import io.etl4j.core.OAuthState;
import io.etl4j.core.PlainCredentials;
import io.etl4j.core.SensitiveField;
import io.etl4j.core.TokenResponse;
import io.etl4j.crypto.CredentialCipher;
import io.etl4j.error.ConfigException;
import io.etl4j.error.DestinationException;
import io.etl4j.error.ErrorLogger;
import io.etl4j.error.ProviderException;
import io.etl4j.error.StateException;
import io.etl4j.error.TokenException;
import io.etl4j.retry.RetryPolicy;
import io.etl4j.testing.InMemoryErrorLogStore;
import io.etl4j.testing.InMemoryTokenStore;
import io.etl4j.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OAuthManagerTest {

    private static final String DEST = "dest-1";
    private static final String TOKEN_URL = "https://oauth2.example.com/token";
    private static final Instant T0 = Instant.parse("2026-10-12T08:00:00Z");

    private final CredentialCipher cipher = new CredentialCipher("test-master-secret", 1_000);
    private final MutableClock clock = new MutableClock(T0);
    private InMemoryTokenStore store;
    private InMemoryErrorLogStore errorLog;
    private TokenEndpointClient tokenClient;
    private OAuthManager manager;

    @BeforeEach
    void setUp() {
        store = new InMemoryTokenStore();
        tokenClient = mock(TokenEndpointClient.class);
        RetryPolicy retry = new RetryPolicy(3, RetryPolicy.linear(Duration.ofSeconds(1)),
                RetryPolicy.retryableEtlErrors(), d -> { });
        errorLog = new InMemoryErrorLogStore();
        manager = new OAuthManager(store, cipher, tokenClient, retry, OAuthSettings.defaults(),
                new ErrorLogger(errorLog, clock), clock);
        store.put(destination(DestinationCredentials.empty().withSecrets(
                cipher.encryptFields(Map.of(SensitiveField.CLIENT_SECRET, "client-secret")), null, CredentialState.UNAUTHORIZED)));
    }

    @Test
    void authorizationUrlShouldCarryAllParametersAndIssueState() {
        String url = manager.getAuthorizationUrl("user-1", DEST);

        assertTrue(url.startsWith("https://accounts.example.com/o/oauth2/auth?client_id=client-123&response_type=code"));
        assertTrue(url.contains("redirect_uri=https%3A%2F%2Fapp.example.com%2Fcallback"));
        assertTrue(url.contains("scope=drive.file%20drive.readonly"));
        assertTrue(url.contains("access_type=offline"));
        assertTrue(url.contains("prompt=consent"));

        assertEquals(1, store.states().size());
        OAuthState state = store.states().values().iterator().next();
        assertEquals(64, state.state().length());
        assertTrue(url.contains("state=" + state.state()));
        assertEquals("user-1", state.userId());
        assertEquals(T0.plus(Duration.ofMinutes(10)), state.expiresAt());
        assertEquals(CredentialState.AUTHORIZING, store.get(DEST).credentials().state());
        assertEquals(AuditAction.AUTHORIZATION_REQUESTED, store.findAudit(DEST).get(0).action());
    }

    @Test
    void missingOAuthConfigShouldFailWithoutIssuingState() {
        store.put(new Destination(DEST, "user-1", "GoogleDrive", "csv", provider(),
                new DestinationCredentials(Map.of("redirectUri", "https://app.example.com/callback"), Map.of(), null, null), 0, true));

        ConfigException e = assertThrows(ConfigException.class, () -> manager.getAuthorizationUrl("user-1", DEST));

        assertTrue(e.getMessage().contains("clientId"));
        assertTrue(e.getMessage().contains("clientSecret"));
        assertTrue(store.states().isEmpty());
    }

    @Test
    void missingScopesShouldFailValidation() {
        Destination d = new Destination(DEST, "user-1", "GoogleDrive", "csv",
                new OAuthProviderConfig("google", "https://accounts.example.com/o/oauth2/auth", TOKEN_URL, List.of()),
                store.get(DEST).credentials(), 0, true);

        ConfigException e = assertThrows(ConfigException.class, () -> manager.validateOAuthConfig(d));
        assertTrue(e.getMessage().contains("scopes"));
    }

    @Test
    void callbackShouldStoreEncryptedTokensAndRedactedAudit() {
        String state = issueState();
        when(tokenClient.exchange(eq(TOKEN_URL), anyMap()))
                .thenReturn(new TokenResponse("access-1", "refresh-1", 3600));

        AuthorizationResult result = manager.handleCallback("code-xyz", state);

        assertEquals(new AuthorizationResult(DEST, 3600), result);
        verify(tokenClient).exchange(eq(TOKEN_URL), argThat(form ->
                "authorization_code".equals(form.get("grant_type"))
                        && "code-xyz".equals(form.get("code"))
                        && "client-secret".equals(form.get("client_secret"))));

        DestinationCredentials stored = store.get(DEST).credentials();
        assertEquals(CredentialState.AUTHORIZED, stored.state());
        assertEquals(T0.plusSeconds(3600), stored.tokenExpiresAt());
        assertEquals("access-1", cipher.decrypt(stored.secrets().get(SensitiveField.ACCESS_TOKEN)));
        assertEquals("refresh-1", cipher.decrypt(stored.secrets().get(SensitiveField.REFRESH_TOKEN)));

        CredentialAuditRecord audit = store.findAudit(DEST).get(1);
        assertEquals(AuditAction.AUTHORIZED, audit.action());
        assertEquals(CredentialRedactor.REDACTED, audit.newCredentials().get("accessToken"));
        assertEquals(CredentialRedactor.REDACTED, audit.newCredentials().get("refreshToken"));
        assertFalse(audit.toString().contains("access-1"));
        assertFalse(audit.toString().contains(stored.secrets().get(SensitiveField.ACCESS_TOKEN).ciphertext()));
    }

    @Test
    void stateShouldBeConsumedAtMostOnce() {
        String state = issueState();
        when(tokenClient.exchange(anyString(), anyMap())).thenReturn(new TokenResponse("a", "r", 3600));

        manager.handleCallback("code-1", state);

        assertThrows(StateException.class, () -> manager.handleCallback("code-1", state));
        verify(tokenClient, times(1)).exchange(anyString(), anyMap());
        assertEquals(1, errorLog.withCode("STATE_ERROR").size());
        assertEquals("handleCallback", errorLog.withCode("STATE_ERROR").get(0).context().get("operation"));
    }

    @Test
    void expiredStateShouldBeRejected() {
        String state = issueState();
        clock.advance(Duration.ofMinutes(10).plusSeconds(1));

        assertThrows(StateException.class, () -> manager.handleCallback("code-1", state));
        verifyNoInteractions(tokenClient);
    }

    @Test
    void failedPersistenceAfterExchangeShouldLeaveCredentialsUntouched() {
        String state = issueState();
        when(tokenClient.exchange(anyString(), anyMap())).thenReturn(new TokenResponse("a", "r", 3600));
        DestinationCredentials before = store.get(DEST).credentials();
        store.failNextUpdate(new IllegalStateException("transaction aborted"));

        assertThrows(DestinationException.class, () -> manager.handleCallback("code-1", state));

        assertEquals(before, store.get(DEST).credentials());
        assertEquals(1, store.findAudit(DEST).size());
    }

    @Test
    void refreshWithoutRefreshTokenShouldFailWithoutNetworkCall() {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0"), T0.plusSeconds(60));

        TokenException e = assertThrows(TokenException.class, () -> manager.refreshTokens(DEST));

        assertTrue(e.getMessage().contains("Reauthorization required"));
        verifyNoInteractions(tokenClient);
    }

    @Test
    void unauthorizedRefreshShouldNotBeRetried() {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0", SensitiveField.REFRESH_TOKEN, "refresh-0"), T0.plusSeconds(60));
        when(tokenClient.exchange(anyString(), anyMap()))
                .thenThrow(new ProviderException("invalid_grant", 401, Map.of(), null));

        assertThrows(TokenException.class, () -> manager.refreshTokens(DEST));
        verify(tokenClient, times(1)).exchange(anyString(), anyMap());
    }

    @Test
    void timeoutOnRefreshShouldBeRetriedUpToMaxAttempts() {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0", SensitiveField.REFRESH_TOKEN, "refresh-0"), T0.plusSeconds(60));
        when(tokenClient.exchange(anyString(), anyMap()))
                .thenThrow(ProviderException.noResponse("token endpoint timed out", new SocketTimeoutException("Read timed out")));

        ProviderException e = assertThrows(ProviderException.class, () -> manager.refreshTokens(DEST));

        assertEquals(0, e.httpStatus());
        verify(tokenClient, times(3)).exchange(anyString(), anyMap());
    }

    @Test
    void refreshWithoutNewRefreshTokenShouldKeepStoredOne() {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0", SensitiveField.REFRESH_TOKEN, "refresh-0"), T0.plusSeconds(60));
        when(tokenClient.exchange(anyString(), anyMap())).thenReturn(new TokenResponse("access-1", null, 3600));

        manager.refreshTokens(DEST);

        DestinationCredentials stored = store.get(DEST).credentials();
        assertEquals("access-1", cipher.decrypt(stored.secrets().get(SensitiveField.ACCESS_TOKEN)));
        assertEquals("refresh-0", cipher.decrypt(stored.secrets().get(SensitiveField.REFRESH_TOKEN)));
        assertEquals(AuditAction.REFRESHED, store.findAudit(DEST).get(store.findAudit(DEST).size() - 1).action());
    }

    @Test
    void refreshWithRotatedRefreshTokenShouldPersistIt() {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0", SensitiveField.REFRESH_TOKEN, "refresh-0"), T0.plusSeconds(60));
        when(tokenClient.exchange(anyString(), anyMap())).thenReturn(new TokenResponse("access-1", "refresh-1", 3600));

        manager.refreshTokens(DEST);

        assertEquals("refresh-1", cipher.decrypt(store.get(DEST).credentials().secrets().get(SensitiveField.REFRESH_TOKEN)));
    }

    @Test
    void tokensFarFromExpiryShouldNotBeRefreshed() {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0", SensitiveField.REFRESH_TOKEN, "refresh-0"), T0.plus(Duration.ofMinutes(30)));

        PlainCredentials plain = manager.getDecryptedCredentials(DEST);

        assertEquals("access-0", plain.accessToken());
        assertEquals("client-123", plain.config("clientId"));
        assertFalse(plain.toString().contains("access-0"));
        verifyNoInteractions(tokenClient);
    }

    @Test
    void tokensInsideThresholdShouldBeRefreshedBeforeDecrypting() {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0", SensitiveField.REFRESH_TOKEN, "refresh-0"), T0.plus(Duration.ofMinutes(4)));
        when(tokenClient.exchange(anyString(), anyMap())).thenReturn(new TokenResponse("access-1", null, 3600));

        PlainCredentials plain = manager.getDecryptedCredentials(DEST);

        assertEquals("access-1", plain.accessToken());
    }

    @Test
    void concurrentRefreshChecksShouldCallProviderOnce() throws Exception {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0", SensitiveField.REFRESH_TOKEN, "refresh-0"), T0.plusSeconds(30));
        CountDownLatch inExchange = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(tokenClient.exchange(anyString(), anyMap())).thenAnswer(inv -> {
            inExchange.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new TokenResponse("access-1", null, 3600);
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Destination> first = pool.submit(() -> manager.checkAndRefreshTokens(DEST));
            assertTrue(inExchange.await(5, TimeUnit.SECONDS));
            Future<Destination> second = pool.submit(() -> manager.checkAndRefreshTokens(DEST));
            Thread.sleep(100);
            release.countDown();

            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        verify(tokenClient, times(1)).exchange(anyString(), anyMap());
    }

    @Test
    void revokedCredentialsShouldFailFastWithReauthorizationRequired() {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0", SensitiveField.REFRESH_TOKEN, "refresh-0"), T0.plusSeconds(3600));

        manager.revokeTokens(DEST);

        DestinationCredentials stored = store.get(DEST).credentials();
        assertEquals(CredentialState.REVOKED, stored.state());
        assertFalse(stored.has(SensitiveField.ACCESS_TOKEN));
        assertFalse(stored.has(SensitiveField.REFRESH_TOKEN));
        assertTrue(stored.has(SensitiveField.CLIENT_SECRET));
        assertNull(stored.tokenExpiresAt());

        TokenException e = assertThrows(TokenException.class, () -> manager.getDecryptedCredentials(DEST));
        assertTrue(e.getMessage().startsWith("Reauthorization required"));
        verifyNoInteractions(tokenClient);
    }

    @Test
    void failedRevokeShouldBeRecordedInErrorLog() {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0", SensitiveField.REFRESH_TOKEN, "refresh-0"), T0.plusSeconds(3600));
        store.failNextUpdate(new IllegalStateException("write concern failed"));

        assertThrows(IllegalStateException.class, () -> manager.revokeTokens(DEST));

        assertEquals(1, errorLog.entries().size());
        assertEquals("IllegalStateException", errorLog.entries().get(0).errorType());
        assertEquals(Map.of("operation", "revokeTokens", "destinationId", DEST), errorLog.entries().get(0).context());
    }

    @Test
    void nestedRefreshFailureShouldBeRecordedOnce() {
        authorize(Map.of(SensitiveField.ACCESS_TOKEN, "access-0", SensitiveField.REFRESH_TOKEN, "refresh-0"), T0.plusSeconds(60));
        when(tokenClient.exchange(anyString(), anyMap()))
                .thenThrow(new ProviderException("invalid_grant", 401, Map.of(), null));

        assertThrows(TokenException.class, () -> manager.getDecryptedCredentials(DEST));

        assertEquals(1, errorLog.entries().size());
        assertEquals("getDecryptedCredentials", errorLog.entries().get(0).context().get("operation"));
        assertFalse(errorLog.entries().get(0).toString().contains("refresh-0"));
    }

    private String issueState() {
        manager.getAuthorizationUrl("user-1", DEST);
        return store.states().keySet().iterator().next();
    }

    private void authorize(Map<SensitiveField, String> tokens, Instant expiresAt) {
        Map<SensitiveField, String> all = new EnumMap<>(SensitiveField.class);
        all.putAll(tokens);
        all.put(SensitiveField.CLIENT_SECRET, "client-secret");
        Destination current = store.get(DEST);
        store.put(current.withCredentials(current.credentials().withSecrets(cipher.encryptFields(all), expiresAt,
                CredentialState.AUTHORIZED), current.credentialsVersion()));
    }

    private static Destination destination(DestinationCredentials secrets) {
        DestinationCredentials credentials = new DestinationCredentials(
                Map.of("clientId", "client-123", "redirectUri", "https://app.example.com/callback", "folderPath", "/exports"),
                secrets.secrets(), secrets.tokenExpiresAt(), secrets.state());
        return new Destination(DEST, "user-1", "GoogleDrive", "csv", provider(), credentials, 0, true);
    }

    private static OAuthProviderConfig provider() {
        return new OAuthProviderConfig("google", "https://accounts.example.com/o/oauth2/auth", TOKEN_URL,
                List.of("drive.file", "drive.readonly"));
    }
}
