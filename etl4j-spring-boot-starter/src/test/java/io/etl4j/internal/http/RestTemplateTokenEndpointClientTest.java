package io.etl4j.internal.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etl4j.core.TokenResponse;
import io.etl4j.error.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestTemplateTokenEndpointClientTest {

    private static final String TOKEN_URL = "https://auth.example.com/token";

    private MockRestServiceServer server;
    private RestTemplateTokenEndpointClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestTemplateTokenEndpointClient(restTemplate, new ObjectMapper());
    }

    @Test
    void exchangeShouldPostFormAndParseTokens() {
        server.expect(requestTo(TOKEN_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andExpect(content().formDataContains(Map.of("grant_type", "authorization_code", "code", "abc")))
                .andRespond(withSuccess("{\"access_token\":\"at-1\",\"refresh_token\":\"rt-1\",\"expires_in\":1800}",
                        MediaType.APPLICATION_JSON));

        TokenResponse tokens = client.exchange(TOKEN_URL, Map.of("grant_type", "authorization_code", "code", "abc"));

        assertEquals("at-1", tokens.accessToken());
        assertEquals("rt-1", tokens.refreshToken());
        assertEquals(1800, tokens.expiresIn());
        server.verify();
    }

    @Test
    void missingRefreshTokenAndExpiryShouldUseDefaults() {
        server.expect(requestTo(TOKEN_URL))
                .andRespond(withSuccess("{\"access_token\":\"at-2\"}", MediaType.APPLICATION_JSON));

        TokenResponse tokens = client.exchange(TOKEN_URL, Map.of("grant_type", "refresh_token"));

        assertNull(tokens.refreshToken());
        assertEquals(RestTemplateTokenEndpointClient.DEFAULT_EXPIRES_IN, tokens.expiresIn());
    }

    @Test
    void unauthorizedShouldCarryStatusAndOAuthError() {
        server.expect(requestTo(TOKEN_URL))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid_grant\",\"error_description\":\"Token has been revoked\"}"));

        ProviderException e = assertThrows(ProviderException.class,
                () -> client.exchange(TOKEN_URL, Map.of("grant_type", "refresh_token")));

        assertTrue(e.isUnauthorized());
        assertFalse(e.isRetryable());
        assertEquals("invalid_grant", e.details().get("error"));
    }

    @Test
    void serverErrorShouldBeRetryable() {
        server.expect(requestTo(TOKEN_URL)).andRespond(withStatus(HttpStatus.BAD_GATEWAY).body("<html>oops</html>"));

        ProviderException e = assertThrows(ProviderException.class,
                () -> client.exchange(TOKEN_URL, Map.of("grant_type", "refresh_token")));

        assertEquals(502, e.httpStatus());
        assertTrue(e.isRetryable());
    }

    @Test
    void timeoutShouldBeReportedAsNoResponse() {
        server.expect(requestTo(TOKEN_URL)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        ProviderException e = assertThrows(ProviderException.class,
                () -> client.exchange(TOKEN_URL, Map.of("grant_type", "refresh_token")));

        assertEquals(0, e.httpStatus());
        assertTrue(e.isRetryable());
    }

    @Test
    void responseWithoutAccessTokenShouldFail() {
        server.expect(requestTo(TOKEN_URL)).andRespond(withSuccess("{\"token_type\":\"bearer\"}", MediaType.APPLICATION_JSON));

        ProviderException e = assertThrows(ProviderException.class,
                () -> client.exchange(TOKEN_URL, Map.of("grant_type", "refresh_token")));

        assertEquals(200, e.httpStatus());
    }
}
