package io.etl4j.internal.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.etl4j.TokenEndpointClient;
import io.etl4j.core.TokenResponse;
import io.etl4j.error.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TokenEndpointClient} over a {@link RestTemplate}: form-encoded POST, JSON response.
 *
 * <p>HTTP errors become {@link ProviderException} with the status; timeouts and connection errors
 * become {@link ProviderException#noResponse(String, Throwable)}. Response bodies are never logged.
 */
public class RestTemplateTokenEndpointClient implements TokenEndpointClient {
    private static final Logger log = LoggerFactory.getLogger(RestTemplateTokenEndpointClient.class);

    static final long DEFAULT_EXPIRES_IN = 3600;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public RestTemplateTokenEndpointClient(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public static RestTemplateTokenEndpointClient create(Duration connectTimeout, Duration readTimeout,
                                                         ObjectMapper objectMapper) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return new RestTemplateTokenEndpointClient(new RestTemplate(factory), objectMapper);
    }

    @Override
    public TokenResponse exchange(String tokenUrl, Map<String, String> form) {
        Objects.requireNonNull(tokenUrl, "tokenUrl must not be null");
        Objects.requireNonNull(form, "form must not be null");

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        form.forEach(body::add);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(tokenUrl, new HttpEntity<>(body, headers), String.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            log.warn("etl4j token endpoint rejected request url={} status={} grantType={}", tokenUrl, status, form.get("grant_type"));
            throw new ProviderException("Token endpoint returned HTTP " + status, status, errorDetails(e), e);
        } catch (ResourceAccessException e) {
            log.warn("etl4j token endpoint unreachable url={} msg={}", tokenUrl, e.getMessage());
            throw ProviderException.noResponse("Token endpoint did not respond: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw ProviderException.noResponse("Token request failed: " + e.getMessage(), e);
        }

        return parse(response.getStatusCode().value(), response.getBody());
    }

    private TokenResponse parse(int status, String body) {
        JsonNode json;
        try {
            json = body == null ? null : objectMapper.readTree(body);
        } catch (Exception e) {
            throw new ProviderException("Token endpoint returned an unreadable body", status, Map.of(), e);
        }
        if (json == null || !json.hasNonNull("access_token")) {
            throw new ProviderException("Token endpoint response has no access_token", status, Map.of(), null);
        }

        String refreshToken = json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null;
        long expiresIn = json.path("expires_in").asLong(DEFAULT_EXPIRES_IN);
        return new TokenResponse(json.get("access_token").asText(), refreshToken, expiresIn);
    }

    // Only the OAuth error code and description; the rest of the body may echo request values.
    private Map<String, Object> errorDetails(HttpStatusCodeException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            JsonNode json = objectMapper.readTree(e.getResponseBodyAsString());
            if (json != null && json.hasNonNull("error")) {
                details.put("error", json.get("error").asText());
            }
            if (json != null && json.hasNonNull("error_description")) {
                details.put("errorDescription", json.get("error_description").asText());
            }
        } catch (Exception parseEx) {
            log.debug("etl4j token error body is not JSON status={}", e.getStatusCode().value());
        }
        return details;
    }
}
