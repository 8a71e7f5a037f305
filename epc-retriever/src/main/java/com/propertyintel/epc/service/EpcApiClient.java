package com.propertyintel.epc.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.epc.config.EpcProperties;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin client over the EPC open data REST API.
 *
 * Each fetch is one GET, retried on 429 and on network failure with a linear
 * backoff of attempt * retry-delay. Any other non-200 status is final.
 * Failures come back as an empty Optional; callers never see an exception
 * from the network layer.
 */
@Service
@Slf4j
public class EpcApiClient {

    static final int HTTP_OK = 200;
    static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final RestTemplate restTemplate;
    private final EpcProperties properties;
    private final ObjectMapper objectMapper;
    private final Retry retry;

    public EpcApiClient(RestTemplate epcRestTemplate, EpcProperties properties, ObjectMapper objectMapper) {
        this.restTemplate = epcRestTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.retry = buildRetry(properties.getApi());
    }

    private static Retry buildRetry(EpcProperties.Api api) {
        long delayMs = api.getRetryDelay().toMillis();

        RetryConfig config = RetryConfig.<RawResponse>custom()
                .maxAttempts(Math.max(1, api.getRetryAttempts()))
                .intervalFunction(attempt -> attempt * delayMs)
                .retryOnResult(response -> response.status() == HTTP_TOO_MANY_REQUESTS)
                .retryExceptions(ResourceAccessException.class)
                .build();

        Retry retry = Retry.of("epcApi", config);
        retry.getEventPublisher().onRetry(event -> {
            if (event.getLastThrowable() != null) {
                log.warn("Request failed, retrying in {}ms (attempt {}): {}",
                        event.getWaitInterval().toMillis(),
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage());
            } else {
                log.warn("Rate limited (429), waiting {}ms before retry (attempt {})",
                        event.getWaitInterval().toMillis(),
                        event.getNumberOfRetryAttempts());
            }
        });
        return retry;
    }

    /**
     * @param endpoint path relative to the base URL, e.g. "domestic/search"
     * @param params   query parameters, sent as-is
     * @return the decoded JSON body, or empty if the request ultimately failed
     */
    public Optional<JsonNode> fetch(String endpoint, Map<String, String> params) {
        URI uri = buildUri(endpoint, params);
        log.debug("Calling EPC API: {}", uri);

        RawResponse response;
        try {
            response = retry.executeSupplier(() -> exchange(uri));
        } catch (ResourceAccessException e) {
            log.error("Request failed after {} attempts: {}",
                    properties.getApi().getRetryAttempts(), e.getMessage());
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Request to {} failed: {}", uri, e.getMessage());
            return Optional.empty();
        }

        if (response.status() == HTTP_TOO_MANY_REQUESTS) {
            log.error("Still rate limited after {} attempts: {}",
                    properties.getApi().getRetryAttempts(), uri);
            return Optional.empty();
        }
        if (response.status() != HTTP_OK) {
            log.error("API error {}: {}", response.status(), response.body());
            return Optional.empty();
        }
        if (response.body() == null || response.body().isBlank()) {
            log.error("API returned an empty body for {}", uri);
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            log.error("API returned a non-JSON body for {}: {}", uri, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Issues a one-record domestic search to check the credentials.
     */
    public boolean testConnection() {
        Optional<JsonNode> response = fetch("domestic/search", Map.of("postcode", "SW1A 0AA", "size", "1"));
        if (response.isPresent()) {
            log.info("EPC API authentication successful");
            return true;
        }
        log.error("EPC API connection test failed");
        return false;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RawResponse exchange(URI uri) {
        try {
            ResponseEntity<String> entity = restTemplate.getForEntity(uri, String.class);
            return new RawResponse(entity.getStatusCode().value(), entity.getBody());
        } catch (HttpStatusCodeException e) {
            return new RawResponse(e.getStatusCode().value(), e.getResponseBodyAsString());
        }
    }

    private URI buildUri(String endpoint, Map<String, String> params) {
        String base = properties.getApi().getBaseUrl();
        String url = base.endsWith("/") ? base + endpoint : base + "/" + endpoint;

        // Values go in as URI variables so they are encoded strictly: a cursor
        // holding '+', '/' or '=' must reach the API unchanged.
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url);
        List<Object> values = new ArrayList<>(params.size());
        for (Map.Entry<String, String> param : params.entrySet()) {
            builder.queryParam(param.getKey(), "{p" + values.size() + "}");
            values.add(param.getValue());
        }
        return builder.encode().buildAndExpand(values.toArray()).toUri();
    }

    record RawResponse(int status, String body) {}
}
