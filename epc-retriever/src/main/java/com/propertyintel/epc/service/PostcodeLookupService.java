package com.propertyintel.epc.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Geocoder for GeoJSON export. Certificates hold a postcode but no position,
 * so each one is mapped to the centroid postcodes.io reports for that postcode.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PostcodeLookupService {

    private static final String POSTCODES_IO_URL = "https://api.postcodes.io/postcodes/";
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final ObjectMapper objectMapper;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(TIMEOUT)
            .build();

    public record PostcodeResult(String postcode, double latitude, double longitude) {}

    /**
     * @throws IllegalArgumentException if the postcode is unknown or has no centroid
     */
    public PostcodeResult lookup(String postcode) {
        String normalised = postcode.trim().toUpperCase();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(POSTCODES_IO_URL
                        + URLEncoder.encode(normalised, StandardCharsets.UTF_8).replace("+", "%20")))
                .timeout(TIMEOUT)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Postcode lookup interrupted for " + normalised, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Postcode lookup failed for " + normalised, e);
        }

        return parse(normalised, response.statusCode(), response.body());
    }

    PostcodeResult parse(String normalised, int status, String body) {
        if (status == 404) {
            throw new IllegalArgumentException("Postcode not found: " + normalised);
        }
        if (status != 200) {
            throw new IllegalStateException("postcodes.io returned HTTP " + status + " for " + normalised);
        }

        JsonNode result;
        try {
            result = objectMapper.readTree(body).path("result");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable postcodes.io response for " + normalised, e);
        }

        JsonNode lat = result.path("latitude");
        JsonNode lng = result.path("longitude");
        if (!lat.isNumber() || !lng.isNumber()) {
            throw new IllegalArgumentException("Postcode has no coordinates: " + normalised);
        }

        log.debug("Postcode {} centroid {}, {}", normalised, lat.asDouble(), lng.asDouble());
        return new PostcodeResult(normalised, lat.asDouble(), lng.asDouble());
    }
}
