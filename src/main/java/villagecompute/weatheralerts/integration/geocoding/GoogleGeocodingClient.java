/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.integration.geocoding;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.BoundsType;
import villagecompute.weatheralerts.api.types.LatLngType;
import villagecompute.weatheralerts.exceptions.GeocodingException;

/**
 * HTTP client for the Google Maps Geocoding API (reverse lookups only).
 *
 * <h2>API Details</h2>
 * <ul>
 * <li>Endpoint: {@code GET /maps/api/geocode/json?latlng={lat},{lng}&key={key}}</li>
 * <li>Authentication: API key query parameter</li>
 * <li>Body {@code status} must be {@code OK}; {@code ZERO_RESULTS}, {@code OVER_QUERY_LIMIT} etc. are failures</li>
 * </ul>
 *
 * <h2>Result Extraction</h2>
 * <ul>
 * <li>Place name: first address component of the first result typed {@code neighborhood} or {@code locality},
 * otherwise the third address component</li>
 * <li>Bounds: {@code geometry.bounds}, otherwise {@code geometry.viewport}</li>
 * </ul>
 *
 * <p>
 * Every failure (transport, timeout, non-200, bad status, missing fields) is raised as {@link GeocodingException}.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code alerts.geocoding.base-url} - API host (overridden by tests to point at WireMock)</li>
 * <li>{@code alerts.geocoding.api-key} - Google Maps API key</li>
 * <li>{@code alerts.geocoding.timeout-seconds} - request timeout (default 5)</li>
 * </ul>
 *
 * @see <a href="https://developers.google.com/maps/documentation/geocoding/requests-reverse-geocoding">Reverse
 *      Geocoding</a>
 */
@ApplicationScoped
public class GoogleGeocodingClient {

    private static final Logger LOG = Logger.getLogger(GoogleGeocodingClient.class);

    private static final String GEOCODE_PATH = "/maps/api/geocode/json";
    private static final int FALLBACK_COMPONENT_INDEX = 2;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Optional<String> apiKey;
    private final Duration timeout;

    @Inject
    public GoogleGeocodingClient(ObjectMapper objectMapper, @ConfigProperty(
            name = "alerts.geocoding.base-url",
            defaultValue = "https://maps.googleapis.com") String baseUrl,
            @ConfigProperty(
                    name = "alerts.geocoding.api-key") Optional<String> apiKey,
            @ConfigProperty(
                    name = "alerts.geocoding.timeout-seconds",
                    defaultValue = "5") int timeoutSeconds) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_2)
                .followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(timeout).build();
    }

    /**
     * Reverse-geocodes a coordinate.
     *
     * @param latitude
     *            latitude coordinate
     * @param longitude
     *            longitude coordinate
     * @return place name and bounds
     * @throws GeocodingException
     *             if the lookup fails for any reason
     */
    public GeocodeResult geocode(double latitude, double longitude) {
        String key = apiKey.filter(k -> !k.isBlank())
                .orElseThrow(() -> new GeocodingException("Geocoding API key is not configured"));
        String url = baseUrl + GEOCODE_PATH + "?latlng=" + latitude + "," + longitude + "&key="
                + URLEncoder.encode(key, StandardCharsets.UTF_8);
        LOG.debugf("Reverse geocoding %s,%s", latitude, longitude);

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout).GET().build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeocodingException("Geocoding request interrupted", e);
        } catch (Exception e) {
            throw new GeocodingException("Geocoding request failed: " + e.getMessage(), e);
        }

        if (response.statusCode() != 200) {
            throw new GeocodingException("Geocoding request failed: HTTP status - " + response.statusCode());
        }
        return parseResponse(response.body());
    }

    private GeocodeResult parseResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GeocodingException("Malformed geocoding response", e);
        }

        String status = root.path("status").asText();
        if (!"OK".equals(status)) {
            throw new GeocodingException("Geocoding failed: API status - " + status);
        }

        JsonNode firstResult = root.path("results").path(0);
        if (firstResult.isMissingNode()) {
            throw new GeocodingException("Geocoding response has no results");
        }

        String placeName = extractPlaceName(firstResult.path("address_components"));
        BoundsType bounds = extractBounds(firstResult.path("geometry"));
        return new GeocodeResult(placeName, bounds);
    }

    private String extractPlaceName(JsonNode components) {
        for (JsonNode component : components) {
            for (JsonNode type : component.path("types")) {
                String typeName = type.asText();
                if ("neighborhood".equals(typeName) || "locality".equals(typeName)) {
                    return requireText(component.path("long_name"), "address component long_name");
                }
            }
        }
        JsonNode fallback = components.path(FALLBACK_COMPONENT_INDEX);
        if (fallback.isMissingNode()) {
            throw new GeocodingException("Geocoding response has no usable address component");
        }
        return requireText(fallback.path("long_name"), "address component long_name");
    }

    private BoundsType extractBounds(JsonNode geometry) {
        JsonNode box = geometry.hasNonNull("bounds") ? geometry.get("bounds") : geometry.path("viewport");
        if (box.isMissingNode() || box.isNull()) {
            throw new GeocodingException("Geocoding successful, but bounds/viewport not found");
        }
        return new BoundsType(corner(box.path("northeast")), corner(box.path("southwest")));
    }

    private LatLngType corner(JsonNode node) {
        if (!node.path("lat").isNumber() || !node.path("lng").isNumber()) {
            throw new GeocodingException("Malformed bounds corner in geocoding response");
        }
        return new LatLngType(node.get("lat").asDouble(), node.get("lng").asDouble());
    }

    private static String requireText(JsonNode node, String field) {
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new GeocodingException("Geocoding response missing " + field);
        }
        return node.asText();
    }
}
