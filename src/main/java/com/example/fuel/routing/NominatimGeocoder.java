package com.example.fuel.routing;

import com.example.fuel.config.FuelRouteProperties;
import com.example.fuel.exception.GeocodingException;
import com.example.fuel.geo.GeoPoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Geocoder backed by the OpenStreetMap Nominatim search API.
 */
@Slf4j
@Component
public class NominatimGeocoder implements Geocoder {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String userAgent;

    public NominatimGeocoder(RestTemplate restTemplate, ObjectMapper objectMapper, FuelRouteProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = properties.getRouting().getNominatimBaseUrl();
        this.userAgent = properties.getRouting().getUserAgent();
    }

    @Override
    public Optional<GeoPoint> lookup(String query) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/search")
                .queryParam("q", query)
                .queryParam("format", "json")
                .queryParam("limit", 1)
                .encode()
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, userAgent);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (ResourceAccessException e) {
            throw new GeocodingException(GeocodingException.UNAVAILABLE, "Geocoder timed out for '" + query + "'", e);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new GeocodingException(GeocodingException.UNAVAILABLE,
                        "Geocoder unavailable (" + e.getStatusCode().value() + ") for '" + query + "'", e);
            }
            throw new GeocodingException(GeocodingException.FAILED,
                    "Geocoder rejected '" + query + "' with " + e.getStatusCode().value(), e);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.getBody() == null ? "[]" : response.getBody());
        } catch (JsonProcessingException e) {
            throw new GeocodingException(GeocodingException.FAILED, "Unreadable geocoder response for '" + query + "'", e);
        }

        JsonNode first = root.path(0);
        if (first.isMissingNode() || !first.hasNonNull("lat") || !first.hasNonNull("lon")) {
            log.warn("No geocoding match for '{}'", query);
            return Optional.empty();
        }
        GeoPoint point = GeoPoint.of(first.get("lat").asDouble(), first.get("lon").asDouble());
        log.info("Geocoded '{}' to ({}, {})", query, point.getLatitude(), point.getLongitude());
        return Optional.of(point);
    }
}
