package com.example.fuel.routing;

import com.example.fuel.config.FuelRouteProperties;
import com.example.fuel.exception.GeocodingException;
import com.example.fuel.exception.RoutingException;
import com.example.fuel.geo.GeoPoint;
import com.example.fuel.geo.RoutePolyline;
import com.example.fuel.util.Polyline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Routes through the OSRM HTTP API and geocodes addresses through a {@link Geocoder}.
 */
@Slf4j
@Service
public class OsrmRoutingService implements RoutingService {

    static final double METERS_PER_MILE = 1609.344;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Geocoder geocoder;
    private final String osrmBaseUrl;

    public OsrmRoutingService(RestTemplate restTemplate, ObjectMapper objectMapper, Geocoder geocoder,
                              FuelRouteProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.geocoder = geocoder;
        this.osrmBaseUrl = properties.getRouting().getOsrmBaseUrl();
    }

    @Override
    public GeoPoint geocode(String address) {
        return lookup(address, "address");
    }

    @Override
    public RouteResult routeBetween(String startAddress, String endAddress) {
        GeoPoint start = lookup(startAddress, "start location");
        GeoPoint end = lookup(endAddress, "end location");
        return route(start, end);
    }

    private GeoPoint lookup(String address, String label) {
        return geocoder.lookup(address + ", USA")
                .orElseThrow(() -> new GeocodingException(GeocodingException.NOT_FOUND,
                        "Could not geocode " + label + ": " + address));
    }

    @Override
    public RouteResult route(GeoPoint start, GeoPoint end) {
        // OSRM takes lon,lat pairs
        String coordinates = String.format(Locale.ROOT, "%f,%f;%f,%f",
                start.getLongitude(), start.getLatitude(), end.getLongitude(), end.getLatitude());
        URI uri = UriComponentsBuilder.fromHttpUrl(osrmBaseUrl)
                .path("/route/v1/driving/")
                .path(coordinates)
                .queryParam("overview", "full")
                .queryParam("geometries", "polyline")
                .queryParam("steps", "false")
                .queryParam("annotations", "false")
                .encode()
                .build()
                .toUri();

        log.info("Calling OSRM for route ({},{}) -> ({},{})",
                start.getLatitude(), start.getLongitude(), end.getLatitude(), end.getLongitude());

        String body;
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            body = response.getBody();
        } catch (HttpClientErrorException e) {
            // OSRM reports NoRoute, InvalidQuery etc. as 400 with a JSON body
            body = e.getResponseBodyAsString();
        } catch (RestClientException e) {
            log.error("OSRM request failed: {}", e.getMessage());
            throw new RoutingException("Could not calculate route: routing service unavailable", e);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new RoutingException("Could not calculate route: unreadable routing response", e);
        }

        if (!"Ok".equals(root.path("code").asText())) {
            log.error("OSRM error: {}", root.path("message").asText("Unknown error"));
            throw new RoutingException("Could not calculate route: " + root.path("message").asText(root.path("code").asText("no response")));
        }
        JsonNode routeNode = root.path("routes").path(0);
        if (routeNode.isMissingNode()) {
            throw new RoutingException("Could not calculate route: no routes returned");
        }

        List<GeoPoint> points;
        try {
            points = Polyline.decode(routeNode.path("geometry").asText(""));
        } catch (IllegalArgumentException e) {
            throw new RoutingException("Could not calculate route: malformed route geometry", e);
        }
        if (points.size() < 2) {
            throw new RoutingException("Could not calculate route: route geometry has " + points.size() + " points");
        }

        RouteResult result = RouteResult.builder()
                .distanceMiles(round2(routeNode.path("distance").asDouble() / METERS_PER_MILE))
                .durationHours(round2(routeNode.path("duration").asDouble() / 3600.0))
                .polyline(new RoutePolyline(points))
                .start(start)
                .end(end)
                .build();
        log.info("Route calculated: {} miles, {} hours", result.getDistanceMiles(), result.getDurationHours());
        return result;
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
