package com.example.fuel.ingest;

import com.example.fuel.exception.GeocodingException;
import com.example.fuel.geo.GeoPoint;
import com.example.fuel.routing.Geocoder;
import com.example.fuel.station.CityState;
import com.example.fuel.station.StationCatalog;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Geocodes every ungeocoded (city, state) pair in the catalog, one request at a time.
 *
 * <p>The public geocoder allows one request per second, so requests go through a
 * {@link RequestThrottle} and are never issued concurrently. Timeouts and unavailability are retried
 * per {@link GeocodeRetryPolicy}; an unknown place or any other error marks the location as failed
 * for the rest of the run. Canadian provinces are skipped without a request.</p>
 */
@Slf4j
public class StationGeocodingJob {

    static final Set<String> CANADIAN_PROVINCES = Set.of(
            "SK", "AB", "BC", "MB", "ON", "QC", "NB", "NS", "PE", "NL", "NT", "YT", "NU");

    private final Geocoder geocoder;
    private final StationCatalog catalog;
    private final RequestThrottle throttle;
    private final GeocodeRetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public StationGeocodingJob(Geocoder geocoder, StationCatalog catalog, RequestThrottle throttle,
                               GeocodeRetryPolicy retryPolicy, Sleeper sleeper) {
        this.geocoder = geocoder;
        this.catalog = catalog;
        this.throttle = throttle;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    /**
     * Geocodes pending locations and writes the coordinates back to the catalog.
     */
    public GeocodingReport run() throws InterruptedException {
        List<CityState> pending = catalog.pendingLocations();
        if (pending.isEmpty()) {
            log.info("All stations already geocoded");
            return new GeocodingReport(Map.of(), List.of(), 0, 0);
        }
        log.info("Found {} unique locations to geocode", pending.size());

        GeocodingReport resolved = resolve(pending);
        int updated = catalog.applyCoordinates(resolved.getResolved());
        log.info("Geocoded {} unique locations, updated {} station records",
                resolved.getResolved().size(), updated);
        if (!resolved.getFailed().isEmpty()) {
            log.warn("Failed to geocode {} locations; run again in geocode-only mode to retry them",
                    resolved.getFailed().size());
        }
        return new GeocodingReport(resolved.getResolved(), resolved.getFailed(), updated, resolved.getRequestsSent());
    }

    /**
     * Resolves coordinates for {@code locations} without touching the catalog.
     */
    public GeocodingReport resolve(List<CityState> locations) throws InterruptedException {
        Map<CityState, GeoPoint> cache = new LinkedHashMap<>();
        Set<CityState> failedKeys = new HashSet<>();
        List<String> failed = new ArrayList<>();
        int requests = 0;
        int index = 0;

        for (CityState location : locations) {
            index++;
            if (index % 10 == 0 || index == locations.size()) {
                log.info("Progress: {}/{} ({}%)", index, locations.size(),
                        String.format(Locale.ROOT, "%.1f", index * 100.0 / locations.size()));
            }
            if (cache.containsKey(location) || failedKeys.contains(location)) {
                continue;
            }
            if (CANADIAN_PROVINCES.contains(location.getState().toUpperCase(Locale.ROOT))) {
                log.warn("Skipping Canadian location: {}", location);
                failedKeys.add(location);
                failed.add(location + " (Canada)");
                continue;
            }

            String query = location.toQuery();
            for (int attempt = 0; ; attempt++) {
                throttle.acquire();
                requests++;
                try {
                    Optional<GeoPoint> point = geocoder.lookup(query);
                    if (point.isPresent()) {
                        cache.put(location, point.get());
                    } else {
                        log.warn("Could not find: {}", query);
                        failedKeys.add(location);
                        failed.add(query);
                    }
                    break;
                } catch (GeocodingException e) {
                    if (e.isTransient() && attempt < retryPolicy.getMaxRetries()) {
                        Duration wait = retryPolicy.backoffBefore(attempt + 1);
                        log.warn("Timeout on {}, retrying in {}s (attempt {}/{})",
                                query, wait.toMillis() / 1000.0, attempt + 1, retryPolicy.getMaxRetries() + 1);
                        sleeper.sleep(wait);
                        continue;
                    }
                    log.error("Failed to geocode {} after {} attempts: {}", query, attempt + 1, e.getMessage());
                    failedKeys.add(location);
                    failed.add(query);
                    break;
                } catch (RuntimeException e) {
                    log.error("Error geocoding {}: {}", query, e.toString());
                    failedKeys.add(location);
                    failed.add(query);
                    break;
                }
            }
        }
        return new GeocodingReport(cache, failed, 0, requests);
    }
}
