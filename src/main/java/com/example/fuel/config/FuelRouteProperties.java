package com.example.fuel.config;

import com.example.fuel.planner.CorridorFilter;
import com.example.fuel.planner.GreedyFallback;
import com.example.fuel.planner.RefuelPlanner;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under the {@code fuel.*} prefix.
 */
@Data
@ConfigurationProperties(prefix = "fuel")
public class FuelRouteProperties {

    private Vehicle vehicle = new Vehicle();
    private Corridor corridor = new Corridor();
    private Planner planner = new Planner();
    private Routing routing = new Routing();
    private Ingest ingest = new Ingest();

    @Data
    public static class Vehicle {
        /** Miles on a full tank. */
        private double rangeMiles = 500;
        private double milesPerGallon = 10;
    }

    @Data
    public static class Corridor {
        /** Max cross-track distance for a station to count as on-route. */
        private double halfWidthMiles = CorridorFilter.DEFAULT_HALF_WIDTH_MILES;
    }

    @Data
    public static class Planner {
        private double greedyBufferMiles = GreedyFallback.DEFAULT_BUFFER_MILES;
        private int maxCandidateStations = RefuelPlanner.DEFAULT_MAX_CANDIDATE_STATIONS;
    }

    @Data
    public static class Routing {
        private String osrmBaseUrl = "https://router.project-osrm.org";
        private String nominatimBaseUrl = "https://nominatim.openstreetmap.org";
        /** Nominatim's usage policy requires an identifying User-Agent. */
        private String userAgent = "fuel-route-optimizer/2.0";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Ingest {
        private boolean enabled = false;
        private String csvPath = "data/fuel_prices.csv";
        private boolean skipGeocoding = false;
        private boolean geocodeOnly = false;
        /** Minimum spacing between geocoding requests. */
        private Duration minInterval = Duration.ofSeconds(1);
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
    }
}
