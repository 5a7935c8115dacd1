package com.example.fuel.model;

import com.example.fuel.planner.OptimizationMethod;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RouteResponse {
    private RouteInfo route;
    private List<FuelStopView> fuelStops = new ArrayList<>();
    private double totalFuelCost;
    /** Gallons burned over the whole trip, not the gallons bought at the stops. */
    private double totalGallons;
    private Location startLocation;
    private Location endLocation;
    private OptimizationMethod optimizationMethod;
    private int stationsConsidered;
    private boolean rangeFeasible;
    private Double processingTimeSeconds;
    private String apiVersion;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class RouteInfo {
        private double distanceMiles;
        private double durationHours;
        private GeoJsonLineString geometry;
    }

    @Data
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class FuelStopView {
        private String name;
        private String address;
        private String city;
        private String state;
        private double pricePerGallon;
        private double gallonsNeeded;
        private double cost;
        private double milesFromStart;
        private double latitude;
        private double longitude;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Location {
        private String address;
        private double latitude;
        private double longitude;
    }
}
