package com.example.fuel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

@Value
public class HealthResponse {
    String status;
    String service;
    String version;
    Database database;

    @Value
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Database {
        long totalStations;
        long geocodedStations;
        long pendingGeocoding;
    }
}
