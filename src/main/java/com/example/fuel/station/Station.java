package com.example.fuel.station;

import com.example.fuel.geo.GeoPoint;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of a catalog station, detached from the persistence layer.
 */
@Value
@Builder
public class Station {
    long id;
    String name;
    String address;
    String city;
    String state;
    /** Retail price per gallon. */
    double price;
    /** Null while the station has not been geocoded. */
    GeoPoint location;
    boolean resolved;
}
