package com.example.fuel.geo;

import lombok.Value;

/**
 * Geographic position in decimal degrees.
 */
@Value
public class GeoPoint {
    double latitude;
    double longitude;

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }
}
