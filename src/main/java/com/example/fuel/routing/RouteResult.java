package com.example.fuel.routing;

import com.example.fuel.geo.GeoPoint;
import com.example.fuel.geo.RoutePolyline;
import lombok.Builder;
import lombok.Value;

/**
 * Driving route between two geocoded endpoints.
 */
@Value
@Builder
public class RouteResult {
    double distanceMiles;
    double durationHours;
    RoutePolyline polyline;
    GeoPoint start;
    GeoPoint end;
}
