package com.example.fuel.routing;

import com.example.fuel.geo.GeoPoint;

/**
 * Address geocoding and point-to-point driving routes.
 *
 * <p>Failures surface as {@link com.example.fuel.exception.GeocodingException} or
 * {@link com.example.fuel.exception.RoutingException}; callers treat them as request errors and do
 * not retry.</p>
 */
public interface RoutingService {

    GeoPoint geocode(String address);

    RouteResult route(GeoPoint start, GeoPoint end);

    /**
     * Geocodes both addresses and routes between them: two geocoder calls and one routing call.
     */
    RouteResult routeBetween(String startAddress, String endAddress);
}
