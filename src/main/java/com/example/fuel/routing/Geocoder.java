package com.example.fuel.routing;

import com.example.fuel.exception.GeocodingException;
import com.example.fuel.geo.GeoPoint;

import java.util.Optional;

/**
 * Free-text location lookup.
 */
public interface Geocoder {

    /**
     * Resolves {@code query} to its best match.
     *
     * @return the match, or empty when the geocoder knows no such place
     * @throws GeocodingException when the lookup itself fails; {@link GeocodingException#isTransient()}
     *     tells whether trying again later may help
     */
    Optional<GeoPoint> lookup(String query);
}
