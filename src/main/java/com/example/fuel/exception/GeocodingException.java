package com.example.fuel.exception;

/**
 * Address could not be resolved to coordinates.
 */
public class GeocodingException extends FuelRouteException {
    public static final String NOT_FOUND = "GEOCODE_NOT_FOUND";
    public static final String UNAVAILABLE = "GEOCODE_UNAVAILABLE";
    public static final String FAILED = "GEOCODE_FAILED";

    public GeocodingException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public GeocodingException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }

    /**
     * True when the geocoder timed out, throttled us or reported itself unavailable.
     */
    public boolean isTransient() {
        return UNAVAILABLE.equals(getReasonCode());
    }
}
