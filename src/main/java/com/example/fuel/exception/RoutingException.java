package com.example.fuel.exception;

/**
 * Routing backend returned no usable route.
 */
public class RoutingException extends FuelRouteException {
    public static final String UNAVAILABLE = "ROUTING_UNAVAILABLE";

    public RoutingException(String message) {
        super(UNAVAILABLE, message);
    }

    public RoutingException(String message, Throwable cause) {
        super(UNAVAILABLE, message, cause);
    }
}
