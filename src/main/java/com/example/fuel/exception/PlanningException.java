package com.example.fuel.exception;

public class PlanningException extends FuelRouteException {
    public static final String CANDIDATE_LIMIT = "CANDIDATE_LIMIT";

    public PlanningException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
