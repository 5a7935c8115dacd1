package com.example.fuel.planner;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Single forward pass used when no refuel sequence covers the route within range.
 *
 * <p>A station becomes a stop once the distance since the previous stop (or the start) reaches
 * {@code range - buffer}. Leg lengths are not checked against the range, so the result can be
 * infeasible when coverage is sparse.</p>
 */
@Slf4j
public class GreedyFallback {

    public static final double DEFAULT_BUFFER_MILES = 50.0;

    private final double bufferMiles;

    public GreedyFallback(double bufferMiles) {
        if (!(bufferMiles >= 0)) {
            throw new IllegalArgumentException("buffer must be >= 0, got " + bufferMiles);
        }
        this.bufferMiles = bufferMiles;
    }

    public StopSequence plan(double routeDistanceMiles, List<OnRouteStation> stations, VehicleProfile vehicle) {
        List<FuelStop> stops = new ArrayList<>();
        double threshold = vehicle.getRangeMiles() - bufferMiles;
        double lastChainage = 0.0;

        for (OnRouteStation station : stations) {
            if (station.getChainage() - lastChainage >= threshold) {
                stops.add(FuelStop.fullTank(station, vehicle));
                lastChainage = station.getChainage();
            }
        }

        log.debug("Greedy fallback chose {} stops, final leg {} miles",
                stops.size(), routeDistanceMiles - lastChainage);
        return new StopSequence(stops, OptimizationMethod.GREEDY_FALLBACK);
    }
}
