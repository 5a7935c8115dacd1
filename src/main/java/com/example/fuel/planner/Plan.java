package com.example.fuel.planner;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Planner output before it is mapped onto the HTTP response.
 */
@Value
@Builder
public class Plan {
    /** Stops in strictly increasing chainage. */
    List<FuelStop> stops;
    double totalCost;
    /** Whole-trip consumption, route distance over efficiency; not the gallons purchased. */
    double totalFuelConsumed;
    OptimizationMethod optimizationMethod;
    int stationsConsidered;
    /** Every leg, endpoints included, fits within the vehicle range. */
    boolean rangeFeasible;
}
