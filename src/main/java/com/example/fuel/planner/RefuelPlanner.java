package com.example.fuel.planner;

import com.example.fuel.exception.PlanningException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Minimum-cost full-tank refuel sequence along a route.
 *
 * <p>Nodes are a virtual START at chainage 0, the on-route stations in chainage order and a virtual
 * END at the route distance. An edge {@code j -> i} exists when {@code i} comes after {@code j} and
 * the gap between them is at most the vehicle range. Arriving at a station costs a full tank at
 * that station's price, whatever was actually burned on the leg; arriving at END costs nothing.</p>
 *
 * <p>Because nodes are already in position order this is a shortest path over a DAG: one forward
 * relaxation pass is enough, no priority queue. Ties keep the lowest-index predecessor.</p>
 */
@Slf4j
public class RefuelPlanner {

    public static final int DEFAULT_MAX_CANDIDATE_STATIONS = 10_000;

    private final GreedyFallback fallback;
    private final int maxCandidateStations;

    public RefuelPlanner(GreedyFallback fallback) {
        this(fallback, DEFAULT_MAX_CANDIDATE_STATIONS);
    }

    public RefuelPlanner(GreedyFallback fallback, int maxCandidateStations) {
        if (maxCandidateStations <= 0) {
            throw new IllegalArgumentException("maxCandidateStations must be > 0");
        }
        this.fallback = fallback;
        this.maxCandidateStations = maxCandidateStations;
    }

    /**
     * Plans refuel stops.
     *
     * @param routeDistanceMiles total route distance
     * @param stations on-route stations sorted by ascending chainage
     * @param vehicle range and efficiency
     * @return optimal stops, or the greedy fallback's stops when no sequence covers the route
     */
    public StopSequence plan(double routeDistanceMiles, List<OnRouteStation> stations, VehicleProfile vehicle) {
        int n = stations.size();
        if (n > maxCandidateStations) {
            throw new PlanningException(PlanningException.CANDIDATE_LIMIT,
                    "Too many on-route stations to plan: " + n + " (limit " + maxCandidateStations + ")");
        }

        int end = n + 1;
        double[] position = new double[n + 2];
        double[] arrivalCost = new double[n + 2];
        for (int i = 0; i < n; i++) {
            OnRouteStation station = stations.get(i);
            if (i > 0 && station.getChainage() < stations.get(i - 1).getChainage()) {
                throw new IllegalArgumentException("stations must be sorted by chainage (index " + i + ")");
            }
            position[i + 1] = station.getChainage();
            arrivalCost[i + 1] = vehicle.fullTankGallons() * station.getPrice();
        }
        position[end] = routeDistanceMiles;

        double range = vehicle.getRangeMiles();
        double[] dp = new double[n + 2];
        int[] parent = new int[n + 2];
        Arrays.fill(dp, Double.POSITIVE_INFINITY);
        Arrays.fill(parent, -1);
        dp[0] = 0.0;

        int firstInRange = 0;
        for (int i = 1; i <= end; i++) {
            while (position[i] - position[firstInRange] > range) {
                firstInRange++;
            }
            for (int j = firstInRange; j < i; j++) {
                if (dp[j] == Double.POSITIVE_INFINITY) {
                    continue;
                }
                double candidate = dp[j] + arrivalCost[i];
                if (candidate < dp[i]) {
                    dp[i] = candidate;
                    parent[i] = j;
                }
            }
        }

        if (dp[end] == Double.POSITIVE_INFINITY) {
            log.warn("No refuel sequence covers {} miles with range {} using {} stations, falling back to greedy",
                    routeDistanceMiles, range, n);
            return fallback.plan(routeDistanceMiles, stations, vehicle);
        }

        List<FuelStop> stops = new ArrayList<>();
        for (int node = parent[end]; node > 0; node = parent[node]) {
            stops.add(FuelStop.fullTank(stations.get(node - 1), vehicle));
        }
        Collections.reverse(stops);
        return new StopSequence(stops, OptimizationMethod.DYNAMIC_PROGRAMMING);
    }
}
