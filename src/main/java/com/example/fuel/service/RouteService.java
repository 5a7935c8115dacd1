package com.example.fuel.service;

import com.example.fuel.model.RouteResponse;
import com.example.fuel.planner.CorridorFilter;
import com.example.fuel.planner.OnRouteStation;
import com.example.fuel.planner.Plan;
import com.example.fuel.planner.PlanAssembler;
import com.example.fuel.planner.RefuelPlanner;
import com.example.fuel.planner.StopSequence;
import com.example.fuel.planner.VehicleProfile;
import com.example.fuel.routing.RouteResult;
import com.example.fuel.routing.RoutingService;
import com.example.fuel.station.Station;
import com.example.fuel.station.StationCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Plans the cheapest full-tank refuel stops for a trip between two addresses.
 *
 * <p>Makes exactly three external calls per request (two geocodes, one route); stations come from
 * the pre-geocoded catalog. Nothing is shared between requests.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteService {

    static final String API_VERSION = "v2";

    private final RoutingService routingService;
    private final StationCatalog stationCatalog;
    private final CorridorFilter corridorFilter;
    private final RefuelPlanner refuelPlanner;
    private final PlanAssembler planAssembler;
    private final VehicleProfile vehicle;

    public RouteResponse planRoute(String startAddress, String endAddress) {
        long startedAt = System.nanoTime();
        log.info("Route: {} -> {}", startAddress, endAddress);

        RouteResult route = routingService.routeBetween(startAddress, endAddress);
        log.info("Route: {} miles, {} hours", route.getDistanceMiles(), route.getDurationHours());

        List<Station> stations = stationCatalog.resolvedStations();
        List<OnRouteStation> onRoute = corridorFilter.filter(route.getPolyline(), stations, route.getDistanceMiles());
        log.info("Filtered {} geocoded stations to {} on-route stations", stations.size(), onRoute.size());

        Plan plan;
        if (onRoute.isEmpty()) {
            log.warn("No fuel stations found on route");
            plan = planAssembler.empty(route.getDistanceMiles(), vehicle);
        } else {
            StopSequence sequence = refuelPlanner.plan(route.getDistanceMiles(), onRoute, vehicle);
            plan = planAssembler.assemble(route.getDistanceMiles(), sequence, vehicle, onRoute.size());
        }
        if (!plan.isRangeFeasible()) {
            log.warn("Plan from {} leaves a leg longer than the {} mile range",
                    plan.getOptimizationMethod().getLabel(), vehicle.getRangeMiles());
        }

        RouteResponse response = planAssembler.toResponse(plan, route, startAddress, endAddress);
        double elapsed = (System.nanoTime() - startedAt) / 1_000_000_000.0;
        response.setProcessingTimeSeconds(BigDecimal.valueOf(elapsed).setScale(2, RoundingMode.HALF_UP).doubleValue());
        response.setApiVersion(API_VERSION);

        log.info("[{}] {} stops, ${} total (from {} candidates) in {}s",
                plan.getOptimizationMethod().getLabel(), plan.getStops().size(),
                response.getTotalFuelCost(), plan.getStationsConsidered(), response.getProcessingTimeSeconds());
        return response;
    }
}
