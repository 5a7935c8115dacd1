package com.example.fuel.planner;

import com.example.fuel.model.GeoJsonLineString;
import com.example.fuel.model.RouteResponse;
import com.example.fuel.routing.RouteResult;
import com.example.fuel.station.Station;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a stop sequence into a {@link Plan} and a plan into the client response.
 *
 * <p>Total fuel consumed is the whole trip's burn (distance over efficiency) and is
 * independent of how many full tanks were bought. Values are rounded only when the response is
 * built; the response total is the sum of the rounded stop costs.</p>
 */
public class PlanAssembler {

    public Plan assemble(double routeDistanceMiles, StopSequence sequence, VehicleProfile vehicle, int stationsConsidered) {
        double totalCost = 0.0;
        for (FuelStop stop : sequence.getStops()) {
            totalCost += stop.getCost();
        }
        return Plan.builder()
                .stops(sequence.getStops())
                .totalCost(totalCost)
                .totalFuelConsumed(vehicle.gallonsFor(routeDistanceMiles))
                .optimizationMethod(sequence.getMethod())
                .stationsConsidered(stationsConsidered)
                .rangeFeasible(isRangeFeasible(routeDistanceMiles, sequence.getStops(), vehicle.getRangeMiles()))
                .build();
    }

    /**
     * Plan for a route with no stations in its corridor.
     */
    public Plan empty(double routeDistanceMiles, VehicleProfile vehicle) {
        return assemble(routeDistanceMiles, StopSequence.empty(), vehicle, 0);
    }

    public RouteResponse toResponse(Plan plan, RouteResult route, String startAddress, String endAddress) {
        RouteResponse response = new RouteResponse();
        response.setRoute(new RouteResponse.RouteInfo(
                route.getDistanceMiles(),
                route.getDurationHours(),
                GeoJsonLineString.of(route.getPolyline())));

        List<RouteResponse.FuelStopView> stops = new ArrayList<>(plan.getStops().size());
        BigDecimal totalCost = BigDecimal.ZERO;
        for (FuelStop stop : plan.getStops()) {
            RouteResponse.FuelStopView view = toView(stop);
            stops.add(view);
            totalCost = totalCost.add(BigDecimal.valueOf(view.getCost()));
        }
        response.setFuelStops(stops);
        // sum of the displayed stop costs, so the response adds up
        response.setTotalFuelCost(totalCost.setScale(2, RoundingMode.HALF_UP).doubleValue());
        response.setTotalGallons(round(plan.getTotalFuelConsumed(), 2));
        response.setStartLocation(new RouteResponse.Location(
                startAddress, route.getStart().getLatitude(), route.getStart().getLongitude()));
        response.setEndLocation(new RouteResponse.Location(
                endAddress, route.getEnd().getLatitude(), route.getEnd().getLongitude()));
        response.setOptimizationMethod(plan.getOptimizationMethod());
        response.setStationsConsidered(plan.getStationsConsidered());
        response.setRangeFeasible(plan.isRangeFeasible());
        return response;
    }

    /**
     * Checks every gap in {0, stop chainages..., route distance} against the range.
     */
    static boolean isRangeFeasible(double routeDistanceMiles, List<FuelStop> stops, double rangeMiles) {
        double previous = 0.0;
        for (FuelStop stop : stops) {
            if (stop.getChainage() - previous > rangeMiles) {
                return false;
            }
            previous = stop.getChainage();
        }
        return routeDistanceMiles - previous <= rangeMiles;
    }

    private static RouteResponse.FuelStopView toView(FuelStop stop) {
        Station station = stop.getStation().getStation();
        RouteResponse.FuelStopView view = new RouteResponse.FuelStopView();
        view.setName(station.getName());
        view.setAddress(station.getAddress());
        view.setCity(station.getCity());
        view.setState(station.getState());
        view.setPricePerGallon(round(station.getPrice(), 3));
        view.setGallonsNeeded(round(stop.getGallonsPurchased(), 2));
        view.setCost(round(stop.getCost(), 2));
        view.setMilesFromStart(round(stop.getChainage(), 2));
        view.setLatitude(station.getLocation().getLatitude());
        view.setLongitude(station.getLocation().getLongitude());
        return view;
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
