package com.example.fuel.planner;

import lombok.Value;

/**
 * Chosen refuel: always a full tank bought at the station's price.
 */
@Value
public class FuelStop {
    OnRouteStation station;
    double gallonsPurchased;
    double cost;

    static FuelStop fullTank(OnRouteStation station, VehicleProfile vehicle) {
        double gallons = vehicle.fullTankGallons();
        return new FuelStop(station, gallons, gallons * station.getPrice());
    }

    public double getChainage() {
        return station.getChainage();
    }
}
