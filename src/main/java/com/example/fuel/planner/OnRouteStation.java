package com.example.fuel.planner;

import com.example.fuel.station.Station;
import lombok.Value;

/**
 * Station inside the route corridor, tagged with where along the route it sits.
 */
@Value
public class OnRouteStation {
    Station station;
    /** Miles from route start to the station's projection onto the route. */
    double chainage;
    /** Cross-track miles between the station and the route. */
    double lateralOffset;

    public double getPrice() {
        return station.getPrice();
    }
}
