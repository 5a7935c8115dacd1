package com.example.fuel.planner;

import lombok.Value;

import java.util.List;

@Value
public class StopSequence {
    List<FuelStop> stops;
    OptimizationMethod method;

    public StopSequence(List<FuelStop> stops, OptimizationMethod method) {
        this.stops = List.copyOf(stops);
        this.method = method;
    }

    public static StopSequence empty() {
        return new StopSequence(List.of(), OptimizationMethod.NO_STATIONS);
    }
}
