package com.example.fuel.planner;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which strategy produced a plan, reported to clients as {@code optimization_method}.
 */
public enum OptimizationMethod {
    DYNAMIC_PROGRAMMING("dynamic_programming"),
    GREEDY_FALLBACK("greedy_fallback"),
    NO_STATIONS("no_stations");

    private final String label;

    OptimizationMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
