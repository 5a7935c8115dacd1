package com.example.fuel.station;

import lombok.Value;

/**
 * Geocoding key shared by every station in the same city.
 */
@Value
public class CityState {
    String city;
    String state;

    public String toQuery() {
        return city + ", " + state + ", USA";
    }

    @Override
    public String toString() {
        return city + ", " + state;
    }
}
