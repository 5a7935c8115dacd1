package com.example.fuel.planner;

import com.example.fuel.geo.GeoPoint;
import com.example.fuel.station.Station;

final class PlannerFixtures {
    static final VehicleProfile TRUCK = new VehicleProfile(500, 10);

    private PlannerFixtures() {
    }

    static Station station(long id, double price, GeoPoint location) {
        return Station.builder()
                .id(id)
                .name("Stop " + id)
                .address("I-40, EXIT " + id)
                .city("City" + id)
                .state("TX")
                .price(price)
                .location(location)
                .resolved(location != null)
                .build();
    }

    static OnRouteStation onRoute(long id, double chainage, double price) {
        return new OnRouteStation(station(id, price, GeoPoint.of(0.0, chainage / 69.0)), chainage, 0.0);
    }
}
