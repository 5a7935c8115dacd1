package com.example.fuel.planner;

import com.example.fuel.geo.GeoPoint;
import com.example.fuel.geo.RoutePolyline;
import com.example.fuel.geo.SphericalGeometry;
import com.example.fuel.station.Station;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.example.fuel.planner.PlannerFixtures.station;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Corridor filter")
class CorridorFilterTest {
    private static final double MILES_PER_DEGREE = SphericalGeometry.EARTH_RADIUS_MILES * Math.PI / 180.0;

    private static final RoutePolyline EQUATOR_ROUTE = new RoutePolyline(List.of(
            GeoPoint.of(0, 0), GeoPoint.of(0, 10), GeoPoint.of(0, 20)));

    private final CorridorFilter filter = new CorridorFilter(CorridorFilter.DEFAULT_HALF_WIDTH_MILES);

    @Test
    @DisplayName("Keeps stations within the half-width and drops the rest")
    void testCorridorMembership() {
        Station near = station(1, 3.10, GeoPoint.of(0.1, 2.0));     // ~6.9 miles off
        Station far = station(2, 2.50, GeoPoint.of(0.3, 5.0));      // ~20.7 miles off
        Station edge = station(3, 3.00, GeoPoint.of(-0.2, 12.0));   // ~13.8 miles off

        List<OnRouteStation> result = filter.filter(EQUATOR_ROUTE, List.of(near, far, edge));

        assertEquals(2, result.size());
        assertEquals(1, result.get(0).getStation().getId());
        assertEquals(3, result.get(1).getStation().getId());
        assertEquals(2.0 * MILES_PER_DEGREE, result.get(0).getChainage(), 1e-6);
        assertEquals(0.1 * MILES_PER_DEGREE, result.get(0).getLateralOffset(), 1e-6);
        assertEquals(12.0 * MILES_PER_DEGREE, result.get(1).getChainage(), 1e-6);
    }

    @Test
    @DisplayName("Output is ordered by chainage whatever the input order")
    void testSortedByChainage() {
        List<Station> stations = new ArrayList<>();
        Random random = new Random(7);
        for (int i = 0; i < 200; i++) {
            stations.add(station(i, 2.5 + random.nextDouble(),
                    GeoPoint.of((random.nextDouble() - 0.5) * 0.6, random.nextDouble() * 22 - 1)));
        }
        Collections.shuffle(stations, random);

        List<OnRouteStation> result = filter.filter(EQUATOR_ROUTE, stations);

        assertTrue(result.size() > 0);
        for (int i = 0; i < result.size(); i++) {
            assertTrue(result.get(i).getLateralOffset() <= CorridorFilter.DEFAULT_HALF_WIDTH_MILES);
            if (i > 0) {
                assertTrue(result.get(i).getChainage() >= result.get(i - 1).getChainage());
            }
        }
    }

    @Test
    @DisplayName("Equal chainage orders by price, then id")
    void testTieBreakByPrice() {
        GeoPoint sameSpot = GeoPoint.of(0.05, 4.0);
        Station pricey = station(10, 3.40, sameSpot);
        Station cheap = station(11, 3.05, sameSpot);
        Station cheapTwin = station(9, 3.05, sameSpot);

        List<OnRouteStation> result = filter.filter(EQUATOR_ROUTE, List.of(pricey, cheap, cheapTwin));

        assertEquals(List.of(9L, 11L, 10L), result.stream().map(s -> s.getStation().getId()).toList());
    }

    @Test
    @DisplayName("Chainage is clamped to the reported route distance")
    void testClampToRouteDistance() {
        Station nearEnd = station(1, 3.0, GeoPoint.of(0.0, 19.99));
        double reported = 19.0 * MILES_PER_DEGREE;

        List<OnRouteStation> result = filter.filter(EQUATOR_ROUTE, List.of(nearEnd), reported);

        assertEquals(reported, result.get(0).getChainage(), 0.0);
    }

    @Test
    @DisplayName("Stations without coordinates are ignored")
    void testUnresolvedIgnored() {
        List<OnRouteStation> result = filter.filter(EQUATOR_ROUTE, List.of(station(1, 3.0, null)));

        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("Same input gives the same output")
    void testDeterministic() {
        List<Station> stations = List.of(
                station(1, 3.0, GeoPoint.of(0.1, 1.0)),
                station(2, 2.9, GeoPoint.of(-0.1, 1.0)),
                station(3, 3.1, GeoPoint.of(0.0, 15.0)));

        assertEquals(filter.filter(EQUATOR_ROUTE, stations), filter.filter(EQUATOR_ROUTE, stations));
    }

    @Test
    @DisplayName("Negative half-width is rejected")
    void testInvalidHalfWidth() {
        assertThrows(IllegalArgumentException.class, () -> new CorridorFilter(-1.0));
    }

    @Test
    @DisplayName("Mid-latitude corridor follows the great circle, not the parallel")
    void testMidLatitudeCorridor() {
        RoutePolyline northernRoute = new RoutePolyline(List.of(GeoPoint.of(45.0, -120.0), GeoPoint.of(45.0, -80.0)));
        Station onArc = station(1, 3.00, GeoPoint.of(46.78, -100.0));      // ~0.06 miles off
        Station inside = station(2, 3.00, GeoPoint.of(46.6, -100.0));      // ~12.5 miles off
        Station onParallel = station(3, 2.00, GeoPoint.of(45.0, -100.0));  // ~123 miles off

        List<OnRouteStation> result = filter.filter(northernRoute, List.of(onArc, inside, onParallel));

        // both project to the same chainage up to rounding, so only membership is checked
        assertEquals(2, result.size());
        for (OnRouteStation kept : result) {
            assertTrue(kept.getStation().getId() != 3);
            assertEquals(967.05, kept.getChainage(), 0.01);
            assertTrue(kept.getLateralOffset() < 12.5);
        }
    }
}
