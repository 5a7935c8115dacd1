package com.example.fuel.planner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.fuel.planner.PlannerFixtures.TRUCK;
import static com.example.fuel.planner.PlannerFixtures.onRoute;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Greedy fallback")
class GreedyFallbackTest {

    private final GreedyFallback fallback = new GreedyFallback(50);

    @Test
    @DisplayName("Stops once the distance since the last stop reaches range minus buffer")
    void testThreshold() {
        List<OnRouteStation> stations = List.of(
                onRoute(1, 200, 3.0),
                onRoute(2, 449, 3.0),
                onRoute(3, 450, 3.1),
                onRoute(4, 850, 3.2),
                onRoute(5, 900, 3.3));

        StopSequence result = fallback.plan(1500, stations, TRUCK);

        assertEquals(OptimizationMethod.GREEDY_FALLBACK, result.getMethod());
        assertEquals(List.of(450.0, 900.0), result.getStops().stream().map(FuelStop::getChainage).toList());
        assertEquals(155.0, result.getStops().get(0).getCost(), 1e-9);
    }

    @Test
    @DisplayName("Does not guarantee legs within range")
    void testMayExceedRange() {
        StopSequence result = fallback.plan(2000, List.of(onRoute(1, 800, 3.0)), TRUCK);

        assertEquals(1, result.getStops().size());
        assertTrue(!PlanAssembler.isRangeFeasible(2000, result.getStops(), TRUCK.getRangeMiles()));
    }

    @Test
    @DisplayName("No stations gives no stops")
    void testEmpty() {
        assertTrue(fallback.plan(2000, List.of(), TRUCK).getStops().isEmpty());
    }

    @Test
    @DisplayName("Negative buffer is rejected")
    void testInvalidBuffer() {
        assertThrows(IllegalArgumentException.class, () -> new GreedyFallback(-5));
    }
}
