package com.example.fuel.planner;

import com.example.fuel.geo.RoutePolyline;
import com.example.fuel.geo.SegmentProjection;
import com.example.fuel.station.Station;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Keeps the stations that lie within a lateral corridor around the route.
 *
 * <p>Each station is projected onto every segment of the polyline; the segment with the smallest
 * cross-track distance decides both the station's lateral offset and its chainage. Output is
 * ordered by chainage, then price, then station id, so identical inputs always give the same
 * list.</p>
 */
@Slf4j
public class CorridorFilter {

    public static final double DEFAULT_HALF_WIDTH_MILES = 15.0;

    private static final Comparator<OnRouteStation> ALONG_ROUTE = Comparator
            .comparingDouble(OnRouteStation::getChainage)
            .thenComparingDouble(OnRouteStation::getPrice)
            .thenComparingLong(s -> s.getStation().getId());

    private final double halfWidthMiles;

    public CorridorFilter(double halfWidthMiles) {
        if (!(halfWidthMiles >= 0)) {
            throw new IllegalArgumentException("corridor half-width must be >= 0, got " + halfWidthMiles);
        }
        this.halfWidthMiles = halfWidthMiles;
    }

    public double getHalfWidthMiles() {
        return halfWidthMiles;
    }

    public List<OnRouteStation> filter(RoutePolyline polyline, Collection<Station> stations) {
        return filter(polyline, stations, Double.POSITIVE_INFINITY);
    }

    /**
     * Filters and orders stations along the route.
     *
     * @param polyline route path
     * @param stations candidate stations; entries without a location are ignored
     * @param routeDistanceMiles reported route distance; chainages are clamped to it because the
     *     router's distance and the polyline's geometric length differ slightly
     * @return on-route stations sorted by ascending chainage
     */
    public List<OnRouteStation> filter(RoutePolyline polyline, Collection<Station> stations, double routeDistanceMiles) {
        List<OnRouteStation> onRoute = new ArrayList<>();
        for (Station station : stations) {
            if (station.getLocation() == null) {
                continue;
            }
            SegmentProjection projection = polyline.project(station.getLocation());
            if (projection.getOffsetMiles() <= halfWidthMiles) {
                double chainage = Math.min(Math.max(projection.getAlongMiles(), 0.0), routeDistanceMiles);
                onRoute.add(new OnRouteStation(station, chainage, projection.getOffsetMiles()));
            }
        }
        onRoute.sort(ALONG_ROUTE);
        log.debug("Corridor of {} miles kept {} of {} stations", halfWidthMiles, onRoute.size(), stations.size());
        return onRoute;
    }
}
