package com.example.fuel.geo;

import java.util.List;
import java.util.Objects;

/**
 * Immutable route path as an ordered list of vertices.
 *
 * <p>Cumulative vertex chainages are computed once on construction; {@link #project(GeoPoint)}
 * then answers the chainage and lateral offset of any location in one pass over the segments.</p>
 */
public final class RoutePolyline {

    private final List<GeoPoint> points;
    private final double[] vertexChainage;

    public RoutePolyline(List<GeoPoint> points) {
        Objects.requireNonNull(points, "points");
        if (points.size() < 2) {
            throw new IllegalArgumentException("route polyline needs at least 2 points, got " + points.size());
        }
        this.points = List.copyOf(points);
        this.vertexChainage = new double[this.points.size()];
        for (int i = 1; i < this.points.size(); i++) {
            vertexChainage[i] = vertexChainage[i - 1]
                    + SphericalGeometry.distanceMiles(this.points.get(i - 1), this.points.get(i));
        }
    }

    public List<GeoPoint> getPoints() {
        return points;
    }

    public int segmentCount() {
        return points.size() - 1;
    }

    /**
     * Geometric length of the path in miles.
     */
    public double lengthMiles() {
        return vertexChainage[vertexChainage.length - 1];
    }

    /**
     * Finds the segment closest to {@code location}.
     *
     * @return minimum cross-track offset over all segments, with the chainage of its projection
     *     point; equal offsets resolve to the smaller chainage
     */
    public SegmentProjection project(GeoPoint location) {
        double bestOffset = Double.POSITIVE_INFINITY;
        double bestChainage = 0.0;
        for (int i = 0; i < segmentCount(); i++) {
            SegmentProjection local = SphericalGeometry.projectOntoSegment(location, points.get(i), points.get(i + 1));
            double chainage = vertexChainage[i] + local.getAlongMiles();
            double offset = local.getOffsetMiles();
            if (offset < bestOffset || (offset == bestOffset && chainage < bestChainage)) {
                bestOffset = offset;
                bestChainage = chainage;
            }
        }
        return new SegmentProjection(bestOffset, bestChainage);
    }
}
