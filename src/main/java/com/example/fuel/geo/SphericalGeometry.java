package com.example.fuel.geo;

/**
 * Great-circle arithmetic on a spherical earth.
 *
 * <p>Every distance in the planner is derived from {@link #EARTH_RADIUS_MILES} so that chainages,
 * lateral offsets and leg lengths stay mutually comparable.</p>
 */
public final class SphericalGeometry {

    /** Mean earth radius in miles. */
    public static final double EARTH_RADIUS_MILES = 3959.0;

    private SphericalGeometry() {
    }

    /**
     * Haversine distance between two points, in miles.
     */
    public static double distanceMiles(GeoPoint a, GeoPoint b) {
        return angularDistance(a, b) * EARTH_RADIUS_MILES;
    }

    /**
     * Projects {@code p} onto the great-circle segment {@code a -> b}.
     *
     * <p>When the perpendicular foot falls outside the segment the closer endpoint is used, so the
     * returned offset is the distance to the nearest point of the segment, and the along-segment
     * distance is clamped to {@code [0, |ab|]}.</p>
     *
     * @param p point to project
     * @param a segment start
     * @param b segment end
     * @return cross-track offset and along-segment distance, both in miles
     */
    public static SegmentProjection projectOntoSegment(GeoPoint p, GeoPoint a, GeoPoint b) {
        double d12 = angularDistance(a, b);
        double d13 = angularDistance(a, p);
        if (d12 == 0.0 || d13 == 0.0) {
            return new SegmentProjection(d13 * EARTH_RADIUS_MILES, 0.0);
        }

        double deltaBearing = initialBearing(a, p) - initialBearing(a, b);
        double crossTrack = Math.asin(clamp(Math.sin(d13) * Math.sin(deltaBearing)));
        double alongTrack = Math.acos(clamp(Math.cos(d13) / Math.cos(crossTrack)));
        if (Math.cos(deltaBearing) < 0) {
            alongTrack = -alongTrack;
        }

        if (alongTrack <= 0.0) {
            return new SegmentProjection(d13 * EARTH_RADIUS_MILES, 0.0);
        }
        if (alongTrack >= d12) {
            return new SegmentProjection(distanceMiles(b, p), d12 * EARTH_RADIUS_MILES);
        }
        return new SegmentProjection(Math.abs(crossTrack) * EARTH_RADIUS_MILES, alongTrack * EARTH_RADIUS_MILES);
    }

    static double angularDistance(GeoPoint a, GeoPoint b) {
        double lat1 = Math.toRadians(a.getLatitude());
        double lat2 = Math.toRadians(b.getLatitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(b.getLongitude() - a.getLongitude());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * Math.asin(Math.sqrt(Math.min(1.0, h)));
    }

    static double initialBearing(GeoPoint a, GeoPoint b) {
        double lat1 = Math.toRadians(a.getLatitude());
        double lat2 = Math.toRadians(b.getLatitude());
        double dLon = Math.toRadians(b.getLongitude() - a.getLongitude());
        double y = Math.sin(dLon) * Math.cos(lat2);
        double x = Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon);
        return Math.atan2(y, x);
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
