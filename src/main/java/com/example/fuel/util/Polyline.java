package com.example.fuel.util;

import com.example.fuel.geo.GeoPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Encoded polyline codec (precision 5), the format OSRM returns for {@code geometries=polyline}.
 */
public final class Polyline {

    private static final double PRECISION = 1E5;

    private Polyline() {
    }

    public static List<GeoPoint> decode(String encoded) {
        List<GeoPoint> path = new ArrayList<>();
        if (encoded == null) {
            return path;
        }
        int index = 0, len = encoded.length();
        int lat = 0, lng = 0;

        while (index < len) {
            int b, shift = 0, result = 0;
            do {
                if (index >= len) {
                    throw new IllegalArgumentException("truncated polyline at index " + index);
                }
                b = encoded.charAt(index++) - 63;
                result |= (b & 0x1f) << shift;
                shift += 5;
            } while (b >= 0x20);
            lat += ((result & 1) != 0 ? ~(result >> 1) : (result >> 1));

            shift = 0;
            result = 0;
            do {
                if (index >= len) {
                    throw new IllegalArgumentException("truncated polyline at index " + index);
                }
                b = encoded.charAt(index++) - 63;
                result |= (b & 0x1f) << shift;
                shift += 5;
            } while (b >= 0x20);
            lng += ((result & 1) != 0 ? ~(result >> 1) : (result >> 1));

            path.add(GeoPoint.of(lat / PRECISION, lng / PRECISION));
        }
        return path;
    }
}
