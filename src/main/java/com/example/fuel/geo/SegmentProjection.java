package com.example.fuel.geo;

import lombok.Value;

/**
 * Nearest-point projection of a location onto a route segment or a whole polyline.
 */
@Value
public class SegmentProjection {
    /** Cross-track distance to the nearest point, in miles. */
    double offsetMiles;
    /** Distance along the segment (or route) to the nearest point, in miles. */
    double alongMiles;
}
