package com.example.fuel.model;

import com.example.fuel.geo.GeoPoint;
import com.example.fuel.geo.RoutePolyline;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * GeoJSON LineString; coordinates are {@code [longitude, latitude]} pairs.
 */
@Value
public class GeoJsonLineString {
    String type = "LineString";
    List<List<Double>> coordinates;

    public static GeoJsonLineString of(RoutePolyline polyline) {
        List<List<Double>> coordinates = new ArrayList<>(polyline.getPoints().size());
        for (GeoPoint point : polyline.getPoints()) {
            coordinates.add(List.of(point.getLongitude(), point.getLatitude()));
        }
        return new GeoJsonLineString(coordinates);
    }
}
