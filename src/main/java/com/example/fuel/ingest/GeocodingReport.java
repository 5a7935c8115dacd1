package com.example.fuel.ingest;

import com.example.fuel.geo.GeoPoint;
import com.example.fuel.station.CityState;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class GeocodingReport {
    Map<CityState, GeoPoint> resolved;
    /** Locations that stay ungeocoded after this run, with the reason. */
    List<String> failed;
    int updatedStations;
    int requestsSent;
}
