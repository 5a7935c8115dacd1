package com.example.fuel.ingest;

import com.example.fuel.station.FuelStation;
import lombok.Value;

/**
 * One station as it comes out of the price CSV, after duplicate rows are merged.
 */
@Value
public class StationRecord {
    long opisTruckstopId;
    String truckstopName;
    String address;
    String city;
    String state;
    long rackId;
    double retailPrice;

    public FuelStation toEntity() {
        return new FuelStation(opisTruckstopId, truckstopName, address, city, state, rackId, retailPrice);
    }
}
