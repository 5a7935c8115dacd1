package com.example.fuel.station;

import lombok.Value;

@Value
public class CatalogCounts {
    long total;
    long geocoded;

    public long getPending() {
        return total - geocoded;
    }
}
