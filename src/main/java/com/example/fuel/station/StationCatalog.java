package com.example.fuel.station;

import com.example.fuel.geo.GeoPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Station catalog: read-only snapshots for planning, bulk writes for the ingestion job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StationCatalog {

    private final FuelStationRepository repository;

    /**
     * All stations that have coordinates. Order is unspecified.
     */
    @Transactional(readOnly = true)
    public List<Station> resolvedStations() {
        List<FuelStation> rows = repository.findResolved();
        List<Station> snapshots = new ArrayList<>(rows.size());
        for (FuelStation row : rows) {
            snapshots.add(row.toSnapshot());
        }
        return List.copyOf(snapshots);
    }

    @Transactional(readOnly = true)
    public CatalogCounts counts() {
        return new CatalogCounts(repository.count(), repository.countByGeocodedTrue());
    }

    @Transactional(readOnly = true)
    public List<CityState> pendingLocations() {
        return repository.findPendingLocations();
    }

    /**
     * Replaces the whole catalog with {@code stations}.
     */
    @Transactional
    public int replaceAll(Collection<FuelStation> stations) {
        repository.deleteAllInBatch();
        repository.saveAll(stations);
        log.info("Catalog replaced with {} stations", stations.size());
        return stations.size();
    }

    /**
     * Writes resolved coordinates onto every still-ungeocoded station of each location.
     *
     * @return number of station rows updated
     */
    @Transactional
    public int applyCoordinates(Map<CityState, GeoPoint> coordinates) {
        Instant now = Instant.now();
        int updated = 0;
        for (Map.Entry<CityState, GeoPoint> entry : coordinates.entrySet()) {
            CityState location = entry.getKey();
            GeoPoint point = entry.getValue();
            updated += repository.markGeocoded(location.getCity(), location.getState(),
                    point.getLatitude(), point.getLongitude(), now);
        }
        return updated;
    }
}
