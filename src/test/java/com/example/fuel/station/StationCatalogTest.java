package com.example.fuel.station;

import com.example.fuel.geo.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import(StationCatalog.class)
@DisplayName("Station catalog")
class StationCatalogTest {

    @Autowired
    private StationCatalog catalog;

    @Autowired
    private FuelStationRepository repository;

    @Test
    @DisplayName("Fresh import is entirely pending")
    void testReplaceAll() {
        catalog.replaceAll(sample());

        CatalogCounts counts = catalog.counts();
        assertEquals(4, counts.getTotal());
        assertEquals(0, counts.getGeocoded());
        assertEquals(4, counts.getPending());
        assertTrue(catalog.resolvedStations().isEmpty());
    }

    @Test
    @DisplayName("Pending locations are distinct and ordered by state, then city")
    void testPendingLocations() {
        catalog.replaceAll(sample());

        assertEquals(List.of(
                new CityState("Tulsa", "OK"),
                new CityState("Amarillo", "TX"),
                new CityState("Dallas", "TX")), catalog.pendingLocations());
    }

    @Test
    @DisplayName("Coordinates apply to every station of a location")
    void testApplyCoordinates() {
        catalog.replaceAll(sample());

        int updated = catalog.applyCoordinates(Map.of(new CityState("Amarillo", "TX"), GeoPoint.of(35.2, -101.8)));

        assertEquals(2, updated);
        assertEquals(2, catalog.counts().getGeocoded());
        List<Station> resolved = catalog.resolvedStations();
        assertEquals(2, resolved.size());
        for (Station station : resolved) {
            assertTrue(station.isResolved());
            assertEquals(GeoPoint.of(35.2, -101.8), station.getLocation());
            assertEquals("Amarillo", station.getCity());
        }
        assertEquals(List.of(new CityState("Tulsa", "OK"), new CityState("Dallas", "TX")), catalog.pendingLocations());
    }

    @Test
    @DisplayName("Re-import replaces the previous catalog")
    void testReimport() {
        catalog.replaceAll(sample());
        catalog.replaceAll(List.of(new FuelStation(9, "ONLY", "Addr", "Tulsa", "OK", 1, 3.0)));

        assertEquals(1, repository.count());
    }

    @Test
    @DisplayName("Snapshots carry the price and the database id")
    void testSnapshot() {
        catalog.replaceAll(List.of(new FuelStation(9, "ONLY", "Addr", "Tulsa", "OK", 1, 3.05)));
        catalog.applyCoordinates(Map.of(new CityState("Tulsa", "OK"), GeoPoint.of(36.15, -95.99)));

        Station station = catalog.resolvedStations().get(0);
        assertEquals("ONLY", station.getName());
        assertEquals(3.05, station.getPrice(), 0.0);
        assertTrue(station.getId() > 0);
    }

    private static List<FuelStation> sample() {
        return List.of(
                new FuelStation(1, "PILOT #1", "I-40 EXIT 1", "Amarillo", "TX", 10, 3.40),
                new FuelStation(2, "LOVES #2", "I-40 EXIT 9", "Amarillo", "TX", 11, 3.10),
                new FuelStation(3, "QT #3", "I-35 EXIT 4", "Dallas", "TX", 12, 3.20),
                new FuelStation(4, "QT #4", "I-44 EXIT 2", "Tulsa", "OK", 13, 3.00));
    }
}
