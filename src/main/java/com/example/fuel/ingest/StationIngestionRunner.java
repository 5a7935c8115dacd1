package com.example.fuel.ingest;

import com.example.fuel.config.FuelRouteProperties;
import com.example.fuel.station.CatalogCounts;
import com.example.fuel.station.FuelStation;
import com.example.fuel.station.StationCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Imports the price CSV into the catalog and geocodes it.
 *
 * <p>Command-line options override configuration: {@code --csv=<path>}, {@code --skip-geocoding}
 * (load only) and {@code --geocode-only} (keep the catalog, geocode pending stations).</p>
 */
@Slf4j
public class StationIngestionRunner implements ApplicationRunner {

    private final StationCsvReader reader;
    private final StationGeocodingJob geocodingJob;
    private final StationCatalog catalog;
    private final FuelRouteProperties.Ingest settings;

    public StationIngestionRunner(StationCsvReader reader, StationGeocodingJob geocodingJob, StationCatalog catalog,
                                  FuelRouteProperties.Ingest settings) {
        this.reader = reader;
        this.geocodingJob = geocodingJob;
        this.catalog = catalog;
        this.settings = settings;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        boolean geocodeOnly = settings.isGeocodeOnly() || args.containsOption("geocode-only");
        boolean skipGeocoding = settings.isSkipGeocoding() || args.containsOption("skip-geocoding");
        Path csvPath = Path.of(args.containsOption("csv") ? args.getOptionValues("csv").get(0) : settings.getCsvPath());

        log.info("Starting fuel station import");
        if (geocodeOnly) {
            log.info("Skipping CSV import (geocode-only mode)");
            if (catalog.counts().getTotal() == 0) {
                log.error("No stations in catalog; run the import without geocode-only first");
                return;
            }
        } else {
            List<StationRecord> records = reader.read(csvPath);
            List<FuelStation> stations = new ArrayList<>(records.size());
            for (StationRecord record : records) {
                stations.add(record.toEntity());
            }
            catalog.replaceAll(stations);
        }

        if (skipGeocoding) {
            log.info("Skipping geocoding (skip-geocoding mode)");
        } else {
            geocodingJob.run();
        }

        CatalogCounts counts = catalog.counts();
        log.info("Import complete: {} stations, {} geocoded, {} pending",
                counts.getTotal(), counts.getGeocoded(), counts.getPending());
    }
}
