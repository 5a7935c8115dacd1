package com.example.fuel.ingest;

import com.example.fuel.config.FuelRouteProperties;
import com.example.fuel.routing.Geocoder;
import com.example.fuel.station.StationCatalog;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the offline import; active only with {@code fuel.ingest.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(prefix = "fuel.ingest", name = "enabled", havingValue = "true")
public class IngestConfig {

    @Bean
    public StationCsvReader stationCsvReader() {
        return new StationCsvReader();
    }

    @Bean
    public StationGeocodingJob stationGeocodingJob(Geocoder geocoder, StationCatalog catalog, FuelRouteProperties properties) {
        FuelRouteProperties.Ingest ingest = properties.getIngest();
        return new StationGeocodingJob(
                geocoder,
                catalog,
                new RequestThrottle(ingest.getMinInterval()),
                new GeocodeRetryPolicy(ingest.getMaxRetries(), ingest.getInitialBackoff(), ingest.getBackoffMultiplier()),
                Sleeper.SYSTEM);
    }

    @Bean
    public StationIngestionRunner stationIngestionRunner(StationCsvReader reader, StationGeocodingJob job,
                                                         StationCatalog catalog, FuelRouteProperties properties) {
        return new StationIngestionRunner(reader, job, catalog, properties.getIngest());
    }
}
