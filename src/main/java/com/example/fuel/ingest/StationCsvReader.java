package com.example.fuel.ingest;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the OPIS truck-stop price export.
 *
 * <p>Expected columns: {@code opis_truckstop_id, truckstop_name, address, city, state, rack_id,
 * retail_price}. Header names are trimmed, lower-cased and have spaces replaced by underscores
 * before lookup. Rows sharing (name, address, city, state) collapse into one record with the lowest
 * retail price and the id and rack id of the first row seen.</p>
 */
@Slf4j
public class StationCsvReader {

    private final CsvMapper csvMapper = new CsvMapper();

    public List<StationRecord> read(Path csvPath) throws IOException {
        log.info("Loading station CSV from {}", csvPath);
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<StationRecord> read(Reader reader) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        Map<List<String>, StationRecord> grouped = new LinkedHashMap<>();
        int rows = 0;
        int skipped = 0;

        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(reader)) {
            while (it.hasNext()) {
                Map<String, String> row = normalizeKeys(it.next());
                rows++;
                StationRecord record;
                try {
                    record = toRecord(row);
                } catch (IllegalArgumentException e) {
                    skipped++;
                    log.warn("Skipping CSV row {}: {}", rows, e.getMessage());
                    continue;
                }
                List<String> key = List.of(record.getTruckstopName(), record.getAddress(), record.getCity(), record.getState());
                grouped.merge(key, record, (kept, next) -> next.getRetailPrice() < kept.getRetailPrice()
                        ? new StationRecord(kept.getOpisTruckstopId(), kept.getTruckstopName(), kept.getAddress(),
                        kept.getCity(), kept.getState(), kept.getRackId(), next.getRetailPrice())
                        : kept);
            }
        }

        log.info("Read {} rows ({} skipped), reduced to {} unique stations", rows, skipped, grouped.size());
        return new ArrayList<>(grouped.values());
    }

    private static Map<String, String> normalizeKeys(Map<String, String> row) {
        Map<String, String> normalized = new HashMap<>();
        for (Map.Entry<String, String> entry : row.entrySet()) {
            String key = entry.getKey().trim().toLowerCase(Locale.ROOT).replace(' ', '_');
            normalized.put(key, entry.getValue() == null ? "" : entry.getValue().trim());
        }
        return normalized;
    }

    private static StationRecord toRecord(Map<String, String> row) {
        return new StationRecord(
                parseLong(row, "opis_truckstop_id"),
                required(row, "truckstop_name"),
                required(row, "address"),
                required(row, "city"),
                required(row, "state").toUpperCase(Locale.ROOT),
                parseLong(row, "rack_id"),
                parseDouble(row, "retail_price"));
    }

    private static String required(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("missing " + column);
        }
        return value;
    }

    private static long parseLong(Map<String, String> row, String column) {
        String value = required(row, column);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(column + " is not an integer: " + value, e);
        }
    }

    private static double parseDouble(Map<String, String> row, String column) {
        String value = required(row, column);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(column + " is not a number: " + value, e);
        }
    }
}
