package com.example.fuel.station;

import com.example.fuel.geo.GeoPoint;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Catalog row for a truck stop, with its best retail price and, once geocoded, its coordinates.
 */
@Entity
@Table(name = "fuel_stations",
        uniqueConstraints = @UniqueConstraint(columnNames = {"truckstop_name", "address", "city", "state"}),
        indexes = {
                @Index(columnList = "state, geocoded"),
                @Index(columnList = "city, state"),
                @Index(columnList = "retail_price")
        })
@Getter
@Setter
@NoArgsConstructor
public class FuelStation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "opis_truckstop_id", nullable = false)
    private long opisTruckstopId;

    @Column(name = "truckstop_name", nullable = false, length = 200)
    private String truckstopName;

    @Column(nullable = false, length = 200)
    private String address;

    @Column(nullable = false, length = 100)
    private String city;

    @Column(nullable = false, length = 2)
    private String state;

    @Column(name = "rack_id", nullable = false)
    private long rackId;

    @Column(name = "retail_price", nullable = false)
    private double retailPrice;

    private Double latitude;

    private Double longitude;

    @Column(nullable = false)
    private boolean geocoded;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public FuelStation(long opisTruckstopId, String truckstopName, String address, String city, String state,
                       long rackId, double retailPrice) {
        this.opisTruckstopId = opisTruckstopId;
        this.truckstopName = truckstopName;
        this.address = address;
        this.city = city;
        this.state = state;
        this.rackId = rackId;
        this.retailPrice = retailPrice;
    }

    public Station toSnapshot() {
        boolean resolved = geocoded && latitude != null && longitude != null;
        return Station.builder()
                .id(id == null ? 0L : id)
                .name(truckstopName)
                .address(address)
                .city(city)
                .state(state)
                .price(retailPrice)
                .location(resolved ? GeoPoint.of(latitude, longitude) : null)
                .resolved(resolved)
                .build();
    }

    @Override
    public String toString() {
        return truckstopName + " - " + city + ", " + state;
    }
}
