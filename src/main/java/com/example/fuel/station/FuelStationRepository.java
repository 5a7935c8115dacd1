package com.example.fuel.station;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface FuelStationRepository extends JpaRepository<FuelStation, Long> {

    @Query("select s from FuelStation s where s.geocoded = true and s.latitude is not null and s.longitude is not null")
    List<FuelStation> findResolved();

    long countByGeocodedTrue();

    @Query("select distinct new com.example.fuel.station.CityState(s.city, s.state) from FuelStation s "
            + "where s.geocoded = false order by s.state, s.city")
    List<CityState> findPendingLocations();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update FuelStation s set s.latitude = :latitude, s.longitude = :longitude, s.geocoded = true, "
            + "s.updatedAt = :now where s.city = :city and s.state = :state and s.geocoded = false")
    int markGeocoded(@Param("city") String city, @Param("state") String state,
                     @Param("latitude") double latitude, @Param("longitude") double longitude,
                     @Param("now") Instant now);
}
