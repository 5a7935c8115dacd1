package com.example.fuel.config;

import com.example.fuel.planner.CorridorFilter;
import com.example.fuel.planner.GreedyFallback;
import com.example.fuel.planner.PlanAssembler;
import com.example.fuel.planner.RefuelPlanner;
import com.example.fuel.planner.VehicleProfile;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(FuelRouteProperties.class)
public class AppConfig {

    @Bean
    public RestTemplate restTemplate(FuelRouteProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getRouting().getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getRouting().getReadTimeout().toMillis());
        return new RestTemplate(requestFactory);
    }

    @Bean
    public VehicleProfile vehicleProfile(FuelRouteProperties properties) {
        FuelRouteProperties.Vehicle vehicle = properties.getVehicle();
        return new VehicleProfile(vehicle.getRangeMiles(), vehicle.getMilesPerGallon());
    }

    @Bean
    public CorridorFilter corridorFilter(FuelRouteProperties properties) {
        return new CorridorFilter(properties.getCorridor().getHalfWidthMiles());
    }

    @Bean
    public RefuelPlanner refuelPlanner(FuelRouteProperties properties) {
        FuelRouteProperties.Planner planner = properties.getPlanner();
        return new RefuelPlanner(new GreedyFallback(planner.getGreedyBufferMiles()), planner.getMaxCandidateStations());
    }

    @Bean
    public PlanAssembler planAssembler() {
        return new PlanAssembler();
    }
}
