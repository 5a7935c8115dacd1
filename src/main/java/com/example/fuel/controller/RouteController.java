package com.example.fuel.controller;

import com.example.fuel.model.HealthResponse;
import com.example.fuel.model.RouteRequest;
import com.example.fuel.model.RouteResponse;
import com.example.fuel.service.RouteService;
import com.example.fuel.station.CatalogCounts;
import com.example.fuel.station.StationCatalog;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RouteController {

    private final RouteService routeService;
    private final StationCatalog stationCatalog;

    @PostMapping({"/route", "/route/"})
    public ResponseEntity<RouteResponse> planRoute(@Valid @RequestBody RouteRequest request) {
        return ResponseEntity.ok(routeService.planRoute(request.getStart(), request.getEnd()));
    }

    @GetMapping({"/health", "/health/"})
    public ResponseEntity<HealthResponse> health() {
        CatalogCounts counts = stationCatalog.counts();
        return ResponseEntity.ok(new HealthResponse("healthy", "fuel-route-optimizer", "2.0",
                new HealthResponse.Database(counts.getTotal(), counts.getGeocoded(), counts.getPending())));
    }
}
