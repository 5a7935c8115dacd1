package com.example.fuel;

import com.example.fuel.routing.RoutingService;
import com.example.fuel.service.RouteService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Application context")
class FuelRouteApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RouteService routeService;

    @Autowired
    private RoutingService routingService;

    @Test
    @DisplayName("Context wires the planning pipeline")
    void testContextLoads() {
        assertNotNull(routeService);
        assertNotNull(routingService);
    }

    @Test
    @DisplayName("Health endpoint reports an empty catalog")
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.version").value("2.0"))
                .andExpect(jsonPath("$.database.total_stations").value(0));
    }
}
