package com.example.fuel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FuelRouteApplication {

    public static void main(String[] args) {
        SpringApplication.run(FuelRouteApplication.class, args);
    }
}
