package com.parkingrules.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Parking Rules Engine.
 *
 * Annotations Explained:
 * - @SpringBootApplication: Combines @Configuration, @EnableAutoConfiguration, @ComponentScan
 * - @EnableAsync: Runs manual re-ingestion off the request thread
 * - @EnableScheduling: Enables the nightly ingestion cron
 *
 * Flow:
 * 1. Street centerlines, regulations, meters, parcels and sweeping schedules are loaded
 * 2. Regulations are matched to curb sides and merged into per-side rule sets
 * 3. The result is published as an immutable snapshot and persisted to PostGIS
 * 4. Legality queries evaluate a side's rules for a given stay
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class ParkingRulesApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParkingRulesApplication.class, args);
    }
}
