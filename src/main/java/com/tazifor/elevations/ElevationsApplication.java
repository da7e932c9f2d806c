package com.tazifor.elevations;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Elevations API - H3 cell elevations with deduplicated backfill
 *
 * - Cells, coordinates or polygons in, elevations out
 * - Elevations read from Aerospike in one batch per request
 * - Missing cells sent to the populator over Kafka, at most once per TTL window
 */
@SpringBootApplication
@EnableScheduling
public class ElevationsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ElevationsApplication.class, args);
    }
}
