package com.agrivision.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AgriVision Ingestion Service
 *
 * Receives soil moisture, temperature, humidity and camera readings from field devices via HTTP
 * and stores them in MongoDB, one collection per field.
 */
@SpringBootApplication
public class IngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestionApplication.class, args);
    }
}
