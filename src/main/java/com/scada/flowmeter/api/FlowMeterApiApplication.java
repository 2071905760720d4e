package com.scada.flowmeter.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main entry point for the SCADA flow meter ingestion and retrieval service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FlowMeterApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(FlowMeterApiApplication.class, args);
    }
}
