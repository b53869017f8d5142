package com.investigator.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application entry point for the Incident Investigator.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class InvestigatorApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(InvestigatorApplication.class, args);
    }
}
