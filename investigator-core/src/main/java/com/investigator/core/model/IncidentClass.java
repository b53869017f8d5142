package com.investigator.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Universal failure modes. Every incident, whatever the resource type,
 * is classified into one of these before planning.
 */
public enum IncidentClass {
    
    RESOURCE_SATURATION("Resource exhaustion: CPU, memory, disk or connection limits reached"),
    
    LOAD_SPIKE("Sudden increase in traffic or request volume"),
    
    CONFIGURATION_DRIFT("Configuration changed from a known-good state"),
    
    DEPENDENCY_FAILURE("An upstream or downstream dependency is failing or unreachable"),
    
    SCALING_FAILURE("Auto-scaling did not add or remove capacity as expected"),
    
    NETWORK_CONNECTIVITY("Network path, DNS, routing or firewall problems"),
    
    PERMISSION_FAILURE("Access denied by identity, role or resource policy"),
    
    COST_ANOMALY("Unexpected increase in spend"),
    
    DEPLOYMENT_REGRESSION("A new release or rollout introduced the problem"),
    
    AVAILABILITY_LOSS("Service or resource is down or unhealthy"),
    
    PERFORMANCE_DEGRADATION("Latency or throughput worse than normal"),
    
    DATA_INCONSISTENCY("Replication lag, stale or inconsistent data");
    
    private final String description;
    
    IncidentClass(String description) {
        this.description = description;
    }
    
    public String description() {
        return description;
    }
    
    /**
     * Lowercase wire name, e.g. {@code resource_saturation}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    /**
     * Parse a wire name or enum constant name, ignoring case and surrounding whitespace.
     * 
     * @return the class, or empty when the name is unknown
     */
    public static Optional<IncidentClass> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (IncidentClass value : values()) {
            if (value.name().equals(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
