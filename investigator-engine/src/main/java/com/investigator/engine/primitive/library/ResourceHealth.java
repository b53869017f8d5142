package com.investigator.engine.primitive.library;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a lifecycle status out of a configuration map.
 */
final class ResourceHealth {
    
    static final Set<String> STATUS_KEYS = Set.of("status", "state", "DBInstanceStatus", "State", "Status", "health");
    static final Set<String> HEALTHY = Set.of(
        "available", "running", "active", "healthy", "ok", "inservice", "in-service", "ready", "succeeded");
    
    private ResourceHealth() {
    }
    
    static Optional<String> status(Map<String, String> configuration) {
        return configuration.entrySet().stream()
            .filter(entry -> STATUS_KEYS.contains(entry.getKey()))
            .map(Map.Entry::getValue)
            .filter(value -> value != null && !value.isBlank())
            .sorted()
            .findFirst();
    }
    
    static boolean isHealthy(String status) {
        return HEALTHY.contains(status.trim().toLowerCase(Locale.ROOT));
    }
}
