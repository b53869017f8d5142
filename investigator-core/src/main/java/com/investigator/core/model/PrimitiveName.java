package com.investigator.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of diagnostic primitive names.
 * Adding a primitive means adding a constant here and a registry entry for its implementation.
 */
public enum PrimitiveName {
    ANALYZE_UTILIZATION,
    COMPARE_BASELINE,
    FIND_TOP_CONSUMERS,
    TRACE_DEPENDENCIES,
    CHECK_CONNECTIVITY,
    CHECK_RECENT_CHANGES,
    DIFF_CONFIGURATION,
    CHECK_SCALING_BEHAVIOR,
    CHECK_SCALING_LIMITS,
    CHECK_PERMISSIONS,
    ANALYZE_ERROR_RATE,
    ANALYZE_LATENCY,
    EVALUATE_THROTTLING,
    CHECK_REPLICATION_LAG,
    ANALYZE_COST_TREND,
    CHECK_DEPLOYMENT_STATUS,
    CHECK_RESOURCE_STATUS;
    
    /**
     * Lowercase wire name, e.g. {@code analyze_utilization}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    public static Optional<PrimitiveName> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
