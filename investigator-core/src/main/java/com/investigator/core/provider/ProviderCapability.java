package com.investigator.core.provider;

import java.util.EnumSet;
import java.util.Set;

/**
 * Read capabilities a resource provider may advertise.
 * Primitives declare which ones they need.
 */
public enum ProviderCapability {
    METRIC_SERIES,
    CHANGE_HISTORY,
    DEPENDENCY_GRAPH,
    CONFIGURATION,
    CONNECTIVITY,
    SCALING_STATE,
    QUOTAS,
    PERMISSIONS,
    TOP_CONSUMERS;
    
    /**
     * The capabilities every provider must support.
     */
    public static Set<ProviderCapability> baseline() {
        return EnumSet.of(METRIC_SERIES, CHANGE_HISTORY, DEPENDENCY_GRAPH, CONFIGURATION, CONNECTIVITY);
    }
}
