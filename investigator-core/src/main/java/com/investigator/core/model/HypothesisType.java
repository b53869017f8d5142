package com.investigator.core.model;

/**
 * Kinds of causal explanation. Keys the recommended-action table.
 */
public enum HypothesisType {
    CONFIGURATION_REGRESSION("A recent configuration change caused the regression"),
    CAPACITY_EXHAUSTION("Resource capacity is exhausted under sustained demand"),
    SCALING_CEILING("Scaling has reached its configured maximum or a service quota"),
    SCALING_MISCONFIGURED("Scaling is disabled or cannot react to current demand"),
    TRAFFIC_SURGE("Demand rose far above its usual level"),
    RUNAWAY_CONSUMER("A single consumer accounts for most of the load"),
    DEPENDENCY_OUTAGE("A dependency is unhealthy or unreachable"),
    NETWORK_PATH_BLOCKED("No dependency is reachable; the network path is blocked"),
    PERMISSION_DENIED("Required permissions are missing or were revoked"),
    DEPLOYMENT_REGRESSION("A recent deployment introduced errors"),
    ELEVATED_ERROR_RATE("Error rate is elevated without an obvious trigger"),
    REQUEST_THROTTLING("Requests are being throttled"),
    REPLICATION_LAG("Replicas are lagging behind the primary"),
    COST_SPIKE("Spend is rising sharply"),
    RESOURCE_UNAVAILABLE("The resource itself is not in a running state"),
    
    /**
     * Candidate cause proposed by the language model and validated against cited facts.
     */
    MODEL_PROPOSED("Cause proposed by model analysis of the collected facts");
    
    private final String summary;
    
    HypothesisType(String summary) {
        this.summary = summary;
    }
    
    public String summary() {
        return summary;
    }
}
