package com.investigator.core.model;

import java.time.Duration;

/**
 * Structured context for an incident: what resource, which metric, which environment,
 * and how far back to look. Supplied as caller hints or extracted from the query.
 * 
 * Invariants:
 * - scope is never null (defaults to "production")
 * - lookbackWindow is positive
 */
public record IncidentContext(
    String resourceType,
    String resourceId,
    String metric,
    String scope,
    Duration lookbackWindow
) {
    public static final String DEFAULT_SCOPE = "production";
    public static final Duration DEFAULT_LOOKBACK = Duration.ofHours(1);
    
    public IncidentContext {
        if (scope == null || scope.isBlank()) {
            scope = DEFAULT_SCOPE;
        }
        if (lookbackWindow == null) {
            lookbackWindow = DEFAULT_LOOKBACK;
        }
        if (lookbackWindow.isNegative() || lookbackWindow.isZero()) {
            throw new IllegalArgumentException("lookbackWindow must be positive: " + lookbackWindow);
        }
    }
    
    public static IncidentContext empty() {
        return new IncidentContext(null, null, null, DEFAULT_SCOPE, DEFAULT_LOOKBACK);
    }
    
    public ResourceRef resource() {
        return ResourceRef.of(resourceType, resourceId);
    }
    
    /**
     * Fill every field this context leaves unset from {@code fallback}.
     * Values already present here win.
     */
    public IncidentContext orElse(IncidentContext fallback) {
        if (fallback == null) {
            return this;
        }
        return new IncidentContext(
            firstPresent(resourceType, fallback.resourceType),
            firstPresent(resourceId, fallback.resourceId),
            firstPresent(metric, fallback.metric),
            DEFAULT_SCOPE.equals(scope) ? fallback.scope : scope,
            DEFAULT_LOOKBACK.equals(lookbackWindow) ? fallback.lookbackWindow : lookbackWindow
        );
    }
    
    private static String firstPresent(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private String resourceType;
        private String resourceId;
        private String metric;
        private String scope = DEFAULT_SCOPE;
        private Duration lookbackWindow = DEFAULT_LOOKBACK;
        
        public Builder resourceType(String resourceType) {
            this.resourceType = resourceType;
            return this;
        }
        
        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }
        
        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }
        
        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }
        
        public Builder lookbackWindow(Duration lookbackWindow) {
            this.lookbackWindow = lookbackWindow;
            return this;
        }
        
        public IncidentContext build() {
            return new IncidentContext(resourceType, resourceId, metric, scope, lookbackWindow);
        }
    }
}
