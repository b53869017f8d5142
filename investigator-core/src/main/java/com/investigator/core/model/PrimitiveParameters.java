package com.investigator.core.model;

import com.investigator.core.exception.ParameterContractException;
import java.time.Duration;

/**
 * Parameters bound to a single primitive invocation.
 * Resource type, id and metric may be absent; a primitive that needs them
 * reports a failed fact at execution time.
 * 
 * Invariants:
 * - resource is never null (parts of it may be unknown)
 * - lookbackWindow is positive
 */
public record PrimitiveParameters(
    ResourceRef resource,
    String metric,
    Duration lookbackWindow,
    String scope
) {
    public PrimitiveParameters {
        if (resource == null) {
            throw new ParameterContractException("resource", "must not be null");
        }
        if (lookbackWindow == null || lookbackWindow.isNegative() || lookbackWindow.isZero()) {
            throw new ParameterContractException("lookbackWindow", "must be positive, was " + lookbackWindow);
        }
    }
    
    /**
     * Bind parameters from classification context, falling back to a strategy's default metric.
     */
    public static PrimitiveParameters fromContext(IncidentContext context, String defaultMetric) {
        String metric = context.metric() != null && !context.metric().isBlank()
            ? context.metric()
            : defaultMetric;
        return new PrimitiveParameters(
            context.resource(),
            metric,
            context.lookbackWindow(),
            context.scope()
        );
    }
    
    public boolean hasMetric() {
        return metric != null && !metric.isBlank();
    }
}
