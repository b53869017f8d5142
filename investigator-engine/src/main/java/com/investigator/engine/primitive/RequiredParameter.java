package com.investigator.engine.primitive;

import com.investigator.core.model.PrimitiveParameters;

/**
 * Optional parameter fields a primitive may require.
 */
public enum RequiredParameter {
    RESOURCE_TYPE,
    RESOURCE_ID,
    METRIC;
    
    public boolean isPresentIn(PrimitiveParameters parameters) {
        return switch (this) {
            case RESOURCE_TYPE -> parameters.resource().hasType();
            case RESOURCE_ID -> parameters.resource().hasId();
            case METRIC -> parameters.hasMetric();
        };
    }
    
    public String fieldName() {
        return switch (this) {
            case RESOURCE_TYPE -> "resource_type";
            case RESOURCE_ID -> "resource_id";
            case METRIC -> "metric";
        };
    }
}
