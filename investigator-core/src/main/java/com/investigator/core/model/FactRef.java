package com.investigator.core.model;

import java.util.UUID;

/**
 * Reference to a fact by execution and position.
 */
public record FactRef(
    UUID executionId,
    int index
) {
    public FactRef {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId is required");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
    }
}
