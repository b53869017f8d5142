package com.investigator.core.provider;

/**
 * Provider-level metric identity, resolved from a logical metric name
 * (e.g. "cpu") and a resource type.
 */
public record MetricId(
    String namespace,
    String name,
    String unit
) {
    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
