package com.investigator.core.provider;

/**
 * Service quota or hard limit and its current usage.
 */
public record QuotaUsage(
    String name,
    double limit,
    double used
) {
    /**
     * Used share of the limit in percent. 100 when the limit is zero.
     */
    public double utilizationPercent() {
        return limit <= 0.0 ? 100.0 : used / limit * 100.0;
    }
}
