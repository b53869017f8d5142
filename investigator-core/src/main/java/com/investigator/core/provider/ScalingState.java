package com.investigator.core.provider;

import java.util.List;

/**
 * Auto-scaling configuration and current capacity of a resource.
 */
public record ScalingState(
    boolean enabled,
    int minCapacity,
    int maxCapacity,
    int desiredCapacity,
    int currentCapacity,
    List<String> recentActivities
) {
    public ScalingState {
        recentActivities = recentActivities == null ? List.of() : List.copyOf(recentActivities);
    }
    
    public boolean atMaxCapacity() {
        return enabled && currentCapacity >= maxCapacity;
    }
}
