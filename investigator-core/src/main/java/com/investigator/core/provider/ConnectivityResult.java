package com.investigator.core.provider;

import com.investigator.core.model.ResourceRef;
import java.time.Duration;

/**
 * Result of probing the network path between two resources.
 */
public record ConnectivityResult(
    ResourceRef from,
    ResourceRef to,
    boolean reachable,
    Duration latency,
    String detail
) {
    public static ConnectivityResult reachable(ResourceRef from, ResourceRef to, Duration latency) {
        return new ConnectivityResult(from, to, true, latency, null);
    }
    
    public static ConnectivityResult unreachable(ResourceRef from, ResourceRef to, String detail) {
        return new ConnectivityResult(from, to, false, null, detail);
    }
}
