package com.investigator.core.provider;

import com.investigator.core.model.ResourceRef;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only, capability-scoped access to a cloud or platform.
 * 
 * Implementations exist per platform; the investigator never branches on which
 * one it has. Every method is a read. Implementations must not change state on
 * the target resources. Within one execution they are called by one step at a
 * time; a provider shared across concurrent investigations must be thread-safe.
 * 
 * Failures are reported as {@link ProviderException}. A global exception
 * aborts the investigation, any other fails only the calling primitive.
 */
public interface ResourceProvider {
    
    /**
     * Capabilities this provider supports. The baseline set is mandatory;
     * optional capabilities have default methods that report them unsupported.
     */
    default Set<ProviderCapability> capabilities() {
        return ProviderCapability.baseline();
    }
    
    MetricSeries readMetricSeries(ResourceRef resource, MetricId metric, TimeWindow window) throws ProviderException;
    
    List<ChangeEvent> readRecentChanges(ResourceRef resource, TimeWindow window) throws ProviderException;
    
    List<ResourceRef> readDependencies(ResourceRef resource) throws ProviderException;
    
    Map<String, String> readConfiguration(ResourceRef resource) throws ProviderException;
    
    ConnectivityResult checkConnectivity(ResourceRef from, ResourceRef to) throws ProviderException;
    
    // ========== Optional Capabilities ==========
    
    default ScalingState readScalingState(ResourceRef resource) throws ProviderException {
        throw ProviderException.unsupported(ProviderCapability.SCALING_STATE);
    }
    
    default List<QuotaUsage> readQuotas(ResourceRef resource) throws ProviderException {
        throw ProviderException.unsupported(ProviderCapability.QUOTAS);
    }
    
    default List<PermissionCheck> checkPermissions(ResourceRef resource, List<String> actions) throws ProviderException {
        throw ProviderException.unsupported(ProviderCapability.PERMISSIONS);
    }
    
    default List<ConsumerUsage> readTopConsumers(ResourceRef resource, MetricId metric, TimeWindow window, int limit)
            throws ProviderException {
        throw ProviderException.unsupported(ProviderCapability.TOP_CONSUMERS);
    }
}
