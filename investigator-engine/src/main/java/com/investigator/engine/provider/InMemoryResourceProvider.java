package com.investigator.engine.provider;

import com.investigator.core.model.ResourceRef;
import com.investigator.core.provider.ChangeEvent;
import com.investigator.core.provider.ConnectivityResult;
import com.investigator.core.provider.ConsumerUsage;
import com.investigator.core.provider.MetricId;
import com.investigator.core.provider.MetricPoint;
import com.investigator.core.provider.MetricSeries;
import com.investigator.core.provider.PermissionCheck;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.QuotaUsage;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.core.provider.ScalingState;
import com.investigator.core.provider.TimeWindow;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resource provider backed by seeded in-memory data.
 * For demonstration and testing purposes.
 * 
 * Data is keyed by resource id. Metric series are keyed by provider metric name
 * and filtered to the requested window. Reading data that was never seeded
 * raises a resource-scoped {@link ProviderException}, except metric series and
 * change history, which read as empty.
 */
public class InMemoryResourceProvider implements ResourceProvider {
    
    private final Set<ProviderCapability> capabilities;
    private final Map<String, Map<String, List<MetricPoint>>> series;
    private final Map<String, List<ChangeEvent>> changes;
    private final Map<String, List<ResourceRef>> dependencies;
    private final Map<String, Map<String, String>> configuration;
    private final Map<String, Map<String, ConnectivityResult>> connectivity;
    private final Map<String, ScalingState> scaling;
    private final Map<String, List<QuotaUsage>> quotas;
    private final Map<String, Map<String, PermissionCheck>> permissions;
    private final Map<String, List<ConsumerUsage>> consumers;
    
    private InMemoryResourceProvider(Builder builder) {
        this.capabilities = Collections.unmodifiableSet(EnumSet.copyOf(builder.capabilities));
        this.series = builder.series;
        this.changes = builder.changes;
        this.dependencies = builder.dependencies;
        this.configuration = builder.configuration;
        this.connectivity = builder.connectivity;
        this.scaling = builder.scaling;
        this.quotas = builder.quotas;
        this.permissions = builder.permissions;
        this.consumers = builder.consumers;
    }
    
    /**
     * A provider with every capability and no data.
     */
    public static InMemoryResourceProvider empty() {
        return builder().build();
    }
    
    @Override
    public Set<ProviderCapability> capabilities() {
        return capabilities;
    }
    
    @Override
    public MetricSeries readMetricSeries(ResourceRef resource, MetricId metric, TimeWindow window) {
        List<MetricPoint> points = series.getOrDefault(resource.id(), Map.of())
            .getOrDefault(metric.name(), List.of())
            .stream()
            .filter(point -> window.contains(point.timestamp()))
            .toList();
        return new MetricSeries(metric, points);
    }
    
    @Override
    public List<ChangeEvent> readRecentChanges(ResourceRef resource, TimeWindow window) {
        return changes.getOrDefault(resource.id(), List.of()).stream()
            .filter(event -> window.contains(event.occurredAt()))
            .toList();
    }
    
    @Override
    public List<ResourceRef> readDependencies(ResourceRef resource) throws ProviderException {
        return require(dependencies, resource, "dependencies");
    }
    
    @Override
    public Map<String, String> readConfiguration(ResourceRef resource) throws ProviderException {
        return require(configuration, resource, "configuration");
    }
    
    @Override
    public ConnectivityResult checkConnectivity(ResourceRef from, ResourceRef to) throws ProviderException {
        ConnectivityResult result = connectivity.getOrDefault(from.id(), Map.of()).get(to.id());
        if (result == null) {
            throw ProviderException.resource(ProviderException.NO_DATA,
                "No connectivity result from " + from + " to " + to);
        }
        return result;
    }
    
    @Override
    public ScalingState readScalingState(ResourceRef resource) throws ProviderException {
        return require(scaling, resource, "scaling state");
    }
    
    @Override
    public List<QuotaUsage> readQuotas(ResourceRef resource) throws ProviderException {
        return require(quotas, resource, "quotas");
    }
    
    @Override
    public List<PermissionCheck> checkPermissions(ResourceRef resource, List<String> actions) throws ProviderException {
        Map<String, PermissionCheck> seeded = require(permissions, resource, "permissions");
        List<PermissionCheck> checks = new ArrayList<>();
        for (String action : actions) {
            PermissionCheck check = seeded.get(action);
            checks.add(check != null ? check : new PermissionCheck(action, true, null));
        }
        return checks;
    }
    
    @Override
    public List<ConsumerUsage> readTopConsumers(ResourceRef resource, MetricId metric, TimeWindow window, int limit)
            throws ProviderException {
        
        return require(consumers, resource, "top consumers").stream()
            .sorted(Comparator.comparingDouble(ConsumerUsage::value).reversed())
            .limit(limit)
            .toList();
    }
    
    private static <T> T require(Map<String, T> data, ResourceRef resource, String what) throws ProviderException {
        T value = data.get(resource.id());
        if (value == null) {
            throw ProviderException.resource(ProviderException.RESOURCE_NOT_FOUND,
                "No " + what + " for " + resource);
        }
        return value;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private Set<ProviderCapability> capabilities = EnumSet.allOf(ProviderCapability.class);
        private final Map<String, Map<String, List<MetricPoint>>> series = new HashMap<>();
        private final Map<String, List<ChangeEvent>> changes = new HashMap<>();
        private final Map<String, List<ResourceRef>> dependencies = new HashMap<>();
        private final Map<String, Map<String, String>> configuration = new HashMap<>();
        private final Map<String, Map<String, ConnectivityResult>> connectivity = new HashMap<>();
        private final Map<String, ScalingState> scaling = new HashMap<>();
        private final Map<String, List<QuotaUsage>> quotas = new HashMap<>();
        private final Map<String, Map<String, PermissionCheck>> permissions = new HashMap<>();
        private final Map<String, List<ConsumerUsage>> consumers = new HashMap<>();
        
        public Builder capabilities(Set<ProviderCapability> capabilities) {
            this.capabilities = EnumSet.noneOf(ProviderCapability.class);
            this.capabilities.addAll(capabilities);
            return this;
        }
        
        public Builder withoutCapability(ProviderCapability capability) {
            capabilities.remove(capability);
            return this;
        }
        
        public Builder point(String resourceId, String metricName, Instant timestamp, double value) {
            series.computeIfAbsent(resourceId, key -> new HashMap<>())
                .computeIfAbsent(metricName, key -> new ArrayList<>())
                .add(new MetricPoint(timestamp, value));
            return this;
        }
        
        public Builder series(String resourceId, String metricName, List<MetricPoint> points) {
            series.computeIfAbsent(resourceId, key -> new HashMap<>())
                .computeIfAbsent(metricName, key -> new ArrayList<>())
                .addAll(points);
            return this;
        }
        
        public Builder change(String resourceId, ChangeEvent event) {
            changes.computeIfAbsent(resourceId, key -> new ArrayList<>()).add(event);
            return this;
        }
        
        public Builder dependencies(String resourceId, List<ResourceRef> refs) {
            dependencies.put(resourceId, List.copyOf(refs));
            return this;
        }
        
        public Builder configuration(String resourceId, Map<String, String> values) {
            configuration.put(resourceId, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
            return this;
        }
        
        public Builder connectivity(String fromId, ConnectivityResult result) {
            connectivity.computeIfAbsent(fromId, key -> new HashMap<>()).put(result.to().id(), result);
            return this;
        }
        
        public Builder scaling(String resourceId, ScalingState state) {
            scaling.put(resourceId, state);
            return this;
        }
        
        public Builder quotas(String resourceId, List<QuotaUsage> usage) {
            quotas.put(resourceId, List.copyOf(usage));
            return this;
        }
        
        public Builder permission(String resourceId, PermissionCheck check) {
            permissions.computeIfAbsent(resourceId, key -> new LinkedHashMap<>()).put(check.action(), check);
            return this;
        }
        
        public Builder consumers(String resourceId, List<ConsumerUsage> usage) {
            consumers.put(resourceId, List.copyOf(usage));
            return this;
        }
        
        public InMemoryResourceProvider build() {
            return new InMemoryResourceProvider(this);
        }
    }
}
