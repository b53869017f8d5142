package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.provider.ConsumerUsage;
import com.investigator.core.provider.MetricId;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.core.provider.TimeWindow;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.MetricCatalog;
import com.investigator.engine.primitive.Observations;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * What is consuming the resource? Ranks consumers by their share of the bound metric.
 */
public class FindTopConsumers implements DiagnosticPrimitive {
    
    static final int LIMIT = 5;
    
    private final MetricCatalog catalog;
    
    public FindTopConsumers(MetricCatalog catalog) {
        this.catalog = catalog;
    }
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.FIND_TOP_CONSUMERS;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.TOP_CONSUMERS);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws ProviderException {
        
        String logical = parameters.hasMetric() ? parameters.metric() : AnalyzeUtilization.DEFAULT_METRIC;
        MetricId metricId = catalog.resolve(parameters.resource().type(), logical);
        TimeWindow window = TimeWindow.ending(now, parameters.lookbackWindow());
        
        List<ConsumerUsage> consumers = provider.readTopConsumers(parameters.resource(), metricId, window, LIMIT)
            .stream()
            .sorted(Comparator.comparingDouble(ConsumerUsage::value).reversed().thenComparing(ConsumerUsage::consumer))
            .limit(LIMIT)
            .toList();
        double total = consumers.stream().mapToDouble(ConsumerUsage::value).sum();
        
        List<Object> ranked = new ArrayList<>();
        for (ConsumerUsage usage : consumers) {
            double share = total > 0.0 ? usage.value() / total * 100.0 : 0.0;
            ranked.add(Observations.create()
                .put("consumer", usage.consumer())
                .put("value", usage.value())
                .put("share_percent", share)
                .build());
        }
        
        Observations observations = Observations.create()
            .put("metric", MetricCatalog.normalizeMetric(logical))
            .put("consumer_count", consumers.size())
            .put("consumers", ranked);
        if (!consumers.isEmpty()) {
            ConsumerUsage top = consumers.get(0);
            observations
                .put("top_consumer", top.consumer())
                .put("top_share_percent", total > 0.0 ? top.value() / total * 100.0 : 0.0);
        }
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
}
