package com.investigator.engine.primitive.library;

import com.investigator.core.model.Fact;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.provider.MetricId;
import com.investigator.core.provider.MetricSeries;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.core.provider.TimeWindow;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.MetricCatalog;
import com.investigator.engine.primitive.Observations;
import com.investigator.engine.primitive.PrimitiveException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * How loaded is the resource over the lookback window?
 * Reports current, average, peak and trend of the bound metric (cpu when unbound).
 */
public class AnalyzeUtilization implements DiagnosticPrimitive {
    
    static final String DEFAULT_METRIC = "cpu";
    
    private final MetricCatalog catalog;
    
    public AnalyzeUtilization(MetricCatalog catalog) {
        this.catalog = catalog;
    }
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.ANALYZE_UTILIZATION;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.METRIC_SERIES);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws PrimitiveException, ProviderException {
        
        String logical = parameters.hasMetric() ? parameters.metric() : DEFAULT_METRIC;
        MetricId metricId = catalog.resolve(parameters.resource().type(), logical);
        TimeWindow window = TimeWindow.ending(now, parameters.lookbackWindow());
        
        MetricSeries series = provider.readMetricSeries(parameters.resource(), metricId, window);
        if (series.isEmpty()) {
            throw PrimitiveException.noData("No datapoints for " + metricId + " on " + parameters.resource());
        }
        
        Observations observations = Observations.create()
            .put("metric", MetricCatalog.normalizeMetric(logical))
            .put("provider_metric", metricId.toString())
            .put("unit", metricId.unit())
            .put("current", series.latest())
            .put("average", series.average())
            .put("maximum", series.max())
            .put("minimum", series.min())
            .put("trend", series.trend())
            .put("datapoints", series.points().size())
            .put("window_minutes", window.length().toMinutes());
        
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
}
