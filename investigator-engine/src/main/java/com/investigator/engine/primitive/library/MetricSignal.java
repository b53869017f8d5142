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
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Single-signal primitive over a fixed logical metric: latency, throttles,
 * replication lag, cost. Reports the window summary, trend and the change
 * against the same window one day earlier. When a threshold is configured,
 * also reports whether the peak reached it.
 */
public class MetricSignal implements DiagnosticPrimitive {
    
    private final PrimitiveName name;
    private final String logicalMetric;
    private final Double threshold;
    private final MetricCatalog catalog;
    
    public MetricSignal(PrimitiveName name, String logicalMetric, Double threshold, MetricCatalog catalog) {
        this.name = name;
        this.logicalMetric = logicalMetric;
        this.threshold = threshold;
        this.catalog = catalog;
    }
    
    public static MetricSignal latency(MetricCatalog catalog) {
        return new MetricSignal(PrimitiveName.ANALYZE_LATENCY, "latency", null, catalog);
    }
    
    public static MetricSignal throttling(MetricCatalog catalog) {
        return new MetricSignal(PrimitiveName.EVALUATE_THROTTLING, "throttles", 1.0, catalog);
    }
    
    public static MetricSignal replicationLag(MetricCatalog catalog) {
        return new MetricSignal(PrimitiveName.CHECK_REPLICATION_LAG, "replication_lag", 30.0, catalog);
    }
    
    public static MetricSignal costTrend(MetricCatalog catalog) {
        return new MetricSignal(PrimitiveName.ANALYZE_COST_TREND, "cost", null, catalog);
    }
    
    @Override
    public PrimitiveName name() {
        return name;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.METRIC_SERIES);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws PrimitiveException, ProviderException {
        
        MetricId metricId = catalog.resolve(parameters.resource().type(), logicalMetric);
        TimeWindow window = TimeWindow.ending(now, parameters.lookbackWindow());
        MetricSeries series = provider.readMetricSeries(parameters.resource(), metricId, window);
        if (series.isEmpty()) {
            throw PrimitiveException.noData("No datapoints for " + metricId + " on " + parameters.resource());
        }
        
        Observations observations = Observations.create()
            .put("metric", logicalMetric)
            .put("provider_metric", metricId.toString())
            .put("average", series.average())
            .put("maximum", series.max())
            .put("total", series.sum())
            .put("trend", series.trend());
        if (threshold != null) {
            observations
                .put("threshold", threshold)
                .put("exceeds_threshold", series.max().orElse(0.0) >= threshold);
        }
        
        OptionalDouble baseline = provider.readMetricSeries(parameters.resource(), metricId,
            window.shiftedBack(CompareBaseline.BASELINE_OFFSET)).average();
        if (baseline.isEmpty()) {
            return List.of(Fact.partial(name, parameters.resource(), observations.build(), now,
                "No baseline datapoints for " + metricId));
        }
        observations
            .put("baseline_average", baseline)
            .put("deviation_percent",
                CompareBaseline.deviationPercent(series.average().orElse(0.0), baseline.getAsDouble()));
        return List.of(Fact.ok(name, parameters.resource(), observations.build(), now));
    }
}
