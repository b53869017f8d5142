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
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Is the current window normal compared to the same window one day earlier?
 * Anomalous when the averages differ by more than 50%.
 */
public class CompareBaseline implements DiagnosticPrimitive {
    
    public static final Duration BASELINE_OFFSET = Duration.ofDays(1);
    public static final double ANOMALY_THRESHOLD_PERCENT = 50.0;
    
    private final MetricCatalog catalog;
    
    public CompareBaseline(MetricCatalog catalog) {
        this.catalog = catalog;
    }
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.COMPARE_BASELINE;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.METRIC_SERIES);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws PrimitiveException, ProviderException {
        
        String logical = parameters.hasMetric() ? parameters.metric() : AnalyzeUtilization.DEFAULT_METRIC;
        MetricId metricId = catalog.resolve(parameters.resource().type(), logical);
        TimeWindow current = TimeWindow.ending(now, parameters.lookbackWindow());
        TimeWindow baseline = current.shiftedBack(BASELINE_OFFSET);
        
        OptionalDouble currentAverage = provider.readMetricSeries(parameters.resource(), metricId, current).average();
        if (currentAverage.isEmpty()) {
            throw PrimitiveException.noData("No current datapoints for " + metricId + " on " + parameters.resource());
        }
        
        Observations observations = Observations.create()
            .put("metric", MetricCatalog.normalizeMetric(logical))
            .put("provider_metric", metricId.toString())
            .put("current_average", currentAverage)
            .put("baseline_offset_hours", BASELINE_OFFSET.toHours());
        
        MetricSeries baselineSeries = provider.readMetricSeries(parameters.resource(), metricId, baseline);
        OptionalDouble baselineAverage = baselineSeries.average();
        if (baselineAverage.isEmpty()) {
            return List.of(Fact.partial(name(), parameters.resource(), observations.build(), now,
                "No baseline datapoints for " + metricId));
        }
        
        double deviation = deviationPercent(currentAverage.getAsDouble(), baselineAverage.getAsDouble());
        observations
            .put("baseline_average", baselineAverage)
            .put("deviation_percent", deviation)
            .put("anomalous", Math.abs(deviation) > ANOMALY_THRESHOLD_PERCENT);
        
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
    
    /**
     * Percent change from baseline to current. A zero baseline counts as 100% when current is positive.
     */
    static double deviationPercent(double current, double baseline) {
        if (baseline == 0.0) {
            return current == 0.0 ? 0.0 : 100.0;
        }
        return (current - baseline) / Math.abs(baseline) * 100.0;
    }
}
