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
 * What fraction of requests failed over the lookback window?
 * Elevated at 5% or more. Without a request count only the error total is reported.
 */
public class AnalyzeErrorRate implements DiagnosticPrimitive {
    
    public static final double ELEVATED_PERCENT = 5.0;
    
    private final MetricCatalog catalog;
    
    public AnalyzeErrorRate(MetricCatalog catalog) {
        this.catalog = catalog;
    }
    
    @Override
    public PrimitiveName name() {
        return PrimitiveName.ANALYZE_ERROR_RATE;
    }
    
    @Override
    public Set<ProviderCapability> requiredCapabilities() {
        return EnumSet.of(ProviderCapability.METRIC_SERIES);
    }
    
    @Override
    public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now)
            throws PrimitiveException, ProviderException {
        
        String type = parameters.resource().type();
        TimeWindow window = TimeWindow.ending(now, parameters.lookbackWindow());
        MetricId errorsMetric = catalog.resolve(type, "errors");
        MetricId requestsMetric = catalog.resolve(type, "requests");
        
        MetricSeries errors = provider.readMetricSeries(parameters.resource(), errorsMetric, window);
        if (errors.isEmpty()) {
            throw PrimitiveException.noData("No error datapoints for " + errorsMetric + " on " + parameters.resource());
        }
        double errorCount = errors.sum().orElse(0.0);
        
        Observations observations = Observations.create()
            .put("error_metric", errorsMetric.toString())
            .put("error_count", errorCount)
            .put("error_trend", errors.trend());
        
        MetricSeries requests = provider.readMetricSeries(parameters.resource(), requestsMetric, window);
        double requestCount = requests.sum().orElse(0.0);
        if (requestCount <= 0.0) {
            return List.of(Fact.partial(name(), parameters.resource(), observations.build(), now,
                "No request count available for " + requestsMetric));
        }
        
        double rate = errorCount / requestCount * 100.0;
        observations
            .put("request_count", requestCount)
            .put("error_rate_percent", rate)
            .put("elevated", rate >= ELEVATED_PERCENT);
        return List.of(Fact.ok(name(), parameters.resource(), observations.build(), now));
    }
}
