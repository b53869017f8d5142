package com.investigator.engine.planner;

import com.investigator.core.exception.PlanningException;
import com.investigator.core.model.IncidentClass;
import com.investigator.core.model.PrimitiveName;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.investigator.core.model.PrimitiveName.*;

/**
 * Static mapping from incident class to investigation strategy.
 * 
 * Invariants (checked at construction):
 * - every incident class has a strategy
 * - no strategy is empty or lists a primitive twice
 */
public final class StrategyTable {
    
    private final Map<IncidentClass, Strategy> strategies;
    
    private StrategyTable(Map<IncidentClass, Strategy> strategies) {
        for (IncidentClass incidentClass : IncidentClass.values()) {
            Strategy strategy = strategies.get(incidentClass);
            if (strategy == null) {
                throw new PlanningException(incidentClass.wireName(), "no strategy defined");
            }
            if (strategy.incidentClass() != incidentClass) {
                throw new PlanningException(incidentClass.wireName(),
                    "strategy is registered for " + strategy.incidentClass());
            }
            if (strategy.primitives().isEmpty()) {
                throw new PlanningException(incidentClass.wireName(), "strategy lists no primitives");
            }
            Set<PrimitiveName> seen = new HashSet<>();
            for (PrimitiveName primitive : strategy.primitives()) {
                if (primitive == null) {
                    throw new PlanningException(incidentClass.wireName(), "strategy contains a null primitive");
                }
                if (!seen.add(primitive)) {
                    throw new PlanningException(incidentClass.wireName(), "duplicate primitive " + primitive.wireName());
                }
            }
        }
        this.strategies = Collections.unmodifiableMap(new EnumMap<>(strategies));
    }
    
    /**
     * The built-in strategy table.
     */
    public static StrategyTable standard() {
        return builder()
            .strategy(IncidentClass.RESOURCE_SATURATION, "cpu",
                "Measure load against baseline, find what consumes it, check whether scaling or a change explains it",
                ANALYZE_UTILIZATION, COMPARE_BASELINE, FIND_TOP_CONSUMERS, CHECK_SCALING_BEHAVIOR, CHECK_RECENT_CHANGES)
            .strategy(IncidentClass.LOAD_SPIKE, "requests",
                "Confirm the surge against baseline, check scaling response and identify the source",
                ANALYZE_UTILIZATION, COMPARE_BASELINE, CHECK_SCALING_BEHAVIOR, FIND_TOP_CONSUMERS, TRACE_DEPENDENCIES)
            .strategy(IncidentClass.CONFIGURATION_DRIFT, null,
                "Find what changed and whether the resource is still healthy",
                CHECK_RECENT_CHANGES, DIFF_CONFIGURATION, CHECK_DEPLOYMENT_STATUS, CHECK_RESOURCE_STATUS)
            .strategy(IncidentClass.DEPENDENCY_FAILURE, "errors",
                "Walk the dependency graph, test each edge, look for throttling and errors",
                TRACE_DEPENDENCIES, CHECK_CONNECTIVITY, CHECK_RECENT_CHANGES, EVALUATE_THROTTLING, ANALYZE_ERROR_RATE)
            .strategy(IncidentClass.SCALING_FAILURE, "cpu",
                "Check scaling state against load, limits and the permissions scaling needs",
                CHECK_SCALING_BEHAVIOR, ANALYZE_UTILIZATION, CHECK_SCALING_LIMITS, CHECK_RECENT_CHANGES, CHECK_PERMISSIONS)
            .strategy(IncidentClass.NETWORK_CONNECTIVITY, null,
                "Test network paths to dependencies and look for network configuration changes",
                CHECK_CONNECTIVITY, TRACE_DEPENDENCIES, CHECK_RECENT_CHANGES, DIFF_CONFIGURATION)
            .strategy(IncidentClass.PERMISSION_FAILURE, null,
                "Evaluate required permissions and look for policy changes",
                CHECK_PERMISSIONS, CHECK_RECENT_CHANGES, DIFF_CONFIGURATION)
            .strategy(IncidentClass.COST_ANOMALY, "cost",
                "Confirm the spend trend, compare to baseline and attribute it",
                ANALYZE_COST_TREND, COMPARE_BASELINE, FIND_TOP_CONSUMERS, CHECK_RECENT_CHANGES, ANALYZE_UTILIZATION)
            .strategy(IncidentClass.DEPLOYMENT_REGRESSION, "cpu",
                "Correlate the latest deployment with errors, latency and load",
                CHECK_DEPLOYMENT_STATUS, ANALYZE_ERROR_RATE, ANALYZE_LATENCY, CHECK_RECENT_CHANGES, ANALYZE_UTILIZATION)
            .strategy(IncidentClass.AVAILABILITY_LOSS, null,
                "Check the resource and its dependencies are up, then look for recent changes and errors",
                CHECK_RESOURCE_STATUS, TRACE_DEPENDENCIES, CHECK_RECENT_CHANGES, ANALYZE_ERROR_RATE, CHECK_CONNECTIVITY)
            .strategy(IncidentClass.PERFORMANCE_DEGRADATION, "latency",
                "Quantify the slowdown against baseline and look downstream and at load",
                ANALYZE_LATENCY, COMPARE_BASELINE, TRACE_DEPENDENCIES, ANALYZE_UTILIZATION, CHECK_RECENT_CHANGES)
            .strategy(IncidentClass.DATA_INCONSISTENCY, null,
                "Measure replication lag and look for changes and write errors",
                CHECK_REPLICATION_LAG, CHECK_RECENT_CHANGES, ANALYZE_ERROR_RATE, DIFF_CONFIGURATION)
            .build();
    }
    
    /**
     * Strategy for an incident class.
     * 
     * @throws PlanningException when the class is null or unknown
     */
    public Strategy strategyFor(IncidentClass incidentClass) {
        if (incidentClass == null) {
            throw new PlanningException("incident class", "must not be null");
        }
        Strategy strategy = strategies.get(incidentClass);
        if (strategy == null) {
            throw new PlanningException(incidentClass.wireName(), "no strategy defined");
        }
        return strategy;
    }
    
    public Collection<Strategy> strategies() {
        return strategies.values();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private final Map<IncidentClass, Strategy> strategies = new EnumMap<>(IncidentClass.class);
        
        public Builder strategy(IncidentClass incidentClass, String defaultMetric, String rationale,
                                PrimitiveName... primitives) {
            return strategy(new Strategy(incidentClass, List.of(primitives), defaultMetric, rationale));
        }
        
        public Builder strategy(Strategy strategy) {
            strategies.put(strategy.incidentClass(), strategy);
            return this;
        }
        
        public Builder from(StrategyTable table) {
            strategies.putAll(table.strategies);
            return this;
        }
        
        public Builder remove(IncidentClass incidentClass) {
            strategies.remove(incidentClass);
            return this;
        }
        
        public StrategyTable build() {
            return new StrategyTable(strategies);
        }
    }
}
