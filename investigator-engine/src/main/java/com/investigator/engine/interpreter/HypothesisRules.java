package com.investigator.engine.interpreter;

import com.investigator.core.model.Fact;
import com.investigator.core.model.Hypothesis;
import com.investigator.core.model.HypothesisType;
import com.investigator.core.model.PrimitiveName;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Built-in hypothesis rules.
 * 
 * Each rule reads the observation keys its primitive writes and cites every
 * fact its conclusion depends on. Confidence starts from a base per rule and
 * rises with corroborating evidence.
 */
public final class HypothesisRules {
    
    static final double HIGH_UTILIZATION = 80.0;
    static final double SATURATED_UTILIZATION = 90.0;
    static final double ANOMALY_DEVIATION = 50.0;
    static final double SURGE_DEVIATION = 100.0;
    static final double DOMINANT_CONSUMER_SHARE = 50.0;
    static final long IMMEDIATE_CHANGE_MINUTES = 30;
    
    private HypothesisRules() {
    }
    
    public static List<HypothesisRule> standard() {
        return List.of(
            HypothesisRules::configurationRegression,
            HypothesisRules::capacityExhaustion,
            HypothesisRules::scalingCeiling,
            HypothesisRules::scalingMisconfigured,
            HypothesisRules::trafficSurge,
            HypothesisRules::runawayConsumer,
            HypothesisRules::dependencyOutage,
            HypothesisRules::networkPathBlocked,
            HypothesisRules::permissionDenied,
            HypothesisRules::deploymentRegression,
            HypothesisRules::elevatedErrorRate,
            HypothesisRules::requestThrottling,
            HypothesisRules::replicationLag,
            HypothesisRules::costSpike,
            HypothesisRules::resourceUnavailable
        );
    }
    
    // ========== Load and Change ==========
    
    static Optional<Hypothesis> configurationRegression(EvidenceView evidence) {
        Optional<Fact> change = recentConfigurationChange(evidence);
        if (change.isEmpty()) {
            return Optional.empty();
        }
        Fact utilization = evidence.first(PrimitiveName.ANALYZE_UTILIZATION).orElse(null);
        Fact baseline = evidence.first(PrimitiveName.COMPARE_BASELINE).orElse(null);
        
        double deviation = baseline == null ? 0.0 : baseline.number("deviation_percent").orElse(0.0);
        boolean farAboveBaseline = deviation >= ANOMALY_DEVIATION;
        if (!farAboveBaseline && !isHighLoad(utilization)) {
            return Optional.empty();
        }
        
        Fact changeFact = change.get();
        long minutesAgo = (long) changeFact.number("latest_minutes_ago").orElse(Double.MAX_VALUE);
        double confidence = 0.65;
        if (farAboveBaseline) {
            confidence += 0.15;
        }
        if (minutesAgo <= IMMEDIATE_CHANGE_MINUTES) {
            confidence += 0.10;
        }
        
        String description = String.format(Locale.ROOT,
            "Configuration change %s %d min before observation coincides with %s",
            changeFact.text("latest_action").orElse("(unknown action)"), minutesAgo,
            loadSummary(utilization, baseline));
        return Optional.of(evidence.hypothesis(HypothesisType.CONFIGURATION_REGRESSION, description, confidence,
            utilization, baseline, changeFact));
    }
    
    static Optional<Hypothesis> capacityExhaustion(EvidenceView evidence) {
        Fact utilization = evidence.first(PrimitiveName.ANALYZE_UTILIZATION).orElse(null);
        if (!isSaturated(utilization) || recentConfigurationChange(evidence).isPresent()) {
            return Optional.empty();
        }
        Fact scaling = evidence.first(PrimitiveName.CHECK_SCALING_BEHAVIOR).orElse(null);
        double confidence = 0.55;
        if ("increasing".equals(utilization.text("trend").orElse(""))) {
            confidence += 0.15;
        }
        if (scaling != null && scaling.flag("at_max_capacity")) {
            confidence += 0.10;
        }
        String description = "Sustained demand has exhausted capacity: " + loadSummary(utilization, null);
        return Optional.of(evidence.hypothesis(HypothesisType.CAPACITY_EXHAUSTION, description, confidence,
            utilization, scaling != null && scaling.flag("at_max_capacity") ? scaling : null));
    }
    
    static Optional<Hypothesis> trafficSurge(EvidenceView evidence) {
        Fact baseline = evidence.first(PrimitiveName.COMPARE_BASELINE).orElse(null);
        if (baseline == null || recentConfigurationChange(evidence).isPresent()) {
            return Optional.empty();
        }
        double deviation = baseline.number("deviation_percent").orElse(0.0);
        if (deviation < SURGE_DEVIATION) {
            return Optional.empty();
        }
        String description = String.format(Locale.ROOT, "%s is %.1f%% above the same window yesterday",
            baseline.text("metric").orElse("load"), deviation);
        return Optional.of(evidence.hypothesis(HypothesisType.TRAFFIC_SURGE, description, 0.6,
            baseline, evidence.first(PrimitiveName.ANALYZE_UTILIZATION).orElse(null)));
    }
    
    static Optional<Hypothesis> runawayConsumer(EvidenceView evidence) {
        Fact consumers = evidence.first(PrimitiveName.FIND_TOP_CONSUMERS).orElse(null);
        if (consumers == null || consumers.number("consumer_count").orElse(0.0) < 2) {
            return Optional.empty();
        }
        double share = consumers.number("top_share_percent").orElse(0.0);
        if (share < DOMINANT_CONSUMER_SHARE) {
            return Optional.empty();
        }
        Fact utilization = evidence.first(PrimitiveName.ANALYZE_UTILIZATION).orElse(null);
        double confidence = isHighLoad(utilization) ? 0.65 : 0.55;
        String description = String.format(Locale.ROOT, "Consumer %s accounts for %.1f%% of %s",
            consumers.text("top_consumer").orElse("(unknown)"), share, consumers.text("metric").orElse("load"));
        return Optional.of(evidence.hypothesis(HypothesisType.RUNAWAY_CONSUMER, description, confidence,
            consumers, isHighLoad(utilization) ? utilization : null));
    }
    
    // ========== Scaling ==========
    
    static Optional<Hypothesis> scalingCeiling(EvidenceView evidence) {
        Fact scaling = evidence.first(PrimitiveName.CHECK_SCALING_BEHAVIOR)
            .filter(fact -> fact.flag("at_max_capacity"))
            .orElse(null);
        Fact limits = evidence.first(PrimitiveName.CHECK_SCALING_LIMITS)
            .filter(fact -> fact.flag("near_limit"))
            .orElse(null);
        if (scaling == null && limits == null) {
            return Optional.empty();
        }
        Fact utilization = evidence.first(PrimitiveName.ANALYZE_UTILIZATION).orElse(null);
        double confidence = 0.7;
        if (isHighLoad(utilization)) {
            confidence += 0.1;
        }
        String description = scaling != null
            ? String.format(Locale.ROOT, "Scaling is pinned at its maximum of %d",
                (long) scaling.number("max_capacity").orElse(0.0))
            : String.format(Locale.ROOT, "Quota usage at %.1f%% of limit",
                limits.number("max_utilization_percent").orElse(0.0));
        return Optional.of(evidence.hypothesis(HypothesisType.SCALING_CEILING, description, confidence,
            scaling, limits, isHighLoad(utilization) ? utilization : null));
    }
    
    static Optional<Hypothesis> scalingMisconfigured(EvidenceView evidence) {
        Fact scaling = evidence.first(PrimitiveName.CHECK_SCALING_BEHAVIOR).orElse(null);
        if (scaling == null) {
            return Optional.empty();
        }
        Fact utilization = evidence.first(PrimitiveName.ANALYZE_UTILIZATION).orElse(null);
        if (!scaling.flag("scaling_enabled") && isHighLoad(utilization)) {
            return Optional.of(evidence.hypothesis(HypothesisType.SCALING_MISCONFIGURED,
                "Auto-scaling is disabled while " + loadSummary(utilization, null), 0.6, scaling, utilization));
        }
        if (scaling.flag("lagging_desired")) {
            String description = String.format(Locale.ROOT, "Current capacity %d lags desired capacity %d",
                (long) scaling.number("current_capacity").orElse(0.0),
                (long) scaling.number("desired_capacity").orElse(0.0));
            return Optional.of(evidence.hypothesis(HypothesisType.SCALING_MISCONFIGURED, description, 0.55, scaling));
        }
        return Optional.empty();
    }
    
    // ========== Dependencies and Network ==========
    
    static Optional<Hypothesis> dependencyOutage(EvidenceView evidence) {
        Fact trace = evidence.first(PrimitiveName.TRACE_DEPENDENCIES)
            .filter(fact -> fact.number("unhealthy_count").orElse(0.0) > 0)
            .orElse(null);
        List<Fact> checks = connectivityChecks(evidence);
        List<Fact> unreachable = checks.stream().filter(fact -> !fact.flag("reachable")).toList();
        boolean partiallyUnreachable = !unreachable.isEmpty() && unreachable.size() < checks.size();
        if (trace == null && !partiallyUnreachable) {
            return Optional.empty();
        }
        
        List<Fact> cited = new ArrayList<>();
        List<String> names = new ArrayList<>();
        if (trace != null) {
            cited.add(trace);
            trace.list("unhealthy").forEach(item -> names.add(item.toString()));
        }
        if (partiallyUnreachable) {
            cited.addAll(unreachable);
            unreachable.forEach(fact -> names.add(fact.text("target").orElse("?") + " unreachable"));
        }
        double confidence = trace != null && partiallyUnreachable ? 0.8 : 0.7;
        return Optional.of(evidence.hypothesis(HypothesisType.DEPENDENCY_OUTAGE,
            "Dependency failing: " + String.join(", ", names), confidence, cited.toArray(Fact[]::new)));
    }
    
    static Optional<Hypothesis> networkPathBlocked(EvidenceView evidence) {
        List<Fact> checks = connectivityChecks(evidence);
        if (checks.isEmpty() || checks.stream().anyMatch(fact -> fact.flag("reachable"))) {
            return Optional.empty();
        }
        List<Fact> cited = new ArrayList<>(checks);
        double confidence = 0.75;
        Optional<Fact> change = recentConfigurationChange(evidence);
        if (change.isPresent()) {
            cited.add(change.get());
            confidence += 0.05;
        }
        String description = String.format(Locale.ROOT, "None of %d dependencies is reachable%s",
            checks.size(), change.map(fact -> " after " + fact.text("latest_action").orElse("a change")).orElse(""));
        return Optional.of(evidence.hypothesis(HypothesisType.NETWORK_PATH_BLOCKED, description, confidence,
            cited.toArray(Fact[]::new)));
    }
    
    static Optional<Hypothesis> permissionDenied(EvidenceView evidence) {
        Fact permissions = evidence.first(PrimitiveName.CHECK_PERMISSIONS)
            .filter(fact -> fact.number("denied_count").orElse(0.0) > 0)
            .orElse(null);
        if (permissions == null) {
            return Optional.empty();
        }
        Fact change = recentConfigurationChange(evidence).orElse(null);
        double confidence = change != null ? 0.9 : 0.8;
        String description = String.format(Locale.ROOT, "%d required actions are denied",
            (long) permissions.number("denied_count").orElse(0.0));
        return Optional.of(evidence.hypothesis(HypothesisType.PERMISSION_DENIED, description, confidence,
            permissions, change));
    }
    
    // ========== Releases and Errors ==========
    
    static Optional<Hypothesis> deploymentRegression(EvidenceView evidence) {
        Fact deployment = recentDeployment(evidence).orElse(null);
        if (deployment == null) {
            return Optional.empty();
        }
        Fact errors = evidence.first(PrimitiveName.ANALYZE_ERROR_RATE).filter(fact -> fact.flag("elevated")).orElse(null);
        Fact latency = evidence.first(PrimitiveName.ANALYZE_LATENCY)
            .filter(fact -> fact.number("deviation_percent").orElse(0.0) >= ANOMALY_DEVIATION)
            .orElse(null);
        Fact baseline = evidence.first(PrimitiveName.COMPARE_BASELINE).filter(fact -> fact.flag("anomalous")).orElse(null);
        if (errors == null && latency == null && baseline == null) {
            return Optional.empty();
        }
        double confidence = 0.75;
        if (errors != null && latency != null) {
            confidence += 0.1;
        }
        String version = deployment.text("current_version").map(v -> " (version " + v + ")").orElse("");
        String description = String.format(Locale.ROOT, "Deployment %s%s %d min before observation was followed by %s",
            deployment.text("latest_action").orElse("(unknown)"), version,
            (long) deployment.number("latest_minutes_ago").orElse(0.0),
            errors != null ? "elevated errors" : latency != null ? "higher latency" : "anomalous load");
        return Optional.of(evidence.hypothesis(HypothesisType.DEPLOYMENT_REGRESSION, description, confidence,
            deployment, errors, latency, baseline));
    }
    
    static Optional<Hypothesis> elevatedErrorRate(EvidenceView evidence) {
        Fact errors = evidence.first(PrimitiveName.ANALYZE_ERROR_RATE).filter(fact -> fact.flag("elevated")).orElse(null);
        if (errors == null || recentDeployment(evidence).isPresent()) {
            return Optional.empty();
        }
        double rate = errors.number("error_rate_percent").orElse(0.0);
        double confidence = rate >= 20.0 ? 0.6 : 0.5;
        return Optional.of(evidence.hypothesis(HypothesisType.ELEVATED_ERROR_RATE,
            String.format(Locale.ROOT, "%.1f%% of requests are failing", rate), confidence, errors));
    }
    
    static Optional<Hypothesis> requestThrottling(EvidenceView evidence) {
        return evidence.first(PrimitiveName.EVALUATE_THROTTLING)
            .filter(fact -> fact.flag("exceeds_threshold"))
            .map(fact -> evidence.hypothesis(HypothesisType.REQUEST_THROTTLING,
                String.format(Locale.ROOT, "%.0f requests throttled in the window", fact.number("total").orElse(0.0)),
                0.65, fact));
    }
    
    // ========== Data, Cost and Status ==========
    
    static Optional<Hypothesis> replicationLag(EvidenceView evidence) {
        return evidence.first(PrimitiveName.CHECK_REPLICATION_LAG)
            .filter(fact -> fact.flag("exceeds_threshold"))
            .map(fact -> evidence.hypothesis(HypothesisType.REPLICATION_LAG,
                String.format(Locale.ROOT, "Replication lag peaked at %.1f", fact.number("maximum").orElse(0.0)),
                "increasing".equals(fact.text("trend").orElse("")) ? 0.8 : 0.7, fact));
    }
    
    static Optional<Hypothesis> costSpike(EvidenceView evidence) {
        Fact cost = evidence.first(PrimitiveName.ANALYZE_COST_TREND).orElse(null);
        if (cost == null) {
            return Optional.empty();
        }
        double deviation = cost.number("deviation_percent").orElse(0.0);
        boolean increasing = "increasing".equals(cost.text("trend").orElse(""));
        if (deviation < ANOMALY_DEVIATION && !increasing) {
            return Optional.empty();
        }
        double confidence = deviation >= SURGE_DEVIATION ? 0.7 : 0.6;
        String description = String.format(Locale.ROOT, "Spend is %s, %.1f%% versus yesterday",
            increasing ? "rising" : "elevated", deviation);
        return Optional.of(evidence.hypothesis(HypothesisType.COST_SPIKE, description, confidence,
            cost, evidence.first(PrimitiveName.FIND_TOP_CONSUMERS).orElse(null)));
    }
    
    static Optional<Hypothesis> resourceUnavailable(EvidenceView evidence) {
        return evidence.first(PrimitiveName.CHECK_RESOURCE_STATUS)
            .filter(fact -> fact.observations().containsKey("available") && !fact.flag("available"))
            .map(fact -> evidence.hypothesis(HypothesisType.RESOURCE_UNAVAILABLE,
                "Resource status is " + fact.text("status").orElse("unknown"), 0.85, fact));
    }
    
    // ========== Shared Predicates ==========
    
    static Optional<Fact> recentConfigurationChange(EvidenceView evidence) {
        return evidence.first(PrimitiveName.CHECK_RECENT_CHANGES)
            .filter(fact -> fact.number("configuration_changes").orElse(0.0) > 0)
            .filter(fact -> fact.flag("within_incident_window"));
    }
    
    static Optional<Fact> recentDeployment(EvidenceView evidence) {
        return evidence.first(PrimitiveName.CHECK_DEPLOYMENT_STATUS)
            .filter(fact -> fact.number("deployment_count").orElse(0.0) > 0)
            .filter(fact -> fact.flag("within_incident_window"));
    }
    
    static List<Fact> connectivityChecks(EvidenceView evidence) {
        return evidence.all(PrimitiveName.CHECK_CONNECTIVITY).stream()
            .filter(fact -> fact.observations().containsKey("target"))
            .toList();
    }
    
    static boolean isHighLoad(Fact utilization) {
        if (utilization == null) {
            return false;
        }
        return utilization.number("current").orElse(0.0) >= HIGH_UTILIZATION
            || utilization.number("maximum").orElse(0.0) >= SATURATED_UTILIZATION;
    }
    
    static boolean isSaturated(Fact utilization) {
        return utilization != null && utilization.number("current").orElse(0.0) >= SATURATED_UTILIZATION;
    }
    
    private static String loadSummary(Fact utilization, Fact baseline) {
        StringBuilder summary = new StringBuilder();
        if (utilization != null) {
            summary.append(String.format(Locale.ROOT, "%s at %.1f",
                utilization.text("metric").orElse("load"), utilization.number("current").orElse(0.0)));
        }
        if (baseline != null && baseline.number("deviation_percent").isPresent()) {
            if (summary.length() > 0) {
                summary.append(' ');
            }
            summary.append(String.format(Locale.ROOT, "(%+.1f%% vs baseline %.1f)",
                baseline.number("deviation_percent").getAsDouble(),
                baseline.number("baseline_average").orElse(0.0)));
        }
        return summary.length() == 0 ? "elevated load" : summary.toString();
    }
}
