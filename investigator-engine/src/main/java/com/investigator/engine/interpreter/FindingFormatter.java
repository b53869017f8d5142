package com.investigator.engine.interpreter;

import com.investigator.core.model.Fact;
import com.investigator.core.model.FactStatus;
import java.util.Locale;

/**
 * Renders one usable fact as a short key-finding line.
 */
final class FindingFormatter {
    
    private FindingFormatter() {
    }
    
    static String format(Fact fact) {
        String line = switch (fact.primitive()) {
            case ANALYZE_UTILIZATION -> String.format(Locale.ROOT, "%s on %s at %s (avg %s, max %s, %s)",
                fact.text("metric").orElse("metric"), fact.resource(), num(fact, "current"),
                num(fact, "average"), num(fact, "maximum"), fact.text("trend").orElse("unknown"));
            case COMPARE_BASELINE -> fact.number("deviation_percent").isPresent()
                ? String.format(Locale.ROOT, "%s is %s%% versus %sh ago (baseline %s)",
                    fact.text("metric").orElse("metric"), signed(fact, "deviation_percent"),
                    num(fact, "baseline_offset_hours"), num(fact, "baseline_average"))
                : "No baseline available for " + fact.text("metric").orElse("metric");
            case FIND_TOP_CONSUMERS -> fact.text("top_consumer")
                .map(top -> String.format(Locale.ROOT, "Top consumer %s holds %s%% of %s",
                    top, num(fact, "top_share_percent"), fact.text("metric").orElse("load")))
                .orElse("No consumers reported");
            case TRACE_DEPENDENCIES -> String.format(Locale.ROOT, "%s dependencies, %s unhealthy",
                integer(fact, "dependency_count"), integer(fact, "unhealthy_count"));
            case CHECK_CONNECTIVITY -> fact.text("target")
                .map(target -> target + (fact.flag("reachable") ? " reachable" : " unreachable")
                    + fact.text("detail").map(detail -> ": " + detail).orElse(""))
                .orElse("No dependencies to check");
            case CHECK_RECENT_CHANGES -> fact.text("latest_action")
                .map(action -> String.format(Locale.ROOT, "%s changes in 24h; latest %s %s min ago",
                    integer(fact, "change_count"), action, integer(fact, "latest_minutes_ago")))
                .orElse("No changes in the last 24h");
            case DIFF_CONFIGURATION -> String.format(Locale.ROOT, "%s of %s configuration keys changed",
                integer(fact, "changed_key_count"), integer(fact, "config_key_count"));
            case CHECK_SCALING_BEHAVIOR -> String.format(Locale.ROOT, "Scaling %s: %s/%s capacity (min %s, desired %s)",
                fact.flag("scaling_enabled") ? "enabled" : "disabled", integer(fact, "current_capacity"),
                integer(fact, "max_capacity"), integer(fact, "min_capacity"), integer(fact, "desired_capacity"));
            case CHECK_SCALING_LIMITS -> String.format(Locale.ROOT, "Highest quota usage %s%%%s",
                num(fact, "max_utilization_percent"), fact.flag("near_limit") ? " (near limit)" : "");
            case CHECK_PERMISSIONS -> String.format(Locale.ROOT, "%s of %s required actions denied",
                integer(fact, "denied_count"), integer(fact, "checked_count"));
            case ANALYZE_ERROR_RATE -> fact.number("error_rate_percent").isPresent()
                ? String.format(Locale.ROOT, "Error rate %s%% (%s errors)",
                    num(fact, "error_rate_percent"), integer(fact, "error_count"))
                : String.format(Locale.ROOT, "%s errors, %s", integer(fact, "error_count"),
                    fact.text("error_trend").orElse("unknown"));
            case ANALYZE_LATENCY, EVALUATE_THROTTLING, CHECK_REPLICATION_LAG, ANALYZE_COST_TREND ->
                String.format(Locale.ROOT, "%s avg %s, max %s (%s)%s",
                    fact.text("metric").orElse(fact.primitive().wireName()), num(fact, "average"),
                    num(fact, "maximum"), fact.text("trend").orElse("unknown"),
                    fact.flag("exceeds_threshold") ? ", above threshold" : "");
            case CHECK_DEPLOYMENT_STATUS -> fact.text("latest_action")
                .map(action -> String.format(Locale.ROOT, "Latest deployment %s %s min ago (%s)",
                    action, integer(fact, "latest_minutes_ago"), fact.text("deployment_status").orElse("unknown")))
                .orElse("No deployments in the last 24h");
            case CHECK_RESOURCE_STATUS -> fact.resource() + " is " + fact.text("status").orElse("unknown");
        };
        return fact.status() == FactStatus.PARTIAL ? "[partial] " + line : line;
    }
    
    private static String num(Fact fact, String key) {
        return fact.number(key).isPresent()
            ? String.format(Locale.ROOT, "%.1f", fact.number(key).getAsDouble())
            : "n/a";
    }
    
    private static String signed(Fact fact, String key) {
        return String.format(Locale.ROOT, "%+.1f", fact.number(key).orElse(0.0));
    }
    
    private static String integer(Fact fact, String key) {
        return fact.number(key).isPresent()
            ? Long.toString((long) fact.number(key).getAsDouble())
            : "0";
    }
}
