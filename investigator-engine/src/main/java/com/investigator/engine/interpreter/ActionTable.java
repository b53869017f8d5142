package com.investigator.engine.interpreter;

import com.investigator.core.model.HypothesisType;
import com.investigator.core.model.ResourceRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Recommended actions per hypothesis type.
 * 
 * Command templates may reference {@code {type}} and {@code {id}}. A template is
 * only rendered when the resource id is known; otherwise the action carries no command.
 */
public final class ActionTable {
    
    /**
     * One recommendation template.
     * 
     * @param priority          1 = most urgent
     * @param description       what the operator should do
     * @param commandTemplate   command with placeholders, or null
     * @param requiresApproval  true when the command changes the resource
     */
    public record ActionTemplate(int priority, String description, String commandTemplate, boolean requiresApproval) {
        
        public ActionTemplate {
            if (priority < 1) {
                throw new IllegalArgumentException("priority must be >= 1: " + priority);
            }
            if (description == null || description.isBlank()) {
                throw new IllegalArgumentException("description is required");
            }
        }
        
        String render(ResourceRef resource) {
            if (commandTemplate == null || !resource.hasId()) {
                return null;
            }
            return commandTemplate
                .replace("{type}", resource.hasType() ? resource.type() : "resource")
                .replace("{id}", resource.id());
        }
    }
    
    private final Map<HypothesisType, List<ActionTemplate>> templates;
    
    private ActionTable(Map<HypothesisType, List<ActionTemplate>> templates) {
        Map<HypothesisType, List<ActionTemplate>> copy = new EnumMap<>(HypothesisType.class);
        templates.forEach((type, list) -> copy.put(type, List.copyOf(list)));
        this.templates = Collections.unmodifiableMap(copy);
    }
    
    public List<ActionTemplate> actionsFor(HypothesisType type) {
        return templates.getOrDefault(type, List.of());
    }
    
    public static ActionTable standard() {
        return builder()
            .action(HypothesisType.CONFIGURATION_REGRESSION, 1,
                "Review the recent configuration change and roll it back if it is not required",
                "investigate changes --resource {type}/{id} --since 24h", false)
            .action(HypothesisType.CONFIGURATION_REGRESSION, 2,
                "Restore the previous configuration version",
                "rollback configuration --resource {type}/{id}", true)
            .action(HypothesisType.CAPACITY_EXHAUSTION, 1,
                "Increase capacity for the saturated resource",
                "scale --resource {type}/{id} --increase 1", true)
            .action(HypothesisType.CAPACITY_EXHAUSTION, 2,
                "Identify the workload driving utilization", null, false)
            .action(HypothesisType.SCALING_CEILING, 1,
                "Raise the maximum scaling capacity or request a quota increase",
                "describe limits --resource {type}/{id}", false)
            .action(HypothesisType.SCALING_MISCONFIGURED, 1,
                "Review the scaling policy and enable auto-scaling",
                "describe scaling --resource {type}/{id}", false)
            .action(HypothesisType.TRAFFIC_SURGE, 1,
                "Confirm whether the traffic increase is expected and scale ahead of it", null, false)
            .action(HypothesisType.TRAFFIC_SURGE, 2,
                "Enable rate limiting at the edge if the traffic is abusive", null, true)
            .action(HypothesisType.RUNAWAY_CONSUMER, 1,
                "Inspect the dominant consumer and throttle or terminate it if runaway", null, true)
            .action(HypothesisType.DEPENDENCY_OUTAGE, 1,
                "Check the health of the failing dependency",
                "describe dependencies --resource {type}/{id}", false)
            .action(HypothesisType.DEPENDENCY_OUTAGE, 2,
                "Fail over or degrade gracefully until the dependency recovers", null, true)
            .action(HypothesisType.NETWORK_PATH_BLOCKED, 1,
                "Review security group, route table and firewall rules on the path",
                "describe network --resource {type}/{id}", false)
            .action(HypothesisType.PERMISSION_DENIED, 1,
                "Restore the denied permissions on the resource's role",
                "describe permissions --resource {type}/{id}", false)
            .action(HypothesisType.DEPLOYMENT_REGRESSION, 1,
                "Roll back to the previous deployment",
                "rollback deployment --resource {type}/{id}", true)
            .action(HypothesisType.DEPLOYMENT_REGRESSION, 2,
                "Compare logs between the current and previous versions", null, false)
            .action(HypothesisType.ELEVATED_ERROR_RATE, 1,
                "Inspect application logs for the dominant error", null, false)
            .action(HypothesisType.REQUEST_THROTTLING, 1,
                "Increase provisioned throughput or add client-side backoff", null, true)
            .action(HypothesisType.REPLICATION_LAG, 1,
                "Check replica load and write volume on the primary",
                "describe replication --resource {type}/{id}", false)
            .action(HypothesisType.COST_SPIKE, 1,
                "Identify the resources driving the cost increase", null, false)
            .action(HypothesisType.COST_SPIKE, 2,
                "Set a budget alert on the account", null, false)
            .action(HypothesisType.RESOURCE_UNAVAILABLE, 1,
                "Check the resource's status events and restart it if it is stopped",
                "describe status --resource {type}/{id}", false)
            .action(HypothesisType.MODEL_PROPOSED, 1,
                "Validate the proposed cause manually before acting", null, false)
            .build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private final Map<HypothesisType, List<ActionTemplate>> templates = new EnumMap<>(HypothesisType.class);
        
        public Builder action(HypothesisType type, int priority, String description,
                              String commandTemplate, boolean requiresApproval) {
            templates.computeIfAbsent(type, key -> new ArrayList<>())
                .add(new ActionTemplate(priority, description, commandTemplate, requiresApproval));
            return this;
        }
        
        public ActionTable build() {
            return new ActionTable(templates);
        }
    }
}
