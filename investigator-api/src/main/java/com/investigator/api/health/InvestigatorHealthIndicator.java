package com.investigator.api.health;

import com.investigator.core.llm.LanguageModelCollaborator;
import com.investigator.core.model.IncidentClass;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.planner.ReasoningPlanner;
import com.investigator.engine.primitive.PrimitiveRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the investigation pipeline.
 * Reports:
 * - Strategy table coverage and registered primitives
 * - Provider capabilities
 * - Whether a language model is enabled (informational; never DOWN)
 */
@Component
public class InvestigatorHealthIndicator implements HealthIndicator {

    private final ReasoningPlanner planner;
    private final PrimitiveRegistry registry;
    private final ResourceProvider provider;
    private final LanguageModelCollaborator collaborator;

    public InvestigatorHealthIndicator(
            ReasoningPlanner planner,
            PrimitiveRegistry registry,
            ResourceProvider provider,
            LanguageModelCollaborator collaborator) {
        this.planner = planner;
        this.registry = registry;
        this.provider = provider;
        this.collaborator = collaborator;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            int strategies = planner.strategies().strategies().size();
            details.put("strategies", strategies);
            details.put("primitives", registry.names().size());
            details.put("providerCapabilities", provider.capabilities());
            details.put("languageModel", collaborator.isEnabled() ? "enabled" : "disabled");
            
            if (strategies < IncidentClass.values().length) {
                details.put("strategyTable", "incomplete");
                return Health.down().withDetails(details).build();
            }
            details.put("strategyTable", "validated");
            return Health.up().withDetails(details).build();
        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
