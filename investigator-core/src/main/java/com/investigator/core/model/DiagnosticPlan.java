package com.investigator.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Ordered primitive invocations derived from a classification.
 * 
 * Invariants:
 * - no primitive appears twice
 * - step indexes are 0..n-1 in order
 * - planId is derived from the content, so equal inputs give equal plans
 * 
 * Re-planning produces a new plan; a plan is never modified.
 */
public record DiagnosticPlan(
    UUID planId,
    IncidentClass primaryClass,
    List<IncidentClass> secondaryClasses,
    List<PlanStep> steps
) {
    public static final Duration ESTIMATED_STEP_DURATION = Duration.ofSeconds(3);
    
    public DiagnosticPlan {
        secondaryClasses = secondaryClasses == null ? List.of() : List.copyOf(secondaryClasses);
        steps = steps == null ? List.of() : List.copyOf(steps);
        List<PrimitiveName> seen = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            PlanStep step = steps.get(i);
            if (step.index() != i) {
                throw new IllegalArgumentException("Step " + step.primitive() + " has index " + step.index() + ", expected " + i);
            }
            if (seen.contains(step.primitive())) {
                throw new IllegalArgumentException("Duplicate primitive in plan: " + step.primitive());
            }
            seen.add(step.primitive());
        }
    }
    
    /**
     * Create a plan whose id is a name-based UUID over its content.
     */
    public static DiagnosticPlan create(
            IncidentClass primaryClass,
            List<IncidentClass> secondaryClasses,
            List<PlanStep> steps) {
        
        StringBuilder key = new StringBuilder(primaryClass.name());
        for (IncidentClass secondary : secondaryClasses) {
            key.append('+').append(secondary.name());
        }
        for (PlanStep step : steps) {
            PrimitiveParameters params = step.parameters();
            key.append('|').append(step.primitive().name())
               .append(':').append(params.resource())
               .append(':').append(params.metric())
               .append(':').append(params.lookbackWindow())
               .append(':').append(params.scope());
        }
        UUID planId = UUID.nameUUIDFromBytes(key.toString().getBytes(StandardCharsets.UTF_8));
        return new DiagnosticPlan(planId, primaryClass, secondaryClasses, steps);
    }
    
    @JsonIgnore
    public boolean isEmpty() {
        return steps.isEmpty();
    }
    
    @JsonIgnore
    public List<PrimitiveName> primitiveNames() {
        return steps.stream().map(PlanStep::primitive).toList();
    }
    
    public boolean contains(PrimitiveName primitive) {
        return steps.stream().anyMatch(step -> step.primitive() == primitive);
    }
    
    public Duration estimatedDuration() {
        return ESTIMATED_STEP_DURATION.multipliedBy(steps.size());
    }
}
