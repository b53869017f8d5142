package com.investigator.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of classifying a free-text incident description.
 * Produced once per investigation and never mutated.
 * 
 * Invariants:
 * - confidence in [0, 1]
 * - secondaryClasses contains neither duplicates nor the primary class
 */
public record IncidentClassification(
    IncidentClass primaryClass,
    List<IncidentClass> secondaryClasses,
    IncidentContext context,
    double confidence,
    ClassificationMethod method,
    boolean belowThreshold
) {
    public IncidentClassification {
        if (primaryClass == null) {
            throw new IllegalArgumentException("primaryClass is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        List<IncidentClass> distinct = new ArrayList<>();
        if (secondaryClasses != null) {
            for (IncidentClass secondary : secondaryClasses) {
                if (secondary != null && secondary != primaryClass && !distinct.contains(secondary)) {
                    distinct.add(secondary);
                }
            }
        }
        secondaryClasses = List.copyOf(distinct);
        context = context == null ? IncidentContext.empty() : context;
        method = method == null ? ClassificationMethod.MODEL : method;
    }
    
    /**
     * Create a classification judged against a confidence threshold.
     * Out-of-range confidence is clamped rather than rejected.
     */
    public static IncidentClassification create(
            IncidentClass primaryClass,
            List<IncidentClass> secondaryClasses,
            IncidentContext context,
            double confidence,
            ClassificationMethod method,
            double threshold) {
        
        double clamped = clamp(confidence);
        return new IncidentClassification(
            primaryClass, secondaryClasses, context, clamped, method, clamped < threshold);
    }
    
    /**
     * Primary class followed by secondaries in order.
     */
    @JsonIgnore
    public List<IncidentClass> allClasses() {
        List<IncidentClass> all = new ArrayList<>(secondaryClasses.size() + 1);
        all.add(primaryClass);
        all.addAll(secondaryClasses);
        return List.copyOf(all);
    }
    
    public static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
