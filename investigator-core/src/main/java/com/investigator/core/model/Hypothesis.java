package com.investigator.core.model;

import java.util.List;

/**
 * Confidence-scored causal explanation backed by cited facts.
 * 
 * Invariants:
 * - confidence in [0, 1]
 * - evidence is non-empty
 * - planOrder is the smallest plan step index among the cited facts
 */
public record Hypothesis(
    HypothesisType type,
    String description,
    double confidence,
    List<FactRef> evidence,
    HypothesisSource source,
    int planOrder
) {
    public Hypothesis {
        if (type == null || description == null || source == null) {
            throw new IllegalArgumentException("type, description and source are required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        if (evidence == null || evidence.isEmpty()) {
            throw new IllegalArgumentException("A hypothesis must cite at least one fact: " + description);
        }
        evidence = List.copyOf(evidence);
    }
    
    /**
     * Scale confidence by {@code factor}, clamped into [0, 1].
     */
    public Hypothesis scaled(double factor) {
        return new Hypothesis(type, description,
            IncidentClassification.clamp(confidence * factor), evidence, source, planOrder);
    }
}
