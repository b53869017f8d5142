package com.investigator.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Findings, ranked hypotheses and prioritized actions for one execution.
 * 
 * Invariants:
 * - every hypothesis cites facts of this executionId only
 * - hypotheses are ordered by confidence descending, then plan order
 * - overallConfidence in [0, 1]
 */
public record DiagnosticInterpretation(
    UUID executionId,
    ExecutionStatus executionStatus,
    List<String> keyFindings,
    List<Hypothesis> hypotheses,
    List<RecommendedAction> recommendedActions,
    double overallConfidence,
    boolean requiresHumanReview
) {
    public DiagnosticInterpretation {
        if (executionId == null) {
            throw new IllegalArgumentException("executionId is required");
        }
        keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
        hypotheses = hypotheses == null ? List.of() : List.copyOf(hypotheses);
        recommendedActions = recommendedActions == null ? List.of() : List.copyOf(recommendedActions);
        for (Hypothesis hypothesis : hypotheses) {
            for (FactRef ref : hypothesis.evidence()) {
                if (!executionId.equals(ref.executionId())) {
                    throw new IllegalArgumentException(
                        "Hypothesis cites a fact from execution " + ref.executionId() + ": " + hypothesis.description());
                }
            }
        }
        if (Double.isNaN(overallConfidence) || overallConfidence < 0.0 || overallConfidence > 1.0) {
            throw new IllegalArgumentException("overallConfidence must be in [0, 1]: " + overallConfidence);
        }
    }
    
    public Optional<Hypothesis> topHypothesis() {
        return hypotheses.stream().findFirst();
    }
    
    /**
     * The investigation ran but no explanation was supported by the facts.
     */
    @JsonIgnore
    public boolean isNoIncidentFound() {
        return hypotheses.isEmpty();
    }
    
    public DiagnosticInterpretation withHumanReviewRequired() {
        if (requiresHumanReview) {
            return this;
        }
        return new DiagnosticInterpretation(executionId, executionStatus, keyFindings, hypotheses,
            recommendedActions, overallConfidence, true);
    }
}
