package com.investigator.engine.interpreter;

import com.investigator.core.llm.ModelMode;

/**
 * Interpretation tuning.
 * 
 * @param degradedPenalty         factor applied to every confidence when evidence is missing
 * @param reviewThreshold         top confidence below which a human must review
 * @param modelHypothesesEnabled  whether to ask the model for additional causes
 * @param maxModelHypotheses      cap on accepted model hypotheses
 * @param modelMode               reasoning effort for the model call
 */
public record InterpreterSettings(
    double degradedPenalty,
    double reviewThreshold,
    boolean modelHypothesesEnabled,
    int maxModelHypotheses,
    ModelMode modelMode
) {
    public static final double DEFAULT_DEGRADED_PENALTY = 0.8;
    public static final double DEFAULT_REVIEW_THRESHOLD = 0.5;
    public static final int DEFAULT_MAX_MODEL_HYPOTHESES = 3;
    
    public InterpreterSettings {
        if (degradedPenalty < 0.0 || degradedPenalty > 1.0) {
            throw new IllegalArgumentException("degradedPenalty must be in [0, 1]: " + degradedPenalty);
        }
        if (maxModelHypotheses < 0) {
            throw new IllegalArgumentException("maxModelHypotheses must be non-negative: " + maxModelHypotheses);
        }
        modelMode = modelMode == null ? ModelMode.BALANCED : modelMode;
    }
    
    public static InterpreterSettings defaults() {
        return new InterpreterSettings(DEFAULT_DEGRADED_PENALTY, DEFAULT_REVIEW_THRESHOLD, true,
            DEFAULT_MAX_MODEL_HYPOTHESES, ModelMode.BALANCED);
    }
    
    /**
     * Rule-based interpretation only.
     */
    public static InterpreterSettings rulesOnly() {
        return new InterpreterSettings(DEFAULT_DEGRADED_PENALTY, DEFAULT_REVIEW_THRESHOLD, false, 0, ModelMode.NONE);
    }
}
