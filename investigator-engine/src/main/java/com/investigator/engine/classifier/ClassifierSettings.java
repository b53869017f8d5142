package com.investigator.engine.classifier;

import com.investigator.core.llm.ModelMode;

/**
 * Classification tuning.
 * 
 * @param confidenceThreshold  classifications below this are flagged for review
 * @param fallbackConfidence   confidence assigned to keyword matches
 * @param unmatchedConfidence  confidence of the default class when nothing matches
 * @param modelMode            reasoning effort for the model call; NONE skips the model
 */
public record ClassifierSettings(
    double confidenceThreshold,
    double fallbackConfidence,
    double unmatchedConfidence,
    ModelMode modelMode
) {
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.6;
    public static final double DEFAULT_FALLBACK_CONFIDENCE = 0.5;
    public static final double DEFAULT_UNMATCHED_CONFIDENCE = 0.3;
    
    public ClassifierSettings {
        checkUnit("confidenceThreshold", confidenceThreshold);
        checkUnit("fallbackConfidence", fallbackConfidence);
        checkUnit("unmatchedConfidence", unmatchedConfidence);
        modelMode = modelMode == null ? ModelMode.BALANCED : modelMode;
    }
    
    public static ClassifierSettings defaults() {
        return new ClassifierSettings(DEFAULT_CONFIDENCE_THRESHOLD, DEFAULT_FALLBACK_CONFIDENCE,
            DEFAULT_UNMATCHED_CONFIDENCE, ModelMode.BALANCED);
    }
    
    public ClassifierSettings withModelMode(ModelMode modelMode) {
        return new ClassifierSettings(confidenceThreshold, fallbackConfidence, unmatchedConfidence, modelMode);
    }
    
    private static void checkUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0, 1]: " + value);
        }
    }
}
