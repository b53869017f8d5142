package com.investigator.advisory;

import com.investigator.core.llm.ModelMode;

/**
 * Sampling settings for model calls.
 * 
 * @param temperature  sampling temperature; 0 keeps answers as repeatable as the backend allows
 * @param maxTokens    response budget for BALANCED mode; FAST halves it, DEEP doubles it
 */
public record ChatModelSettings(double temperature, int maxTokens) {
    
    public static final double DEFAULT_TEMPERATURE = 0.0;
    public static final int DEFAULT_MAX_TOKENS = 1000;
    
    public ChatModelSettings {
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be in [0, 2]: " + temperature);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
    }
    
    public static ChatModelSettings defaults() {
        return new ChatModelSettings(DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS);
    }
    
    public int maxTokensFor(ModelMode mode) {
        return switch (mode) {
            case FAST -> Math.max(1, maxTokens / 2);
            case DEEP -> maxTokens * 2;
            case BALANCED, NONE -> maxTokens;
        };
    }
}
