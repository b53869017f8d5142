package com.investigator.core.llm;

import java.util.Locale;

/**
 * How much reasoning effort to ask of the language model.
 * NONE disables the model; callers take their deterministic path.
 */
public enum ModelMode {
    NONE,
    FAST,
    BALANCED,
    DEEP;
    
    public boolean isEnabled() {
        return this != NONE;
    }
    
    public static ModelMode parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
