package com.investigator.engine.executor;

import com.investigator.core.model.PrimitiveName;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Timeouts for plan execution.
 * 
 * @param stepTimeout   default per-primitive timeout
 * @param stepTimeouts  per-primitive overrides
 */
public record ExecutorSettings(
    Duration stepTimeout,
    Map<PrimitiveName, Duration> stepTimeouts
) {
    public static final Duration DEFAULT_STEP_TIMEOUT = Duration.ofSeconds(30);
    
    public ExecutorSettings {
        if (stepTimeout == null || stepTimeout.isNegative() || stepTimeout.isZero()) {
            throw new IllegalArgumentException("stepTimeout must be positive: " + stepTimeout);
        }
        stepTimeouts = stepTimeouts == null ? Map.of() : Map.copyOf(stepTimeouts);
    }
    
    public static ExecutorSettings defaults() {
        return new ExecutorSettings(DEFAULT_STEP_TIMEOUT, Map.of());
    }
    
    public Duration timeoutFor(PrimitiveName primitive) {
        return stepTimeouts.getOrDefault(primitive, stepTimeout);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private Duration stepTimeout = DEFAULT_STEP_TIMEOUT;
        private final Map<PrimitiveName, Duration> stepTimeouts = new EnumMap<>(PrimitiveName.class);
        
        public Builder stepTimeout(Duration stepTimeout) {
            this.stepTimeout = stepTimeout;
            return this;
        }
        
        public Builder stepTimeout(PrimitiveName primitive, Duration timeout) {
            this.stepTimeouts.put(primitive, timeout);
            return this;
        }
        
        public ExecutorSettings build() {
            return new ExecutorSettings(stepTimeout, stepTimeouts);
        }
    }
}
