package com.investigator.core.model;

/**
 * Outcome of a sealed diagnostic execution. An execution only carries a
 * status once its recorder has sealed it.
 */
public enum ExecutionStatus {
    /**
     * Every step produced complete facts.
     */
    COMPLETE,
    
    /**
     * All steps ran but at least one failed, timed out or returned partial facts.
     * Results are usable with reduced confidence.
     */
    DEGRADED,
    
    /**
     * Caller cancelled. Facts collected before cancellation are kept.
     */
    CANCELLED,
    
    /**
     * Investigation could not run: provider global failure or empty plan.
     */
    FATAL;
    
    /**
     * Whether facts from an execution in this state may be interpreted.
     */
    public boolean isInterpretable() {
        return this == COMPLETE || this == DEGRADED || this == CANCELLED;
    }
    
    /**
     * Whether interpretation must discount confidence for missing evidence.
     */
    public boolean isDegraded() {
        return this == DEGRADED || this == CANCELLED;
    }
}
