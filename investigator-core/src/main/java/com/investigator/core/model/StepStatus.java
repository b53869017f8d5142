package com.investigator.core.model;

/**
 * Outcome of one plan step.
 */
public enum StepStatus {
    SUCCEEDED,
    PARTIAL,
    FAILED,
    TIMED_OUT,
    
    /**
     * Not run because the investigation was cancelled or aborted first.
     */
    SKIPPED;
    
    /**
     * Whether this outcome degrades the execution.
     */
    public boolean isDegrading() {
        return this == PARTIAL || this == FAILED || this == TIMED_OUT;
    }
}
