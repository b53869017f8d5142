package com.investigator.core.model;

/**
 * Completeness of a single observation.
 */
public enum FactStatus {
    /**
     * Observation is complete.
     */
    OK,
    
    /**
     * Observation is usable but some of the underlying reads failed or returned no data.
     */
    PARTIAL,
    
    /**
     * Nothing could be observed. Carries an error message.
     */
    FAILED;
    
    /**
     * Whether facts with this status may support findings and hypotheses.
     */
    public boolean isUsable() {
        return this != FAILED;
    }
}
