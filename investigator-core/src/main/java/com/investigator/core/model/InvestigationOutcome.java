package com.investigator.core.model;

/**
 * What an investigation concluded, from the caller's point of view.
 */
public enum InvestigationOutcome {
    /**
     * At least one evidence-backed hypothesis.
     */
    INCIDENT_EXPLAINED,
    
    /**
     * Primitives returned usable facts but none supported a hypothesis.
     */
    NO_INCIDENT_FOUND,
    
    /**
     * The plan ran but no primitive returned a usable fact.
     */
    INCONCLUSIVE,
    
    /**
     * The investigation could not run. No interpretation exists.
     */
    COULD_NOT_RUN
}
