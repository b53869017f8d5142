package com.investigator.core.exception;

/**
 * Thrown when the strategy table is incomplete or malformed.
 * Always a defect: an unknown incident class, a missing strategy,
 * a duplicate entry or a primitive with no registered implementation.
 */
public class PlanningException extends InvestigatorException {
    
    public static final String ERROR_CODE = "PLANNING_FAILED";
    
    public PlanningException(String message) {
        super(ERROR_CODE, message);
    }
    
    public PlanningException(String subject, String reason) {
        super(ERROR_CODE, String.format("Invalid strategy table: %s - %s", subject, reason));
    }
}
