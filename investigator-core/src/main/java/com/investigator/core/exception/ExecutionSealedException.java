package com.investigator.core.exception;

import java.util.UUID;

/**
 * Thrown when something tries to append to an execution that has already been sealed.
 */
public class ExecutionSealedException extends InvestigatorException {
    
    public static final String ERROR_CODE = "EXECUTION_SEALED";
    
    private final UUID executionId;
    
    public ExecutionSealedException(UUID executionId) {
        super(ERROR_CODE, String.format("Execution %s is sealed; no further facts or steps may be recorded", executionId));
        this.executionId = executionId;
    }
    
    public UUID getExecutionId() {
        return executionId;
    }
}
