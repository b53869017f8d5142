package com.investigator.core.exception;

/**
 * Base exception for all investigator errors.
 * Unchecked subclasses signal defects or aborted investigations, never
 * environmental failures of a single primitive.
 */
public class InvestigatorException extends RuntimeException {
    
    private final String errorCode;
    
    public InvestigatorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public InvestigatorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
