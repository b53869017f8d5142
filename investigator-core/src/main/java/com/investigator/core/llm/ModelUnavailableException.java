package com.investigator.core.llm;

/**
 * The model backend failed or timed out. Callers fall back; this is never fatal.
 */
public class ModelUnavailableException extends Exception {
    
    public ModelUnavailableException(String message) {
        super(message);
    }
    
    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
