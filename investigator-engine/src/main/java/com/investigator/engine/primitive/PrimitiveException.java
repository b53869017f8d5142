package com.investigator.engine.primitive;

/**
 * Checked exception for primitive-level failures.
 * Converted into a failed fact; never aborts an execution.
 */
public class PrimitiveException extends Exception {
    
    public static final String NO_DATA = "NO_DATA";
    public static final String MISSING_PARAMETER = "MISSING_PARAMETER";
    public static final String CAPABILITY_UNAVAILABLE = "CAPABILITY_UNAVAILABLE";
    
    private final String errorCode;
    
    public PrimitiveException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public PrimitiveException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public static PrimitiveException noData(String message) {
        return new PrimitiveException(NO_DATA, message);
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
