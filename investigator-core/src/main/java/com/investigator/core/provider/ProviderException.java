package com.investigator.core.provider;

/**
 * Checked exception thrown by resource providers.
 * 
 * A resource-scoped failure (throttled call, missing resource, no data) only
 * fails the primitive that made the call. A global failure (authentication
 * rejected, provider endpoint unreachable) affects every further call and
 * aborts the execution.
 */
public class ProviderException extends Exception {
    
    public static final String AUTHENTICATION_FAILED = "AUTHENTICATION_FAILED";
    public static final String PROVIDER_UNREACHABLE = "PROVIDER_UNREACHABLE";
    public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
    public static final String NO_DATA = "NO_DATA";
    public static final String THROTTLED = "THROTTLED";
    public static final String UNSUPPORTED = "UNSUPPORTED_CAPABILITY";
    
    private final String errorCode;
    private final boolean global;
    
    public ProviderException(String errorCode, String message, boolean global) {
        super(message);
        this.errorCode = errorCode;
        this.global = global;
    }
    
    public ProviderException(String errorCode, String message, boolean global, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.global = global;
    }
    
    /**
     * Failure scoped to one call or resource.
     */
    public static ProviderException resource(String errorCode, String message) {
        return new ProviderException(errorCode, message, false);
    }
    
    /**
     * Failure affecting every further call to this provider.
     */
    public static ProviderException global(String errorCode, String message) {
        return new ProviderException(errorCode, message, true);
    }
    
    public static ProviderException authentication(String message) {
        return global(AUTHENTICATION_FAILED, message);
    }
    
    public static ProviderException unsupported(ProviderCapability capability) {
        return resource(UNSUPPORTED, "Provider does not support " + capability);
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    public boolean isGlobal() {
        return global;
    }
}
