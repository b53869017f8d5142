package com.investigator.core.exception;

/**
 * Thrown when a primitive is invoked in violation of its parameter contract.
 * This is a programmer error and is never converted into a failed fact.
 */
public class ParameterContractException extends InvestigatorException {
    
    public static final String ERROR_CODE = "INVALID_PARAMETER_CONTRACT";
    
    public ParameterContractException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ParameterContractException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid primitive parameter: %s - %s", field, reason));
    }
}
