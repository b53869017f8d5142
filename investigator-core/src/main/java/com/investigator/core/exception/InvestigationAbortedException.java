package com.investigator.core.exception;

import com.investigator.core.model.DiagnosticExecution;
import com.investigator.core.model.InvestigationRecord;

/**
 * The investigation could not run.
 * 
 * Distinct from an investigation that ran and found nothing: this is raised
 * only when the provider reported a global failure (authentication, loss of
 * connectivity) or the plan was empty. The sealed fatal execution and the
 * audit record are attached so callers can report what was attempted.
 */
public class InvestigationAbortedException extends InvestigatorException {
    
    public static final String ERROR_CODE = "INVESTIGATION_ABORTED";
    
    private final transient InvestigationRecord record;
    
    public InvestigationAbortedException(InvestigationRecord record) {
        super(ERROR_CODE, String.format("Investigation %s could not run: %s",
            record.investigationId(), record.execution().abortReason()));
        this.record = record;
    }
    
    public InvestigationRecord getRecord() {
        return record;
    }
    
    public DiagnosticExecution getExecution() {
        return record.execution();
    }
    
    /**
     * The provider or executor error code that caused the abort.
     */
    public String getAbortCode() {
        return record.execution().abortCode();
    }
}
