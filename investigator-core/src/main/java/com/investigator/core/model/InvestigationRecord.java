package com.investigator.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Serializable record of one investigation, handed to the audit sink.
 * The investigator emits it but never persists it.
 * 
 * Invariants:
 * - interpretation is null iff outcome == COULD_NOT_RUN
 */
public record InvestigationRecord(
    UUID investigationId,
    String query,
    IncidentContext hints,
    IncidentClassification classification,
    DiagnosticPlan plan,
    DiagnosticExecution execution,
    DiagnosticInterpretation interpretation,
    InvestigationOutcome outcome,
    Instant startedAt,
    Instant completedAt
) {
    public InvestigationRecord {
        if (investigationId == null || classification == null || plan == null || execution == null || outcome == null) {
            throw new IllegalArgumentException("investigationId, classification, plan, execution and outcome are required");
        }
        if ((outcome == InvestigationOutcome.COULD_NOT_RUN) != (interpretation == null)) {
            throw new IllegalArgumentException("interpretation must be absent exactly when the investigation could not run");
        }
    }
    
    /**
     * Derive the outcome of an investigation that produced an interpretation.
     */
    public static InvestigationOutcome outcomeOf(DiagnosticExecution execution, DiagnosticInterpretation interpretation) {
        if (!interpretation.hypotheses().isEmpty()) {
            return InvestigationOutcome.INCIDENT_EXPLAINED;
        }
        return execution.usableFacts().isEmpty()
            ? InvestigationOutcome.INCONCLUSIVE
            : InvestigationOutcome.NO_INCIDENT_FOUND;
    }
}
