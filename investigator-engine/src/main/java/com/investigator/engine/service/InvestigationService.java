package com.investigator.engine.service;

import com.investigator.core.exception.InvestigationAbortedException;
import com.investigator.core.model.DiagnosticInterpretation;
import com.investigator.core.model.IncidentContext;
import com.investigator.core.model.InvestigationRecord;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.executor.CancellationSignal;

/**
 * Entry point for incident investigations.
 * 
 * Investigations are synchronous and read-only towards the cloud: a provider is
 * only ever read. Calling twice with identical inputs against an unchanged
 * provider yields the same plan, facts and hypotheses.
 */
public interface InvestigationService {

    /**
     * Investigate an incident and return the interpretation.
     * 
     * @param query    free-text incident description
     * @param hints    optional caller context; present fields override extracted ones
     * @param provider read-only source of cloud observations
     * @return the interpretation
     * @throws InvestigationAbortedException when the investigation could not run
     */
    DiagnosticInterpretation investigate(String query, IncidentContext hints, ResourceProvider provider);

    /**
     * Investigate an incident and return the full record: classification, plan,
     * execution, interpretation and outcome.
     * 
     * @throws InvestigationAbortedException when the investigation could not run
     */
    InvestigationRecord run(InvestigationRequest request, ResourceProvider provider);

    /**
     * Request to investigate an incident.
     * 
     * @param query        free-text incident description
     * @param hints        optional caller context
     * @param cancellation optional cancellation signal
     */
    record InvestigationRequest(
        String query,
        IncidentContext hints,
        CancellationSignal cancellation
    ) {
        public InvestigationRequest {
            if (query == null || query.isBlank()) {
                throw new IllegalArgumentException("query is required");
            }
            cancellation = cancellation == null ? CancellationSignal.create() : cancellation;
        }
        
        public static InvestigationRequest of(String query, IncidentContext hints) {
            return new InvestigationRequest(query, hints, null);
        }
    }
}
