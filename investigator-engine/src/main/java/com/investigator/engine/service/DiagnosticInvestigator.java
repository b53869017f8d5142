package com.investigator.engine.service;

import com.investigator.core.exception.InvestigationAbortedException;
import com.investigator.core.model.DiagnosticExecution;
import com.investigator.core.model.DiagnosticInterpretation;
import com.investigator.core.model.DiagnosticPlan;
import com.investigator.core.model.IncidentClassification;
import com.investigator.core.model.IncidentContext;
import com.investigator.core.model.InvestigationOutcome;
import com.investigator.core.model.InvestigationRecord;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.audit.AuditSink;
import com.investigator.engine.classifier.IncidentClassifier;
import com.investigator.engine.executor.DiagnosticExecutor;
import com.investigator.engine.interpreter.DiagnosticInterpreter;
import com.investigator.engine.logging.LoggingContext;
import com.investigator.engine.metrics.InvestigationMetrics;
import com.investigator.engine.planner.ReasoningPlanner;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the classify, plan, execute, interpret pipeline.
 * 
 * Every investigation produces exactly one audit record, including those that
 * could not run. A classification below the confidence threshold always
 * requires human review of the interpretation.
 */
public class DiagnosticInvestigator implements InvestigationService {
    
    private static final Logger log = LoggerFactory.getLogger(DiagnosticInvestigator.class);
    
    private final IncidentClassifier classifier;
    private final ReasoningPlanner planner;
    private final DiagnosticExecutor executor;
    private final DiagnosticInterpreter interpreter;
    private final AuditSink auditSink;
    private final InvestigationMetrics metrics;
    private final Clock clock;
    
    public DiagnosticInvestigator(
            IncidentClassifier classifier,
            ReasoningPlanner planner,
            DiagnosticExecutor executor,
            DiagnosticInterpreter interpreter,
            AuditSink auditSink,
            InvestigationMetrics metrics,
            Clock clock) {
        
        this.classifier = classifier;
        this.planner = planner;
        this.executor = executor;
        this.interpreter = interpreter;
        this.auditSink = auditSink;
        this.metrics = metrics;
        this.clock = clock;
    }
    
    @Override
    public DiagnosticInterpretation investigate(String query, IncidentContext hints, ResourceProvider provider) {
        return run(InvestigationRequest.of(query, hints), provider).interpretation();
    }
    
    @Override
    public InvestigationRecord run(InvestigationRequest request, ResourceProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider is required");
        }
        UUID investigationId = UUID.randomUUID();
        Instant startedAt = clock.instant();
        metrics.investigationStarted();
        
        IncidentClassification classification = null;
        InvestigationOutcome outcome = InvestigationOutcome.COULD_NOT_RUN;
        try (LoggingContext ignored = LoggingContext.forInvestigation(investigationId)) {
            log.info("Investigating: {}", request.query());
            
            classification = classifier.classify(request.query(), request.hints());
            DiagnosticPlan plan = planner.plan(classification);
            log.info("Planned {} steps for {}: {}", plan.steps().size(),
                classification.primaryClass().wireName(), plan.primitiveNames());
            
            DiagnosticExecution execution = executor.execute(plan, provider, request.cancellation());
            
            if (!execution.status().isInterpretable()) {
                InvestigationRecord record = new InvestigationRecord(investigationId, request.query(),
                    request.hints(), classification, plan, execution, null, outcome, startedAt, clock.instant());
                log.error("Investigation could not run: {} ({})", execution.abortReason(), execution.abortCode());
                audit(record);
                throw new InvestigationAbortedException(record);
            }
            
            DiagnosticInterpretation interpretation = interpreter.interpret(execution);
            if (classification.belowThreshold()) {
                interpretation = interpretation.withHumanReviewRequired();
            }
            outcome = InvestigationRecord.outcomeOf(execution, interpretation);
            
            InvestigationRecord record = new InvestigationRecord(investigationId, request.query(),
                request.hints(), classification, plan, execution, interpretation, outcome, startedAt, clock.instant());
            log.info("Investigation finished: outcome={}, status={}, hypotheses={}, confidence={}",
                outcome, execution.status(), interpretation.hypotheses().size(), interpretation.overallConfidence());
            audit(record);
            return record;
        } finally {
            metrics.investigationFinished(outcome, classification == null ? null : classification.primaryClass(),
                Duration.between(startedAt, clock.instant()));
        }
    }
    
    private void audit(InvestigationRecord record) {
        try {
            auditSink.record(record);
        } catch (RuntimeException e) {
            log.warn("Audit sink failed for investigation {}", record.investigationId(), e);
        }
    }
}
