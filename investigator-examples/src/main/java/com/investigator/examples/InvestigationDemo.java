package com.investigator.examples;

import com.investigator.core.exception.InvestigationAbortedException;
import com.investigator.core.model.DiagnosticInterpretation;
import com.investigator.core.model.Hypothesis;
import com.investigator.core.model.IncidentContext;
import com.investigator.core.model.InvestigationRecord;
import com.investigator.core.model.RecommendedAction;
import com.investigator.core.model.ResourceRef;
import com.investigator.core.model.StepStatus;
import com.investigator.core.provider.ChangeEvent;
import com.investigator.core.provider.ConnectivityResult;
import com.investigator.core.provider.MetricId;
import com.investigator.core.provider.MetricSeries;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.core.provider.TimeWindow;
import com.investigator.engine.audit.InMemoryAuditSink;
import com.investigator.engine.classifier.IncidentClassifier;
import com.investigator.engine.executor.DiagnosticExecutor;
import com.investigator.engine.executor.ExecutorSettings;
import com.investigator.engine.interpreter.DiagnosticInterpreter;
import com.investigator.engine.metrics.InvestigationMetrics;
import com.investigator.engine.planner.ReasoningPlanner;
import com.investigator.engine.planner.StrategyTable;
import com.investigator.engine.primitive.PrimitiveRegistry;
import com.investigator.engine.service.DiagnosticInvestigator;
import com.investigator.engine.service.InvestigationService.InvestigationRequest;
import com.investigator.examples.scenario.IncidentScenarios;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demonstration runner for the incident investigator.
 * 
 * Shows:
 * 1. RDS high CPU explained by a recent parameter group change
 * 2. Connection refused explained by a failing dependency
 * 3. Expired credentials reported as "could not run", not "no incident"
 */
public class InvestigationDemo {
    
    private static final Logger log = LoggerFactory.getLogger(InvestigationDemo.class);
    
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    
    private final InvestigationMetrics metrics = new InvestigationMetrics();
    private final InMemoryAuditSink auditSink = new InMemoryAuditSink();
    private final DiagnosticExecutor executor;
    private final DiagnosticInvestigator investigator;
    
    public InvestigationDemo() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        PrimitiveRegistry registry = PrimitiveRegistry.standard();
        this.executor = new DiagnosticExecutor(registry, ExecutorSettings.defaults(), clock, metrics);
        this.investigator = new DiagnosticInvestigator(
            new IncidentClassifier(),
            new ReasoningPlanner(StrategyTable.standard(), registry),
            executor,
            new DiagnosticInterpreter(),
            auditSink,
            metrics,
            clock);
    }
    
    public static void main(String[] args) {
        InvestigationDemo demo = new InvestigationDemo();
        
        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║          INCIDENT INVESTIGATOR - DIAGNOSTIC DEMONSTRATION            ║");
        log.info("╠══════════════════════════════════════════════════════════════════════╣");
        log.info("║  Classify, plan, execute and interpret with cited evidence           ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
        log.info("");
        
        try {
            demo.runScenario1_RdsHighCpu();
            demo.runScenario2_ConnectionRefused();
            demo.runScenario3_ExpiredCredentials();
        } finally {
            demo.executor.close();
        }
        
        log.info("");
        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║                    ALL DEMONSTRATIONS COMPLETE                       ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
        log.info("Audit records emitted: {}", demo.auditSink.records().size());
    }
    
    /**
     * SCENARIO 1: High CPU after a configuration change.
     */
    public void runScenario1_RdsHighCpu() {
        banner("SCENARIO 1: RDS High CPU After Parameter Change");
        
        InvestigationRecord record = investigator.run(
            InvestigationRequest.of("RDS database orders-db high CPU", null),
            IncidentScenarios.rdsHighCpuAfterParameterChange(NOW));
        report(record);
        
        log.info("✓ SCENARIO 1 COMPLETE: {}", record.outcome());
    }
    
    /**
     * SCENARIO 2: Connection refused from a dependency.
     */
    public void runScenario2_ConnectionRefused() {
        banner("SCENARIO 2: Connection Refused From Dependency");
        
        IncidentContext hints = IncidentContext.builder()
            .resourceType("lambda")
            .resourceId(IncidentScenarios.PAYMENTS_API)
            .build();
        InvestigationRecord record = investigator.run(
            InvestigationRequest.of("payments-api is getting connection refused", hints),
            IncidentScenarios.connectionRefusedFromDatabase(NOW));
        report(record);
        
        log.info("✓ SCENARIO 2 COMPLETE: {}", record.outcome());
    }
    
    /**
     * SCENARIO 3: The provider rejects credentials on the first call.
     */
    public void runScenario3_ExpiredCredentials() {
        banner("SCENARIO 3: Expired Credentials");
        
        try {
            investigator.run(InvestigationRequest.of("EC2 i-0abc12345def67890 high cpu", null),
                new ExpiredCredentialsProvider());
            log.warn("Expected the investigation to abort");
        } catch (InvestigationAbortedException e) {
            log.info("Investigation could not run: {} ({})", e.getExecution().abortReason(), e.getAbortCode());
            log.info("Steps skipped after abort: {}",
                e.getExecution().countSteps(StepStatus.SKIPPED));
            log.info("✓ SCENARIO 3 COMPLETE: reported as could-not-run");
        }
    }
    
    private void report(InvestigationRecord record) {
        log.info("Classified as {} ({}, confidence {})", record.classification().primaryClass().wireName(),
            record.classification().method(), record.classification().confidence());
        log.info("Plan: {}", record.plan().primitiveNames());
        log.info("Execution: {} with {} facts", record.execution().status(), record.execution().facts().size());
        
        DiagnosticInterpretation interpretation = record.interpretation();
        log.info("");
        log.info("Key findings:");
        interpretation.keyFindings().forEach(finding -> log.info("  - {}", finding));
        log.info("Hypotheses:");
        for (Hypothesis hypothesis : interpretation.hypotheses()) {
            log.info("  [{}] {} - {} (evidence: {})", String.format("%.2f", hypothesis.confidence()),
                hypothesis.type(), hypothesis.description(),
                hypothesis.evidence().stream().map(ref -> "#" + ref.index()).toList());
        }
        log.info("Recommended actions:");
        for (RecommendedAction action : interpretation.recommendedActions()) {
            log.info("  {}. {}{}{}", action.rank(), action.description(),
                action.command() == null ? "" : "  $ " + action.command(),
                action.requiresApproval() ? "  (requires approval)" : "");
        }
        log.info("Overall confidence {}, human review {}", String.format("%.2f", interpretation.overallConfidence()),
            interpretation.requiresHumanReview() ? "required" : "not required");
        log.info("");
    }
    
    private static void banner(String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info(title);
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info("");
    }
    
    /**
     * Provider whose session token has expired.
     */
    static class ExpiredCredentialsProvider implements ResourceProvider {
        
        private static ProviderException expired() {
            return ProviderException.authentication("The security token included in the request is expired");
        }
        
        @Override
        public MetricSeries readMetricSeries(ResourceRef resource, MetricId metric, TimeWindow window)
                throws ProviderException {
            throw expired();
        }
        
        @Override
        public List<ChangeEvent> readRecentChanges(ResourceRef resource, TimeWindow window) throws ProviderException {
            throw expired();
        }
        
        @Override
        public List<ResourceRef> readDependencies(ResourceRef resource) throws ProviderException {
            throw expired();
        }
        
        @Override
        public Map<String, String> readConfiguration(ResourceRef resource) throws ProviderException {
            throw expired();
        }
        
        @Override
        public ConnectivityResult checkConnectivity(ResourceRef from, ResourceRef to) throws ProviderException {
            throw expired();
        }
    }
}
