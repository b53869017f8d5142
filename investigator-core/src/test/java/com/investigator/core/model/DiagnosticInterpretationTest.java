package com.investigator.core.model;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticInterpretationTest {

    private final UUID executionId = UUID.randomUUID();

    @Test
    void constructor_shouldRejectEvidenceFromAnotherExecution() {
        Hypothesis foreign = hypothesis(new FactRef(UUID.randomUUID(), 0), 0.7);
        
        assertThrows(IllegalArgumentException.class, () -> new DiagnosticInterpretation(
            executionId, ExecutionStatus.COMPLETE, List.of(), List.of(foreign), List.of(), 0.7, false));
    }

    @Test
    void hypothesis_shouldRequireEvidence() {
        assertThrows(IllegalArgumentException.class, () -> new Hypothesis(
            HypothesisType.TRAFFIC_SURGE, "no evidence", 0.5, List.of(), HypothesisSource.RULE, 0));
    }

    @Test
    void scaled_shouldClampIntoRange() {
        Hypothesis hypothesis = hypothesis(new FactRef(executionId, 0), 0.9);
        
        assertEquals(0.72, hypothesis.scaled(0.8).confidence(), 1e-9);
        assertEquals(1.0, hypothesis.scaled(2.0).confidence(), 1e-9);
    }

    @Test
    void noHypotheses_shouldMeanNoIncidentFound() {
        DiagnosticInterpretation interpretation = new DiagnosticInterpretation(
            executionId, ExecutionStatus.COMPLETE, List.of("cpu 40%"), null, null, 0.0, true);
        
        assertTrue(interpretation.isNoIncidentFound());
        assertTrue(interpretation.topHypothesis().isEmpty());
    }

    @Test
    void withHumanReviewRequired_shouldOnlySetTheFlag() {
        Hypothesis hypothesis = hypothesis(new FactRef(executionId, 0), 0.9);
        DiagnosticInterpretation interpretation = new DiagnosticInterpretation(
            executionId, ExecutionStatus.COMPLETE, List.of(), List.of(hypothesis), List.of(), 0.9, false);
        
        DiagnosticInterpretation reviewed = interpretation.withHumanReviewRequired();
        
        assertTrue(reviewed.requiresHumanReview());
        assertEquals(interpretation.hypotheses(), reviewed.hypotheses());
        assertSame(reviewed, reviewed.withHumanReviewRequired());
    }

    @Test
    void diagnosticPlan_sameContent_shouldShareId() {
        PrimitiveParameters params = new PrimitiveParameters(
            ResourceRef.of("ec2", "i-0abc"), "cpu", Duration.ofHours(1), "production");
        List<PlanStep> steps = List.of(
            new PlanStep(0, PrimitiveName.ANALYZE_UTILIZATION, params, IncidentClass.RESOURCE_SATURATION));
        
        DiagnosticPlan first = DiagnosticPlan.create(IncidentClass.RESOURCE_SATURATION, List.of(), steps);
        DiagnosticPlan second = DiagnosticPlan.create(IncidentClass.RESOURCE_SATURATION, List.of(), steps);
        
        assertEquals(first, second);
        assertEquals(Duration.ofSeconds(3), DiagnosticPlan.ESTIMATED_STEP_DURATION);
    }

    @Test
    void diagnosticPlan_shouldRejectDuplicateOrMisnumberedSteps() {
        PrimitiveParameters params = new PrimitiveParameters(
            ResourceRef.of("ec2", "i-0abc"), "cpu", Duration.ofHours(1), "production");
        PlanStep first = new PlanStep(0, PrimitiveName.ANALYZE_UTILIZATION, params, IncidentClass.RESOURCE_SATURATION);
        
        assertThrows(IllegalArgumentException.class, () -> new DiagnosticPlan(UUID.randomUUID(),
            IncidentClass.RESOURCE_SATURATION, List.of(), List.of(first,
                new PlanStep(1, PrimitiveName.ANALYZE_UTILIZATION, params, IncidentClass.LOAD_SPIKE))));
        assertThrows(IllegalArgumentException.class, () -> new DiagnosticPlan(UUID.randomUUID(),
            IncidentClass.RESOURCE_SATURATION, List.of(), List.of(
                new PlanStep(1, PrimitiveName.COMPARE_BASELINE, params, IncidentClass.RESOURCE_SATURATION))));
    }
    
    private Hypothesis hypothesis(FactRef ref, double confidence) {
        return new Hypothesis(HypothesisType.TRAFFIC_SURGE, "Traffic surge", confidence,
            List.of(ref), HypothesisSource.RULE, 0);
    }
}
