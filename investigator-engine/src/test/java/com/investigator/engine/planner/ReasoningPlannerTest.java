package com.investigator.engine.planner;

import com.investigator.core.exception.PlanningException;
import com.investigator.core.model.ClassificationMethod;
import com.investigator.core.model.DiagnosticPlan;
import com.investigator.core.model.IncidentClass;
import com.investigator.core.model.IncidentClassification;
import com.investigator.core.model.IncidentContext;
import com.investigator.core.model.PlanStep;
import com.investigator.core.model.PrimitiveName;
import com.investigator.engine.primitive.PrimitiveRegistry;
import com.investigator.engine.test.IncidentFixtures;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.investigator.core.model.PrimitiveName.*;
import static org.assertj.core.api.Assertions.*;

class ReasoningPlannerTest {

    private final ReasoningPlanner planner = new ReasoningPlanner(StrategyTable.standard(), PrimitiveRegistry.standard());

    // ========== Strategy Coverage ==========

    @Test
    @DisplayName("Every incident class plans a non-empty sequence without duplicates")
    void testEveryClassPlans() {
        for (IncidentClass incidentClass : IncidentClass.values()) {
            DiagnosticPlan plan = planner.plan(classification(incidentClass, List.of(), IncidentFixtures.dbContext()));

            assertThat(plan.steps()).as(incidentClass.wireName()).isNotEmpty();
            assertThat(Set.copyOf(plan.primitiveNames())).hasSameSizeAs(plan.primitiveNames());
        }
    }

    @Test
    @DisplayName("Resource saturation follows the strategy order")
    void testSaturationOrder() {
        DiagnosticPlan plan = planner.plan(IncidentFixtures.saturation(IncidentFixtures.dbContext()));

        assertThat(plan.primitiveNames()).containsExactly(
            ANALYZE_UTILIZATION, COMPARE_BASELINE, FIND_TOP_CONSUMERS, CHECK_SCALING_BEHAVIOR, CHECK_RECENT_CHANGES);
        assertThat(plan.steps()).extracting(PlanStep::index).containsExactly(0, 1, 2, 3, 4);
        assertThat(plan.steps().get(0).parameters().metric()).isEqualTo("cpu");
    }

    // ========== Secondary Classes ==========

    @Test
    @DisplayName("Secondary strategies append only primitives not yet planned")
    void testSecondaryDedup() {
        DiagnosticPlan plan = planner.plan(classification(IncidentClass.RESOURCE_SATURATION,
            List.of(IncidentClass.LOAD_SPIKE), IncidentFixtures.dbContext()));

        assertThat(plan.primitiveNames()).containsExactly(
            ANALYZE_UTILIZATION, COMPARE_BASELINE, FIND_TOP_CONSUMERS, CHECK_SCALING_BEHAVIOR, CHECK_RECENT_CHANGES,
            TRACE_DEPENDENCIES);
        PlanStep appended = plan.steps().get(5);
        assertThat(appended.sourceClass()).isEqualTo(IncidentClass.LOAD_SPIKE);
        assertThat(appended.parameters().metric()).isEqualTo("requests");
    }

    @Test
    @DisplayName("An explicit metric overrides every strategy default")
    void testExplicitMetric() {
        IncidentContext context = IncidentContext.builder()
            .resourceType("rds").resourceId("orders-db").metric("connections").build();

        DiagnosticPlan plan = planner.plan(classification(IncidentClass.RESOURCE_SATURATION,
            List.of(IncidentClass.LOAD_SPIKE), context));

        assertThat(plan.steps()).allSatisfy(step -> assertThat(step.parameters().metric()).isEqualTo("connections"));
    }

    // ========== Determinism ==========

    @Test
    @DisplayName("Equal classifications produce equal plans")
    void testDeterministicPlans() {
        IncidentClassification classification = classification(IncidentClass.DEPENDENCY_FAILURE,
            List.of(IncidentClass.NETWORK_CONNECTIVITY), IncidentFixtures.dbContext());

        DiagnosticPlan first = planner.plan(classification);
        DiagnosticPlan second = new ReasoningPlanner(StrategyTable.standard(), PrimitiveRegistry.standard())
            .plan(classification);

        assertThat(second).isEqualTo(first);
        assertThat(second.planId()).isEqualTo(first.planId());
    }

    @Test
    @DisplayName("Different resources produce different plan ids")
    void testPlanIdDependsOnContext() {
        IncidentContext other = IncidentContext.builder().resourceType("rds").resourceId("billing-db").build();

        DiagnosticPlan first = planner.plan(IncidentFixtures.saturation(IncidentFixtures.dbContext()));
        DiagnosticPlan second = planner.plan(IncidentFixtures.saturation(other));

        assertThat(second.planId()).isNotEqualTo(first.planId());
    }

    // ========== Missing Context ==========

    @Test
    @DisplayName("Primitives are planned even when the resource is unknown")
    void testMissingContextStillPlanned() {
        DiagnosticPlan plan = planner.plan(IncidentFixtures.saturation(IncidentContext.empty()));

        assertThat(plan.steps()).hasSize(5);
        assertThat(plan.steps().get(0).parameters().resource().hasId()).isFalse();
    }

    // ========== Table Validation ==========

    @Test
    @DisplayName("A table missing a class is rejected")
    void testIncompleteTable() {
        assertThatThrownBy(() -> StrategyTable.builder()
                .from(StrategyTable.standard())
                .remove(IncidentClass.COST_ANOMALY)
                .build())
            .isInstanceOf(PlanningException.class)
            .hasMessageContaining("cost_anomaly");
    }

    @Test
    @DisplayName("A strategy listing a primitive twice is rejected")
    void testDuplicatePrimitive() {
        assertThatThrownBy(() -> StrategyTable.builder()
                .from(StrategyTable.standard())
                .strategy(IncidentClass.COST_ANOMALY, "cost", "twice", ANALYZE_COST_TREND, ANALYZE_COST_TREND)
                .build())
            .isInstanceOf(PlanningException.class);
    }

    @Test
    @DisplayName("A table referencing an unregistered primitive is rejected by the planner")
    void testUnregisteredPrimitive() {
        PrimitiveRegistry.Builder partial = PrimitiveRegistry.builder();
        PrimitiveRegistry standard = PrimitiveRegistry.standard();
        for (PrimitiveName name : EnumSet.complementOf(EnumSet.of(CHECK_REPLICATION_LAG))) {
            partial.register(standard.get(name));
        }

        assertThatThrownBy(() -> new ReasoningPlanner(StrategyTable.standard(), partial.build()))
            .isInstanceOf(PlanningException.class)
            .hasMessageContaining("check_replication_lag");
    }

    private static IncidentClassification classification(
            IncidentClass primary, List<IncidentClass> secondaries, IncidentContext context) {
        return IncidentClassification.create(primary, secondaries, context, 0.9, ClassificationMethod.MODEL, 0.6);
    }
}
