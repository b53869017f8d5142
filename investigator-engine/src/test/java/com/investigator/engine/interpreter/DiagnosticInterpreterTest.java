package com.investigator.engine.interpreter;

import com.investigator.core.model.DiagnosticExecution;
import com.investigator.core.model.DiagnosticInterpretation;
import com.investigator.core.model.DiagnosticPlan;
import com.investigator.core.model.ExecutionStatus;
import com.investigator.core.model.FactRef;
import com.investigator.core.model.Hypothesis;
import com.investigator.core.model.HypothesisSource;
import com.investigator.core.model.HypothesisType;
import com.investigator.core.model.RecommendedAction;
import com.investigator.core.model.ResourceRef;
import com.investigator.core.provider.ConsumerUsage;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.core.provider.ScalingState;
import com.investigator.core.test.FailureInjector;
import com.investigator.core.test.TimeController;
import com.investigator.engine.executor.DiagnosticExecutor;
import com.investigator.engine.executor.ExecutorSettings;
import com.investigator.engine.metrics.InvestigationMetrics;
import com.investigator.engine.planner.ReasoningPlanner;
import com.investigator.engine.planner.StrategyTable;
import com.investigator.engine.primitive.PrimitiveRegistry;
import com.investigator.engine.provider.InMemoryResourceProvider;
import com.investigator.engine.test.ScriptedLanguageModel;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.investigator.engine.test.IncidentFixtures.*;
import static org.assertj.core.api.Assertions.*;

class DiagnosticInterpreterTest {

    private DiagnosticExecutor executor;
    private DiagnosticPlan plan;
    private DiagnosticInterpreter interpreter;

    @BeforeEach
    void setUp() {
        executor = new DiagnosticExecutor(PrimitiveRegistry.standard(), ExecutorSettings.defaults(),
            TimeController.frozenAt(NOW), new InvestigationMetrics());
        plan = new ReasoningPlanner(StrategyTable.standard(), PrimitiveRegistry.standard())
            .plan(saturation(dbContext()));
        interpreter = new DiagnosticInterpreter();
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    // ========== Rule Hypotheses ==========

    @Test
    @DisplayName("High CPU after a parameter change is explained as a configuration regression")
    void testConfigurationRegression() {
        DiagnosticExecution execution = executor.execute(plan, highCpuAfterParameterChange().build());

        DiagnosticInterpretation result = interpreter.interpret(execution);

        assertThat(result.hypotheses()).hasSize(1);
        Hypothesis top = result.topHypothesis().orElseThrow();
        assertThat(top.type()).isEqualTo(HypothesisType.CONFIGURATION_REGRESSION);
        assertThat(top.source()).isEqualTo(HypothesisSource.RULE);
        assertThat(top.confidence()).isCloseTo(0.9, within(1e-9));
        assertThat(top.description()).contains("ModifyDBParameterGroup");
        assertThat(top.evidence()).extracting(FactRef::index).containsExactly(0, 1, 4);
        assertThat(top.planOrder()).isZero();
        assertThat(result.overallConfidence()).isCloseTo(0.9, within(1e-9));
        assertThat(result.requiresHumanReview()).isFalse();
        assertThat(result.keyFindings()).hasSize(5);
    }

    @Test
    @DisplayName("Actions follow the top hypothesis with commands rendered for the resource")
    void testRecommendedActions() {
        DiagnosticExecution execution = executor.execute(plan, highCpuAfterParameterChange().build());

        List<RecommendedAction> actions = interpreter.interpret(execution).recommendedActions();

        assertThat(actions).extracting(RecommendedAction::rank).containsExactly(1, 2);
        assertThat(actions.get(0).command()).isEqualTo("investigate changes --resource rds/orders-db --since 24h");
        assertThat(actions.get(0).requiresApproval()).isFalse();
        assertThat(actions.get(1).requiresApproval()).isTrue();
        assertThat(actions).allSatisfy(action ->
            assertThat(action.hypothesisType()).isEqualTo(HypothesisType.CONFIGURATION_REGRESSION));
    }

    @Test
    @DisplayName("Commands are omitted when the resource id is unknown")
    void testCommandWithoutResourceId() {
        ActionTable.ActionTemplate template = ActionTable.standard()
            .actionsFor(HypothesisType.CONFIGURATION_REGRESSION).get(0);

        assertThat(template.render(ResourceRef.of("rds", null))).isNull();
        assertThat(template.render(DB)).contains("rds/orders-db");
    }

    @Test
    @DisplayName("Quiet resource yields no hypotheses and asks for review")
    void testNoIncidentFound() {
        InMemoryResourceProvider.Builder quiet = InMemoryResourceProvider.builder();
        for (int i = 0; i < 6; i++) {
            quiet.point(ORDERS_DB, "CPUUtilization", NOW.minus(Duration.ofMinutes(50 - i * 10L)), 35.0);
            quiet.point(ORDERS_DB, "CPUUtilization", NOW.minus(Duration.ofMinutes(50 - i * 10L)).minus(Duration.ofDays(1)), 33.0);
        }
        quiet.consumers(ORDERS_DB, List.of(
            new ConsumerUsage("checkout-service", 20.0), new ConsumerUsage("batch", 15.0), new ConsumerUsage("sync", 15.0)));
        quiet.scaling(ORDERS_DB, new ScalingState(true, 1, 4, 1, 1, List.of()));

        DiagnosticExecution execution = executor.execute(plan, quiet.build());
        DiagnosticInterpretation result = interpreter.interpret(execution);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETE);
        assertThat(result.isNoIncidentFound()).isTrue();
        assertThat(result.overallConfidence()).isZero();
        assertThat(result.requiresHumanReview()).isTrue();
        assertThat(result.recommendedActions()).isEmpty();
    }

    // ========== Degraded Executions ==========

    @Test
    @DisplayName("Degraded executions discount every hypothesis and require review")
    void testDegradedPenalty() {
        ResourceProvider provider = FailureInjector.wrap(highCpuAfterParameterChange().build())
            .failOn(ProviderCapability.SCALING_STATE, ProviderException.THROTTLED)
            .build();
        DiagnosticExecution execution = executor.execute(plan, provider);

        DiagnosticInterpretation result = interpreter.interpret(execution);

        assertThat(result.executionStatus()).isEqualTo(ExecutionStatus.DEGRADED);
        assertThat(result.overallConfidence()).isCloseTo(0.72, within(1e-9));
        assertThat(result.requiresHumanReview()).isTrue();
        assertThat(result.keyFindings()).hasSize(4);
    }

    @Test
    @DisplayName("Fatal executions cannot be interpreted")
    void testFatalRejected() {
        ResourceProvider provider = FailureInjector.wrap(highCpuAfterParameterChange().build())
            .failGlobally(ProviderException.AUTHENTICATION_FAILED)
            .build();
        DiagnosticExecution execution = executor.execute(plan, provider);

        assertThatThrownBy(() -> interpreter.interpret(execution))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("FATAL");
    }

    @Test
    @DisplayName("Interpreting the same execution twice gives the same result")
    void testIdempotent() {
        DiagnosticExecution execution = executor.execute(plan, highCpuAfterParameterChange().build());

        assertThat(interpreter.interpret(execution)).isEqualTo(interpreter.interpret(execution));
    }

    // ========== Model Hypotheses ==========

    @Test
    @DisplayName("Model hypotheses are kept only when every cited fact exists and is usable")
    void testModelHypothesisValidation() {
        ScriptedLanguageModel model = new ScriptedLanguageModel().respond("""
            {"hypotheses": [
              {"cause": "Reporting job holds long-running locks", "confidence": 0.6, "evidence": [2]},
              {"cause": "Cosmic rays", "confidence": 0.95, "evidence": [99]},
              {"cause": "Bad index", "confidence": 0.5, "evidence": []},
              {"cause": "Negative", "confidence": 0.5, "evidence": [-1]},
              {"cause": "Fractional", "confidence": 0.5, "evidence": [1.5]}
            ]}""");
        InvestigationMetrics metrics = new InvestigationMetrics();
        DiagnosticInterpreter withModel = new DiagnosticInterpreter(HypothesisRules.standard(),
            ActionTable.standard(), InterpreterSettings.defaults(), model, metrics);
        DiagnosticExecution execution = executor.execute(plan, highCpuAfterParameterChange().build());

        DiagnosticInterpretation result = withModel.interpret(execution);

        assertThat(result.hypotheses()).extracting(Hypothesis::source)
            .containsExactly(HypothesisSource.RULE, HypothesisSource.MODEL);
        Hypothesis proposed = result.hypotheses().get(1);
        assertThat(proposed.type()).isEqualTo(HypothesisType.MODEL_PROPOSED);
        assertThat(proposed.evidence()).containsExactly(new FactRef(execution.executionId(), 2));
        assertThat(rejections(metrics, "invalid_evidence")).isEqualTo(3.0);
        assertThat(rejections(metrics, "missing_evidence")).isEqualTo(1.0);
        assertThat(model.prompts().get(0)).contains("[2] find_top_consumers on rds/orders-db");
    }

    @Test
    @DisplayName("Model failure leaves the rule hypotheses intact")
    void testModelUnavailable() {
        ScriptedLanguageModel model = new ScriptedLanguageModel().failNext("timeout");
        DiagnosticInterpreter withModel = new DiagnosticInterpreter(HypothesisRules.standard(),
            ActionTable.standard(), InterpreterSettings.defaults(), model, new InvestigationMetrics());
        DiagnosticExecution execution = executor.execute(plan, highCpuAfterParameterChange().build());

        DiagnosticInterpretation result = withModel.interpret(execution);

        assertThat(result.hypotheses()).singleElement()
            .extracting(Hypothesis::type).isEqualTo(HypothesisType.CONFIGURATION_REGRESSION);
    }

    private static double rejections(InvestigationMetrics metrics, String reason) {
        var counter = metrics.registry().find(InvestigationMetrics.MODEL_REJECTIONS)
            .tag("component", ModelHypothesisProposer.COMPONENT)
            .tag("reason", reason)
            .counter();
        return counter == null ? 0.0 : counter.count();
    }
}
