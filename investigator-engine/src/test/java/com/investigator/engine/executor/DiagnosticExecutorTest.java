package com.investigator.engine.executor;

import com.investigator.core.exception.ParameterContractException;
import com.investigator.core.model.DiagnosticExecution;
import com.investigator.core.model.DiagnosticPlan;
import com.investigator.core.model.ExecutionStatus;
import com.investigator.core.model.Fact;
import com.investigator.core.model.FactStatus;
import com.investigator.core.model.IncidentClass;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.core.model.ResourceRef;
import com.investigator.core.model.StepRecord;
import com.investigator.core.model.StepStatus;
import com.investigator.core.provider.ChangeEvent;
import com.investigator.core.provider.ConnectivityResult;
import com.investigator.core.provider.ConsumerUsage;
import com.investigator.core.provider.MetricId;
import com.investigator.core.provider.MetricSeries;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.core.provider.ScalingState;
import com.investigator.core.provider.TimeWindow;
import com.investigator.core.test.FailureInjector;
import com.investigator.core.test.TimeController;
import com.investigator.engine.metrics.InvestigationMetrics;
import com.investigator.engine.planner.ReasoningPlanner;
import com.investigator.engine.planner.StrategyTable;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.PrimitiveRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.investigator.engine.test.IncidentFixtures.*;
import static org.assertj.core.api.Assertions.*;

class DiagnosticExecutorTest {

    private TimeController clock;
    private DiagnosticPlan plan;
    private DiagnosticExecutor executor;

    @BeforeEach
    void setUp() {
        clock = TimeController.frozenAt(NOW);
        plan = new ReasoningPlanner(StrategyTable.standard(), PrimitiveRegistry.standard())
            .plan(saturation(dbContext()));
        executor = executorWith(PrimitiveRegistry.standard(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    // ========== Happy Path ==========

    @Test
    @DisplayName("Seeded provider yields a complete execution with facts in plan order")
    void testCompleteExecution() {
        DiagnosticExecution execution = executor.execute(plan, highCpuAfterParameterChange().build());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETE);
        assertThat(execution.planId()).isEqualTo(plan.planId());
        assertThat(execution.steps()).extracting(StepRecord::status).containsOnly(StepStatus.SUCCEEDED);
        assertThat(execution.facts()).extracting(Fact::primitive).containsExactlyElementsOf(plan.primitiveNames());
        assertThat(execution.facts()).extracting(Fact::index).containsExactly(0, 1, 2, 3, 4);
        assertThat(execution.facts()).allSatisfy(fact ->
            assertThat(fact.executionId()).isEqualTo(execution.executionId()));
    }

    // ========== Step Isolation ==========

    @Test
    @DisplayName("A failing step is recorded and the remaining steps still run")
    void testStepIsolation() {
        ResourceProvider provider = FailureInjector.wrap(highCpuAfterParameterChange().build())
            .failOn(ProviderCapability.SCALING_STATE, ProviderException.THROTTLED)
            .build();

        DiagnosticExecution execution = executor.execute(plan, provider);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.DEGRADED);
        StepRecord scaling = execution.steps().get(3);
        assertThat(scaling.primitive()).isEqualTo(PrimitiveName.CHECK_SCALING_BEHAVIOR);
        assertThat(scaling.status()).isEqualTo(StepStatus.FAILED);
        assertThat(scaling.errorCode()).isEqualTo(ProviderException.THROTTLED);
        assertThat(execution.steps().get(4).status()).isEqualTo(StepStatus.SUCCEEDED);
        assertThat(execution.usableFacts()).hasSize(4);
    }

    @Test
    @DisplayName("A step that exceeds its timeout is recorded as timed out")
    void testStepTimeout() {
        executor.close();
        executor = executorWith(PrimitiveRegistry.standard(), Duration.ofMillis(200));
        ResourceProvider provider = FailureInjector.wrap(highCpuAfterParameterChange().build())
            .delayOn(ProviderCapability.TOP_CONSUMERS, Duration.ofSeconds(5))
            .build();

        DiagnosticExecution execution = executor.execute(plan, provider);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.DEGRADED);
        assertThat(execution.steps().get(2).status()).isEqualTo(StepStatus.TIMED_OUT);
        Fact timedOut = execution.factsFrom(PrimitiveName.FIND_TOP_CONSUMERS).get(0);
        assertThat(timedOut.status()).isEqualTo(FactStatus.FAILED);
        assertThat(timedOut.errorCode()).isEqualTo(DiagnosticExecutor.STEP_TIMEOUT);
        assertThat(execution.steps().get(3).status()).isEqualTo(StepStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("A timed-out call that ignores interrupts never overlaps the next step's provider calls")
    void testTimedOutCallBlocksLane() throws Exception {
        executor.close();
        executor = executorWith(PrimitiveRegistry.standard(), Duration.ofMillis(100));
        SerialCheckingProvider provider = new SerialCheckingProvider(highCpuAfterParameterChange().build(),
            Duration.ofMillis(1000));

        DiagnosticExecution execution = executor.execute(plan, provider);
        assertThat(provider.hungCallReturned.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(provider.maxConcurrentCalls.get()).isEqualTo(1);
        assertThat(execution.status()).isEqualTo(ExecutionStatus.DEGRADED);
        assertThat(execution.steps().get(0).status()).isEqualTo(StepStatus.TIMED_OUT);
        StepRecord queued = execution.steps().get(1);
        assertThat(queued.status()).isEqualTo(StepStatus.TIMED_OUT);
        assertThat(queued.errorMessage()).contains("waiting for an earlier timed-out step");
        assertThat(execution.steps()).extracting(StepRecord::status)
            .containsOnly(StepStatus.TIMED_OUT, StepStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("A hung call from an earlier execution does not hold up the next one")
    void testNextExecutionGetsFreshLane() throws Exception {
        executor.close();
        executor = executorWith(PrimitiveRegistry.standard(), Duration.ofMillis(100));
        SerialCheckingProvider hung = new SerialCheckingProvider(highCpuAfterParameterChange().build(),
            Duration.ofMillis(1000));
        executor.execute(plan, hung);

        DiagnosticExecution next = executor.execute(plan, highCpuAfterParameterChange().build());

        assertThat(next.status()).isEqualTo(ExecutionStatus.COMPLETE);
        assertThat(hung.hungCallReturned.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Per-primitive timeout overrides the default")
    void testPerPrimitiveTimeout() {
        ExecutorSettings settings = ExecutorSettings.builder()
            .stepTimeout(Duration.ofSeconds(30))
            .stepTimeout(PrimitiveName.CHECK_CONNECTIVITY, Duration.ofSeconds(2))
            .build();

        assertThat(settings.timeoutFor(PrimitiveName.CHECK_CONNECTIVITY)).isEqualTo(Duration.ofSeconds(2));
        assertThat(settings.timeoutFor(PrimitiveName.ANALYZE_UTILIZATION)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("An unexpected runtime error fails only its step")
    void testPrimitiveCrash() {
        ResourceProvider provider = FailureInjector.wrap(highCpuAfterParameterChange().build())
            .crashOn(ProviderCapability.CHANGE_HISTORY, () -> new IllegalStateException("client bug"))
            .build();

        DiagnosticExecution execution = executor.execute(plan, provider);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.DEGRADED);
        Fact crashed = execution.factsFrom(PrimitiveName.CHECK_RECENT_CHANGES).get(0);
        assertThat(crashed.errorCode()).isEqualTo(DiagnosticExecutor.PRIMITIVE_ERROR);
        assertThat(crashed.errorMessage()).contains("IllegalStateException").contains("client bug");
    }

    @Test
    @DisplayName("A parameter contract violation propagates to the caller")
    void testContractViolationPropagates() {
        DiagnosticPrimitive broken = primitive(PrimitiveName.ANALYZE_UTILIZATION, (parameters, provider, now) -> {
            throw new ParameterContractException("metric", "unsupported unit");
        });
        executor.close();
        executor = executorWith(PrimitiveRegistry.builder().from(PrimitiveRegistry.standard()).replace(broken).build(),
            Duration.ofSeconds(5));

        assertThatThrownBy(() -> executor.execute(plan, highCpuAfterParameterChange().build()))
            .isInstanceOf(ParameterContractException.class);
    }

    // ========== Fatal Outcomes ==========

    @Test
    @DisplayName("A global provider failure aborts and skips the remaining steps")
    void testGlobalFailureAborts() {
        FailureInjector provider = FailureInjector.wrap(highCpuAfterParameterChange().build())
            .failGlobally(ProviderException.AUTHENTICATION_FAILED)
            .build();

        DiagnosticExecution execution = executor.execute(plan, provider);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FATAL);
        assertThat(execution.abortCode()).isEqualTo(ProviderException.AUTHENTICATION_FAILED);
        assertThat(execution.steps().get(0).status()).isEqualTo(StepStatus.FAILED);
        assertThat(execution.steps().subList(1, 5)).extracting(StepRecord::status).containsOnly(StepStatus.SKIPPED);
        assertThat(provider.getCallCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("An empty plan is fatal")
    void testEmptyPlan() {
        DiagnosticPlan empty = DiagnosticPlan.create(IncidentClass.COST_ANOMALY, List.of(), List.of());

        DiagnosticExecution execution = executor.execute(empty, highCpuAfterParameterChange().build());

        assertThat(execution.status()).isEqualTo(ExecutionStatus.FATAL);
        assertThat(execution.abortCode()).isEqualTo(DiagnosticExecutor.EMPTY_PLAN);
        assertThat(execution.facts()).isEmpty();
    }

    // ========== Cancellation ==========

    @Test
    @DisplayName("Cancellation keeps collected facts and skips the rest")
    void testCancellation() {
        CancellationSignal cancellation = CancellationSignal.create();
        DiagnosticPrimitive cancelling = primitive(PrimitiveName.COMPARE_BASELINE, (parameters, provider, now) -> {
            cancellation.cancel();
            return List.of(Fact.ok(PrimitiveName.COMPARE_BASELINE, parameters.resource(), Map.of("anomalous", false), now));
        });
        executor.close();
        executor = executorWith(PrimitiveRegistry.builder().from(PrimitiveRegistry.standard()).replace(cancelling).build(),
            Duration.ofSeconds(5));

        DiagnosticExecution execution = executor.execute(plan, highCpuAfterParameterChange().build(), cancellation);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(execution.facts()).hasSize(2);
        assertThat(execution.steps()).extracting(StepRecord::status).containsExactly(
            StepStatus.SUCCEEDED, StepStatus.SUCCEEDED, StepStatus.SKIPPED, StepStatus.SKIPPED, StepStatus.SKIPPED);
    }

    @Test
    @DisplayName("Execution after a cancelled signal runs nothing")
    void testCancelledBeforeStart() {
        CancellationSignal cancellation = CancellationSignal.create();
        cancellation.cancel();

        DiagnosticExecution execution = executor.execute(plan, highCpuAfterParameterChange().build(), cancellation);

        assertThat(execution.status()).isEqualTo(ExecutionStatus.CANCELLED);
        assertThat(execution.facts()).isEmpty();
        assertThat(execution.steps()).extracting(StepRecord::status).containsOnly(StepStatus.SKIPPED);
    }

    // ========== Helpers ==========

    private DiagnosticExecutor executorWith(PrimitiveRegistry registry, Duration stepTimeout) {
        return new DiagnosticExecutor(registry, ExecutorSettings.builder().stepTimeout(stepTimeout).build(),
            clock, new InvestigationMetrics());
    }

    @FunctionalInterface
    private interface StepBody {
        List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now);
    }

    private static DiagnosticPrimitive primitive(PrimitiveName name, StepBody body) {
        return new DiagnosticPrimitive() {
            @Override
            public PrimitiveName name() {
                return name;
            }

            @Override
            public Set<ProviderCapability> requiredCapabilities() {
                return EnumSet.noneOf(ProviderCapability.class);
            }

            @Override
            public List<Fact> run(PrimitiveParameters parameters, ResourceProvider provider, Instant now) {
                return body.run(parameters, provider, now);
            }
        };
    }

    /**
     * Delegating provider that records how many calls are in flight at once. The first
     * metric read holds its thread for {@code hold}, ignoring interrupts.
     */
    private static final class SerialCheckingProvider implements ResourceProvider {
        private final ResourceProvider delegate;
        private final Duration hold;
        private final AtomicInteger activeCalls = new AtomicInteger();
        private final AtomicInteger maxConcurrentCalls = new AtomicInteger();
        private final AtomicBoolean hungOnce = new AtomicBoolean();
        private final CountDownLatch hungCallReturned = new CountDownLatch(1);

        SerialCheckingProvider(ResourceProvider delegate, Duration hold) {
            this.delegate = delegate;
            this.hold = hold;
        }

        private <T> T tracked(ProviderCall<T> call) throws ProviderException {
            maxConcurrentCalls.accumulateAndGet(activeCalls.incrementAndGet(), Math::max);
            try {
                return call.get();
            } finally {
                activeCalls.decrementAndGet();
            }
        }

        private static void holdIgnoringInterrupts(Duration hold) {
            long deadline = System.nanoTime() + hold.toNanos();
            boolean interrupted = false;
            while (System.nanoTime() < deadline) {
                try {
                    Thread.sleep(Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())));
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public Set<ProviderCapability> capabilities() {
            return delegate.capabilities();
        }

        @Override
        public MetricSeries readMetricSeries(ResourceRef resource, MetricId metric, TimeWindow window)
                throws ProviderException {
            return tracked(() -> {
                if (hungOnce.compareAndSet(false, true)) {
                    try {
                        holdIgnoringInterrupts(hold);
                    } finally {
                        hungCallReturned.countDown();
                    }
                }
                return delegate.readMetricSeries(resource, metric, window);
            });
        }

        @Override
        public List<ChangeEvent> readRecentChanges(ResourceRef resource, TimeWindow window) throws ProviderException {
            return tracked(() -> delegate.readRecentChanges(resource, window));
        }

        @Override
        public List<ResourceRef> readDependencies(ResourceRef resource) throws ProviderException {
            return tracked(() -> delegate.readDependencies(resource));
        }

        @Override
        public Map<String, String> readConfiguration(ResourceRef resource) throws ProviderException {
            return tracked(() -> delegate.readConfiguration(resource));
        }

        @Override
        public ConnectivityResult checkConnectivity(ResourceRef from, ResourceRef to) throws ProviderException {
            return tracked(() -> delegate.checkConnectivity(from, to));
        }

        @Override
        public ScalingState readScalingState(ResourceRef resource) throws ProviderException {
            return tracked(() -> delegate.readScalingState(resource));
        }

        @Override
        public List<ConsumerUsage> readTopConsumers(ResourceRef resource, MetricId metric, TimeWindow window, int limit)
                throws ProviderException {
            return tracked(() -> delegate.readTopConsumers(resource, metric, window, limit));
        }
    }

    @FunctionalInterface
    private interface ProviderCall<T> {
        T get() throws ProviderException;
    }
}
