package com.investigator.engine.executor;

import com.investigator.core.exception.InvestigatorException;
import com.investigator.core.model.DiagnosticExecution;
import com.investigator.core.model.DiagnosticPlan;
import com.investigator.core.model.ExecutionRecorder;
import com.investigator.core.model.Fact;
import com.investigator.core.model.FactStatus;
import com.investigator.core.model.PlanStep;
import com.investigator.core.model.StepRecord;
import com.investigator.core.model.StepStatus;
import com.investigator.core.provider.ProviderException;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.logging.LoggingContext;
import com.investigator.engine.metrics.InvestigationMetrics;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.PrimitiveRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a diagnostic plan against a resource provider.
 * 
 * Steps run one at a time in plan order. Each step gets its own timeout; a
 * step that fails or times out yields a failed fact and the next step runs.
 * Only two things abort the execution: a global provider failure and an empty
 * plan. Programmer errors (invalid parameter contract) propagate.
 * 
 * Each execution gets a single worker thread, its lane, and every step of that
 * execution runs on it so that the step timeout can be enforced. A timed-out
 * step is interrupted, but a provider call that ignores the interrupt keeps the
 * lane busy: later steps queue behind it and time out without touching the
 * provider. The provider is therefore never called by two steps of the same
 * execution at once, and a hung call holds at most one thread.
 */
public class DiagnosticExecutor implements AutoCloseable {
    
    private static final Logger log = LoggerFactory.getLogger(DiagnosticExecutor.class);
    
    public static final String EMPTY_PLAN = "EMPTY_PLAN";
    public static final String STEP_TIMEOUT = "STEP_TIMEOUT";
    public static final String PRIMITIVE_ERROR = "PRIMITIVE_ERROR";
    
    private final PrimitiveRegistry registry;
    private final ExecutorSettings settings;
    private final Clock clock;
    private final InvestigationMetrics metrics;
    private final ThreadFactory threadFactory = new StepThreadFactory();
    private final Set<ExecutorService> lanes = ConcurrentHashMap.newKeySet();
    
    public DiagnosticExecutor(PrimitiveRegistry registry, ExecutorSettings settings, Clock clock,
                              InvestigationMetrics metrics) {
        this.registry = registry;
        this.settings = settings;
        this.clock = clock;
        this.metrics = metrics;
    }
    
    public DiagnosticExecutor(PrimitiveRegistry registry) {
        this(registry, ExecutorSettings.defaults(), Clock.systemUTC(), new InvestigationMetrics());
    }
    
    /**
     * Execute every step of the plan.
     */
    public DiagnosticExecution execute(DiagnosticPlan plan, ResourceProvider provider) {
        return execute(plan, provider, CancellationSignal.create());
    }
    
    /**
     * Execute the plan until it completes, aborts or is cancelled.
     * 
     * @return the sealed execution; FATAL when the plan was empty or the provider failed globally
     */
    public DiagnosticExecution execute(DiagnosticPlan plan, ResourceProvider provider, CancellationSignal cancellation) {
        if (plan == null || provider == null) {
            throw new IllegalArgumentException("plan and provider are required");
        }
        
        ExecutionRecorder recorder = ExecutionRecorder.start(plan, clock);
        ExecutorService lane = Executors.newSingleThreadExecutor(threadFactory);
        lanes.add(lane);
        try {
            return run(plan, provider, cancellation, recorder, lane);
        } finally {
            lanes.remove(lane);
            lane.shutdownNow();
        }
    }
    
    private DiagnosticExecution run(DiagnosticPlan plan, ResourceProvider provider, CancellationSignal cancellation,
                                    ExecutionRecorder recorder, ExecutorService lane) {
        try (var ctx = LoggingContext.forExecution(recorder.executionId(), plan.planId(), plan.primaryClass())) {
            if (plan.isEmpty()) {
                log.error("Aborting execution {}: plan {} has no steps", recorder.executionId(), plan.planId());
                return recorder.abort(EMPTY_PLAN, "Plan contains no steps");
            }
            
            log.info("Executing plan {} with {} steps", plan.planId(), plan.steps().size());
            
            List<PlanStep> steps = plan.steps();
            for (int i = 0; i < steps.size(); i++) {
                PlanStep step = steps.get(i);
                
                if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                    skipRemaining(recorder, steps, i);
                    DiagnosticExecution cancelled = recorder.seal(true);
                    log.warn("Execution {} cancelled after {} of {} steps",
                        cancelled.executionId(), i, steps.size());
                    return cancelled;
                }
                
                StepOutcome outcome = runStep(step, provider, recorder.executionId(), lane);
                
                if (outcome.globalFailure() != null) {
                    ProviderException failure = outcome.globalFailure();
                    recorder.recordStep(outcome.record());
                    skipRemaining(recorder, steps, i + 1);
                    log.error("Aborting execution {} at step {} ({}): provider failure {} - {}",
                        recorder.executionId(), step.index(), step.primitive().wireName(),
                        failure.getErrorCode(), failure.getMessage());
                    return recorder.abort(failure.getErrorCode(), failure.getMessage());
                }
                
                recorder.appendFacts(step.index(), outcome.facts());
                recorder.recordStep(outcome.record());
                
                if (outcome.interrupted()) {
                    skipRemaining(recorder, steps, i + 1);
                    return recorder.seal(true);
                }
            }
            
            DiagnosticExecution execution = recorder.seal(false);
            log.info("Execution {} finished {}: {} facts, {} failed steps, {} timed out",
                execution.executionId(), execution.status(), execution.facts().size(),
                execution.countSteps(StepStatus.FAILED), execution.countSteps(StepStatus.TIMED_OUT));
            return execution;
        }
    }
    
    // ========== Step Execution ==========
    
    private StepOutcome runStep(PlanStep step, ResourceProvider provider, UUID executionId, ExecutorService lane) {
        DiagnosticPrimitive primitive = registry.get(step.primitive());
        Duration timeout = settings.timeoutFor(step.primitive());
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        
        AtomicBoolean started = new AtomicBoolean();
        Future<List<Fact>> future = lane.submit(() -> {
            started.set(true);
            try (var ctx = LoggingContext.forStep(executionId, step.index(), step.primitive())) {
                return primitive.execute(step.parameters(), provider, startedAt);
            }
        });
        
        List<Fact> facts;
        StepStatus status;
        String errorCode = null;
        String errorMessage = null;
        boolean interrupted = false;
        
        try {
            facts = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            status = statusOf(facts);
            Fact firstFailure = facts.stream().filter(f -> f.status() != FactStatus.OK).findFirst().orElse(null);
            if (firstFailure != null) {
                errorCode = firstFailure.errorCode();
                errorMessage = firstFailure.errorMessage();
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            errorCode = STEP_TIMEOUT;
            errorMessage = started.get()
                ? "Timed out after " + timeout.toMillis() + "ms"
                : "Timed out after " + timeout.toMillis() + "ms waiting for an earlier timed-out step to return";
            facts = List.of(Fact.failed(step.primitive(), step.parameters().resource(), startedAt, errorCode, errorMessage));
            status = StepStatus.TIMED_OUT;
            log.warn("Step {} ({}) timed out after {}", step.index(), step.primitive().wireName(), timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            facts = List.of();
            status = StepStatus.SKIPPED;
            interrupted = true;
            log.warn("Interrupted while waiting for step {} ({})", step.index(), step.primitive().wireName());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException providerFailure) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                metrics.stepCompleted(step.primitive(), StepStatus.FAILED, elapsed);
                StepRecord record = new StepRecord(step.index(), step.primitive(), StepStatus.FAILED, startedAt,
                    elapsed, 0, providerFailure.getErrorCode(), providerFailure.getMessage());
                return new StepOutcome(List.of(), record, providerFailure, false);
            }
            if (cause instanceof InvestigatorException programmerError) {
                throw programmerError;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            errorCode = PRIMITIVE_ERROR;
            errorMessage = cause.getClass().getSimpleName() + ": " + cause.getMessage();
            facts = List.of(Fact.failed(step.primitive(), step.parameters().resource(), startedAt, errorCode, errorMessage));
            status = StepStatus.FAILED;
            log.error("Step {} ({}) threw unexpectedly", step.index(), step.primitive().wireName(), cause);
        }
        
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        metrics.stepCompleted(step.primitive(), status, elapsed);
        log.debug("Step {} ({}) finished {} in {}ms with {} facts",
            step.index(), step.primitive().wireName(), status, elapsed.toMillis(), facts.size());
        
        StepRecord record = new StepRecord(step.index(), step.primitive(), status, startedAt, elapsed,
            facts.size(), errorCode, errorMessage);
        return new StepOutcome(facts, record, null, interrupted);
    }
    
    private static StepStatus statusOf(List<Fact> facts) {
        boolean anyUsable = facts.stream().anyMatch(Fact::isUsable);
        boolean allOk = facts.stream().allMatch(fact -> fact.status() == FactStatus.OK);
        if (allOk) {
            return StepStatus.SUCCEEDED;
        }
        return anyUsable ? StepStatus.PARTIAL : StepStatus.FAILED;
    }
    
    private static void skipRemaining(ExecutionRecorder recorder, List<PlanStep> steps, int from) {
        for (int i = from; i < steps.size(); i++) {
            recorder.recordStep(StepRecord.skipped(steps.get(i)));
        }
    }
    
    @Override
    public void close() {
        lanes.forEach(ExecutorService::shutdownNow);
    }
    
    private record StepOutcome(
        List<Fact> facts,
        StepRecord record,
        ProviderException globalFailure,
        boolean interrupted
    ) {}
    
    private static final class StepThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "diagnostic-step-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
