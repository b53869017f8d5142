package com.investigator.core.model;

import com.investigator.core.exception.ExecutionSealedException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Append-only builder for a {@link DiagnosticExecution}.
 * Owned by a single executor thread until {@link #seal} or {@link #abort};
 * any append after that fails.
 */
public final class ExecutionRecorder {
    
    private final UUID executionId;
    private final UUID planId;
    private final Clock clock;
    private final Instant startedAt;
    private final List<Fact> facts = new ArrayList<>();
    private final List<StepRecord> steps = new ArrayList<>();
    private DiagnosticExecution sealed;
    
    private ExecutionRecorder(UUID executionId, UUID planId, Clock clock) {
        this.executionId = executionId;
        this.planId = planId;
        this.clock = clock;
        this.startedAt = clock.instant();
    }
    
    /**
     * Start recording an execution of the given plan.
     */
    public static ExecutionRecorder start(DiagnosticPlan plan, Clock clock) {
        return new ExecutionRecorder(UUID.randomUUID(), plan.planId(), clock);
    }
    
    public UUID executionId() {
        return executionId;
    }
    
    public Instant startedAt() {
        return startedAt;
    }
    
    /**
     * Append the facts of one step, stamping execution identity in order.
     */
    public List<Fact> appendFacts(int stepIndex, List<Fact> stepFacts) {
        ensureOpen();
        List<Fact> stamped = new ArrayList<>(stepFacts.size());
        for (Fact fact : stepFacts) {
            Fact recorded = fact.withIdentity(executionId, facts.size(), stepIndex);
            facts.add(recorded);
            stamped.add(recorded);
        }
        return stamped;
    }
    
    public void recordStep(StepRecord step) {
        ensureOpen();
        steps.add(step);
    }
    
    /**
     * Seal with the status derived from the recorded steps: COMPLETE when nothing
     * degraded, otherwise DEGRADED; CANCELLED when requested.
     */
    public DiagnosticExecution seal(boolean cancelled) {
        ensureOpen();
        ExecutionStatus status;
        if (cancelled) {
            status = ExecutionStatus.CANCELLED;
        } else if (isDegraded()) {
            status = ExecutionStatus.DEGRADED;
        } else {
            status = ExecutionStatus.COMPLETE;
        }
        sealed = new DiagnosticExecution(executionId, planId, status, facts, steps,
            startedAt, clock.instant(), null, null);
        return sealed;
    }
    
    /**
     * Seal as FATAL. Facts already recorded are kept for the audit trail only.
     */
    public DiagnosticExecution abort(String abortCode, String abortReason) {
        ensureOpen();
        sealed = new DiagnosticExecution(executionId, planId, ExecutionStatus.FATAL, facts, steps,
            startedAt, clock.instant(), abortCode, abortReason);
        return sealed;
    }
    
    public boolean isSealed() {
        return sealed != null;
    }
    
    public int factCount() {
        return facts.size();
    }
    
    private boolean isDegraded() {
        boolean stepDegraded = steps.stream().anyMatch(step -> step.status().isDegrading());
        boolean factDegraded = facts.stream().anyMatch(fact -> fact.status() != FactStatus.OK);
        return stepDegraded || factDegraded;
    }
    
    private void ensureOpen() {
        if (sealed != null) {
            throw new ExecutionSealedException(executionId);
        }
    }
}
