package com.investigator.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Sealed record of a plan's execution: ordered facts plus per-step metadata.
 * Built only through {@link ExecutionRecorder}; immutable once it exists, so it
 * may be shared freely for interpretation and display.
 * 
 * Invariants:
 * - status is terminal
 * - facts are in plan order and fact i has index i and this executionId
 * - abortReason set iff status == FATAL
 */
public record DiagnosticExecution(
    UUID executionId,
    UUID planId,
    ExecutionStatus status,
    List<Fact> facts,
    List<StepRecord> steps,
    Instant startedAt,
    Instant completedAt,
    String abortCode,
    String abortReason
) {
    public DiagnosticExecution {
        if (executionId == null || status == null) {
            throw new IllegalArgumentException("executionId and status are required");
        }
        facts = facts == null ? List.of() : List.copyOf(facts);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
    
    /**
     * Look up a fact cited by reference. Empty when the reference belongs to
     * another execution or is out of range.
     */
    public Optional<Fact> find(FactRef ref) {
        if (ref == null || !executionId.equals(ref.executionId())) {
            return Optional.empty();
        }
        if (ref.index() < 0 || ref.index() >= facts.size()) {
            return Optional.empty();
        }
        return Optional.of(facts.get(ref.index()));
    }
    
    public List<Fact> factsFrom(PrimitiveName primitive) {
        return facts.stream().filter(fact -> fact.primitive() == primitive).toList();
    }
    
    @JsonIgnore
    public List<Fact> usableFacts() {
        return facts.stream().filter(Fact::isUsable).toList();
    }
    
    @JsonIgnore
    public boolean isFatal() {
        return status == ExecutionStatus.FATAL;
    }
    
    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
    
    public long countSteps(StepStatus stepStatus) {
        return steps.stream().filter(step -> step.status() == stepStatus).count();
    }
}
