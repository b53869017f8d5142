package com.investigator.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Execution metadata for one plan step.
 */
public record StepRecord(
    int stepIndex,
    PrimitiveName primitive,
    StepStatus status,
    Instant startedAt,
    Duration duration,
    int factCount,
    String errorCode,
    String errorMessage
) {
    public static StepRecord skipped(PlanStep step) {
        return new StepRecord(step.index(), step.primitive(), StepStatus.SKIPPED, null, Duration.ZERO, 0, null, null);
    }
}
