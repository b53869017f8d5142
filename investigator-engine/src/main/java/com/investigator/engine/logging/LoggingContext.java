package com.investigator.engine.logging;

import com.investigator.core.model.IncidentClass;
import com.investigator.core.model.PrimitiveName;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Puts correlation ids for the current investigation or step into the MDC
 * and restores whatever was there before on close.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forInvestigation(investigationId)) {
 *     log.info("Classifying query"); // includes investigationId
 * }
 * </pre>
 *
 * Steps run on the executor's worker thread, so the step context is opened
 * on that thread, not the caller's.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String INVESTIGATION_ID = "investigationId";
    public static final String INCIDENT_CLASS = "incidentClass";
    public static final String PLAN_ID = "planId";
    public static final String EXECUTION_ID = "executionId";
    public static final String STEP_INDEX = "stepIndex";
    public static final String PRIMITIVE = "primitive";

    private final Map<String, String> previous = new HashMap<>();

    private LoggingContext() {
    }

    /**
     * Create a logging context for investigation-level operations.
     */
    public static LoggingContext forInvestigation(UUID investigationId) {
        LoggingContext ctx = new LoggingContext();
        if (investigationId != null) {
            ctx.put(INVESTIGATION_ID, investigationId.toString());
        }
        return ctx;
    }

    /**
     * Create a logging context for plan execution.
     */
    public static LoggingContext forExecution(UUID executionId, UUID planId, IncidentClass primaryClass) {
        LoggingContext ctx = new LoggingContext();
        if (executionId != null) {
            ctx.put(EXECUTION_ID, executionId.toString());
        }
        if (planId != null) {
            ctx.put(PLAN_ID, planId.toString());
        }
        if (primaryClass != null) {
            ctx.put(INCIDENT_CLASS, primaryClass.wireName());
        }
        return ctx;
    }

    /**
     * Create a logging context for a single plan step.
     */
    public static LoggingContext forStep(UUID executionId, int stepIndex, PrimitiveName primitive) {
        LoggingContext ctx = new LoggingContext();
        if (executionId != null) {
            ctx.put(EXECUTION_ID, executionId.toString());
        }
        ctx.put(STEP_INDEX, String.valueOf(stepIndex));
        if (primitive != null) {
            ctx.put(PRIMITIVE, primitive.wireName());
        }
        return ctx;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
