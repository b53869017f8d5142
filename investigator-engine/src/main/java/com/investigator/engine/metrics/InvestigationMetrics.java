package com.investigator.engine.metrics;

import com.investigator.core.model.ClassificationMethod;
import com.investigator.core.model.IncidentClass;
import com.investigator.core.model.InvestigationOutcome;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.StepStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for investigations.
 * 
 * Metrics exposed:
 * - Investigations by outcome and primary class
 * - Classifications by method
 * - Step duration per primitive and status
 * - Hypotheses generated and model responses rejected
 * - Investigations in flight
 * 
 * Records into a private {@link SimpleMeterRegistry} until bound to a real registry.
 */
public class InvestigationMetrics implements MeterBinder {

    public static final String INVESTIGATIONS = "investigator.investigations";
    public static final String INVESTIGATION_DURATION = "investigator.investigation.duration";
    public static final String INVESTIGATIONS_ACTIVE = "investigator.investigations.active";
    public static final String CLASSIFICATIONS = "investigator.classifications";
    public static final String STEP_DURATION = "investigator.step.duration";
    public static final String HYPOTHESES = "investigator.hypotheses";
    public static final String MODEL_REJECTIONS = "investigator.model.rejections";

    private final AtomicInteger active = new AtomicInteger(0);
    private volatile MeterRegistry registry = new SimpleMeterRegistry();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(INVESTIGATIONS_ACTIVE, active, AtomicInteger::get)
            .description("Investigations currently running")
            .register(registry);
    }

    // ========== Investigation Metrics ==========

    public void investigationStarted() {
        active.incrementAndGet();
    }

    public void investigationFinished(InvestigationOutcome outcome, IncidentClass primaryClass, Duration duration) {
        active.decrementAndGet();
        String incidentClass = primaryClass == null ? "none" : primaryClass.wireName();
        
        Counter.builder(INVESTIGATIONS)
            .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
            .tag("incident_class", incidentClass)
            .description("Investigations by outcome")
            .register(registry)
            .increment();
        
        Timer.builder(INVESTIGATION_DURATION)
            .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
            .description("End-to-end investigation duration")
            .register(registry)
            .record(duration);
    }

    // ========== Pipeline Metrics ==========

    public void classified(ClassificationMethod method, IncidentClass primaryClass) {
        Counter.builder(CLASSIFICATIONS)
            .tag("method", method.name().toLowerCase(Locale.ROOT))
            .tag("incident_class", primaryClass.wireName())
            .description("Incident classifications by method")
            .register(registry)
            .increment();
    }

    public void stepCompleted(PrimitiveName primitive, StepStatus status, Duration duration) {
        Timer.builder(STEP_DURATION)
            .tag("primitive", primitive.wireName())
            .tag("status", status.name().toLowerCase(Locale.ROOT))
            .description("Diagnostic primitive duration")
            .register(registry)
            .record(duration);
    }

    public void hypothesesGenerated(String source, int count) {
        Counter.builder(HYPOTHESES)
            .tag("source", source)
            .description("Hypotheses generated")
            .register(registry)
            .increment(count);
    }

    public void modelResponseRejected(String component, String reason) {
        Counter.builder(MODEL_REJECTIONS)
            .tag("component", component)
            .tag("reason", reason)
            .description("Model responses discarded during validation")
            .register(registry)
            .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
