package com.investigator.engine.primitive;

import com.investigator.core.model.PrimitiveName;
import com.investigator.engine.primitive.library.AnalyzeErrorRate;
import com.investigator.engine.primitive.library.AnalyzeUtilization;
import com.investigator.engine.primitive.library.CheckConnectivity;
import com.investigator.engine.primitive.library.CheckDeploymentStatus;
import com.investigator.engine.primitive.library.CheckPermissions;
import com.investigator.engine.primitive.library.CheckRecentChanges;
import com.investigator.engine.primitive.library.CheckResourceStatus;
import com.investigator.engine.primitive.library.CheckScalingBehavior;
import com.investigator.engine.primitive.library.CheckScalingLimits;
import com.investigator.engine.primitive.library.CompareBaseline;
import com.investigator.engine.primitive.library.DiffConfiguration;
import com.investigator.engine.primitive.library.FindTopConsumers;
import com.investigator.engine.primitive.library.MetricSignal;
import com.investigator.engine.primitive.library.TraceDependencies;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup from primitive name to implementation.
 * Built once at startup and passed to the planner and executor.
 */
public final class PrimitiveRegistry {
    
    private final Map<PrimitiveName, DiagnosticPrimitive> primitives;
    
    private PrimitiveRegistry(Map<PrimitiveName, DiagnosticPrimitive> primitives) {
        this.primitives = Collections.unmodifiableMap(new EnumMap<>(primitives));
    }
    
    /**
     * Registry with every built-in primitive.
     */
    public static PrimitiveRegistry standard() {
        return standard(MetricCatalog.standard());
    }
    
    public static PrimitiveRegistry standard(MetricCatalog catalog) {
        return builder()
            .register(new AnalyzeUtilization(catalog))
            .register(new CompareBaseline(catalog))
            .register(new FindTopConsumers(catalog))
            .register(new TraceDependencies())
            .register(new CheckConnectivity())
            .register(new CheckRecentChanges())
            .register(new DiffConfiguration())
            .register(new CheckScalingBehavior())
            .register(new CheckScalingLimits())
            .register(new CheckPermissions())
            .register(new AnalyzeErrorRate(catalog))
            .register(MetricSignal.latency(catalog))
            .register(MetricSignal.throttling(catalog))
            .register(MetricSignal.replicationLag(catalog))
            .register(MetricSignal.costTrend(catalog))
            .register(new CheckDeploymentStatus())
            .register(new CheckResourceStatus())
            .build();
    }
    
    public Optional<DiagnosticPrimitive> find(PrimitiveName name) {
        return Optional.ofNullable(primitives.get(name));
    }
    
    /**
     * Look up a primitive that the planner has already validated.
     * 
     * @throws IllegalStateException when the name is not registered
     */
    public DiagnosticPrimitive get(PrimitiveName name) {
        DiagnosticPrimitive primitive = primitives.get(name);
        if (primitive == null) {
            throw new IllegalStateException("No primitive registered for " + name);
        }
        return primitive;
    }
    
    public boolean contains(PrimitiveName name) {
        return primitives.containsKey(name);
    }
    
    public Set<PrimitiveName> names() {
        return primitives.keySet();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private final Map<PrimitiveName, DiagnosticPrimitive> primitives = new EnumMap<>(PrimitiveName.class);
        
        public Builder register(DiagnosticPrimitive primitive) {
            if (primitives.containsKey(primitive.name())) {
                throw new IllegalArgumentException("Primitive already registered: " + primitive.name());
            }
            primitives.put(primitive.name(), primitive);
            return this;
        }
        
        /**
         * Register or override an implementation. Used by tests to substitute primitives.
         */
        public Builder replace(DiagnosticPrimitive primitive) {
            primitives.put(primitive.name(), primitive);
            return this;
        }
        
        public Builder from(PrimitiveRegistry registry) {
            primitives.putAll(registry.primitives);
            return this;
        }
        
        public PrimitiveRegistry build() {
            return new PrimitiveRegistry(primitives);
        }
    }
}
