package com.investigator.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Immutable, structured observation produced by a primitive.
 * 
 * Primitives create unstamped facts (no execution id, index -1). The execution
 * recorder stamps identity when the fact is appended, so a fact's position is
 * fixed by plan order rather than completion order.
 * 
 * Invariants:
 * - errorMessage set iff status != OK
 * - observations keep insertion order
 * - observations are immutable all the way down: nested lists and maps are copied
 */
public record Fact(
    UUID executionId,
    int index,
    int stepIndex,
    PrimitiveName primitive,
    ResourceRef resource,
    Map<String, Object> observations,
    Instant observedAt,
    FactStatus status,
    String errorCode,
    String errorMessage
) {
    public Fact {
        if (primitive == null || status == null) {
            throw new IllegalArgumentException("primitive and status are required");
        }
        observations = observations == null ? Map.of() : freezeMap(observations);
        resource = resource == null ? ResourceRef.of(null, null) : resource;
    }
    
    /**
     * Create a complete observation.
     */
    public static Fact ok(PrimitiveName primitive, ResourceRef resource, Map<String, Object> observations, Instant observedAt) {
        return new Fact(null, -1, -1, primitive, resource, observations, observedAt, FactStatus.OK, null, null);
    }
    
    /**
     * Create an incomplete but usable observation.
     */
    public static Fact partial(
            PrimitiveName primitive,
            ResourceRef resource,
            Map<String, Object> observations,
            Instant observedAt,
            String reason) {
        
        return new Fact(null, -1, -1, primitive, resource, observations, observedAt, FactStatus.PARTIAL, null, reason);
    }
    
    /**
     * Create a failed observation carrying the error text.
     */
    public static Fact failed(
            PrimitiveName primitive,
            ResourceRef resource,
            Instant observedAt,
            String errorCode,
            String errorMessage) {
        
        return new Fact(null, -1, -1, primitive, resource, Map.of(), observedAt, FactStatus.FAILED,
            errorCode, errorMessage == null ? "unknown error" : errorMessage);
    }
    
    /**
     * Stamp execution identity. Called only by the execution recorder.
     */
    public Fact withIdentity(UUID executionId, int index, int stepIndex) {
        return new Fact(executionId, index, stepIndex, primitive, resource, observations, observedAt,
            status, errorCode, errorMessage);
    }
    
    @JsonIgnore
    public boolean isUsable() {
        return status.isUsable();
    }
    
    public FactRef ref() {
        if (executionId == null) {
            throw new IllegalStateException("Fact has not been recorded in an execution: " + primitive);
        }
        return new FactRef(executionId, index);
    }
    
    // ========== Observation Accessors ==========
    
    public OptionalDouble number(String key) {
        Object value = observations.get(key);
        if (value instanceof Number n) {
            return OptionalDouble.of(n.doubleValue());
        }
        return OptionalDouble.empty();
    }
    
    public boolean flag(String key) {
        return Boolean.TRUE.equals(observations.get(key));
    }
    
    public Optional<String> text(String key) {
        Object value = observations.get(key);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }
    
    public List<?> list(String key) {
        Object value = observations.get(key);
        if (value instanceof List<?> items) {
            return items;
        }
        return List.of();
    }
    
    private static Map<String, Object> freezeMap(Map<?, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> copy.put(String.valueOf(key), freeze(value)));
        return Collections.unmodifiableMap(copy);
    }
    
    private static Object freeze(Object value) {
        if (value instanceof List<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            items.forEach(item -> copy.add(freeze(item)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> nested) {
            return freezeMap(nested);
        }
        return value;
    }
}
