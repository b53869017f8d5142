package com.investigator.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class FactTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final ResourceRef API = ResourceRef.of("lambda", "payments-api");

    @Test
    void nestedList_shouldNotChangeWhenProducerMutatesIt() {
        List<String> unhealthy = new ArrayList<>(List.of("orders-db"));
        Map<String, Object> observations = new LinkedHashMap<>();
        observations.put("unhealthy", unhealthy);

        Fact fact = Fact.ok(PrimitiveName.TRACE_DEPENDENCIES, API, observations, NOW);
        unhealthy.add("added-after-construction");
        observations.put("late", true);

        assertEquals(List.of("orders-db"), fact.list("unhealthy"));
        assertFalse(fact.observations().containsKey("late"));
    }

    @Test
    void nestedList_shouldRejectReaderMutation() {
        Fact fact = Fact.ok(PrimitiveName.TRACE_DEPENDENCIES, API,
            Map.of("unhealthy", new ArrayList<>(List.of("orders-db"))), NOW);

        @SuppressWarnings("unchecked")
        List<Object> read = (List<Object>) fact.list("unhealthy");
        assertThrows(UnsupportedOperationException.class, () -> read.add("from-reader"));
        assertThrows(UnsupportedOperationException.class, () -> fact.observations().put("x", 1));
    }

    @Test
    void nestedMap_shouldBeCopiedRecursively() {
        Map<String, Object> changed = new LinkedHashMap<>();
        changed.put("work_mem", new ArrayList<>(List.of("4MB", "64MB")));
        Fact fact = Fact.ok(PrimitiveName.DIFF_CONFIGURATION, API, Map.of("changed", changed), NOW);

        changed.put("max_connections", List.of("100", "50"));

        Map<?, ?> stored = (Map<?, ?>) fact.observations().get("changed");
        assertEquals(1, stored.size());
        assertThrows(UnsupportedOperationException.class, () -> ((List<?>) stored.get("work_mem")).clear());
    }

    @Test
    void observations_shouldKeepInsertionOrderAndNullValues() {
        Map<String, Object> observations = new LinkedHashMap<>();
        observations.put("current", 92.0);
        observations.put("baseline", null);
        observations.put("trend", "increasing");

        Fact fact = Fact.ok(PrimitiveName.ANALYZE_UTILIZATION, API, observations, NOW);

        assertEquals(List.of("current", "baseline", "trend"), new ArrayList<>(fact.observations().keySet()));
        assertTrue(fact.observations().containsKey("baseline"));
        assertEquals(92.0, fact.number("current").orElseThrow());
    }

    @Test
    void list_shouldBeEmptyForMissingOrScalarValue() {
        Fact fact = Fact.ok(PrimitiveName.ANALYZE_UTILIZATION, API, Map.of("current", 92.0), NOW);

        assertTrue(fact.list("missing").isEmpty());
        assertTrue(fact.list("current").isEmpty());
    }
}
