package com.investigator.examples.scenario;

import com.investigator.core.model.ResourceRef;
import com.investigator.core.provider.ChangeCategory;
import com.investigator.core.provider.ChangeEvent;
import com.investigator.core.provider.ConnectivityResult;
import com.investigator.core.provider.ConsumerUsage;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.core.provider.ScalingState;
import com.investigator.engine.provider.InMemoryResourceProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Seeded provider data for the demonstration scenarios.
 */
public final class IncidentScenarios {
    
    public static final String ORDERS_DB = "orders-db";
    public static final String PAYMENTS_API = "payments-api";
    public static final String SESSION_CACHE = "session-cache";
    
    private IncidentScenarios() {
    }
    
    /**
     * orders-db CPU climbs to 95% ten minutes after a parameter group change;
     * the same hour yesterday averaged 30%.
     */
    public static ResourceProvider rdsHighCpuAfterParameterChange(Instant now) {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        for (int i = 0; i < 12; i++) {
            Instant at = now.minus(Duration.ofMinutes(55 - i * 5L));
            provider.point(ORDERS_DB, "CPUUtilization", at, 60.0 + i * 3.2);
            provider.point(ORDERS_DB, "CPUUtilization", at.minus(Duration.ofDays(1)), 30.0);
        }
        provider.change(ORDERS_DB, new ChangeEvent("evt-1042", "ModifyDBParameterGroup", ChangeCategory.CONFIGURATION,
            "deploy-bot", now.minus(Duration.ofMinutes(10)), ResourceRef.of("rds", ORDERS_DB),
            Map.of("work_mem", "4MB"), Map.of("work_mem", "64MB")));
        provider.consumers(ORDERS_DB, List.of(
            new ConsumerUsage("checkout-service", 40.0),
            new ConsumerUsage("reporting-job", 35.0),
            new ConsumerUsage("inventory-sync", 25.0)));
        provider.scaling(ORDERS_DB, new ScalingState(true, 1, 4, 2, 2, List.of()));
        return provider.build();
    }
    
    /**
     * payments-api cannot reach orders-db, which reports storage-full; the
     * session cache is healthy. 12% of invocations are failing.
     */
    public static ResourceProvider connectionRefusedFromDatabase(Instant now) {
        InMemoryResourceProvider.Builder provider = InMemoryResourceProvider.builder();
        ResourceRef api = ResourceRef.of("lambda", PAYMENTS_API);
        ResourceRef database = ResourceRef.of("rds", ORDERS_DB);
        ResourceRef cache = ResourceRef.of("elasticache", SESSION_CACHE);
        
        provider.dependencies(PAYMENTS_API, List.of(database, cache));
        provider.configuration(PAYMENTS_API, Map.of("State", "Active", "Runtime", "java17"));
        provider.configuration(ORDERS_DB, Map.of("DBInstanceStatus", "storage-full"));
        provider.configuration(SESSION_CACHE, Map.of("status", "available"));
        provider.connectivity(PAYMENTS_API, ConnectivityResult.unreachable(api, database, "connection refused"));
        provider.connectivity(PAYMENTS_API, ConnectivityResult.reachable(api, cache, Duration.ofMillis(3)));
        
        for (int i = 0; i < 6; i++) {
            Instant at = now.minus(Duration.ofMinutes(50 - i * 10L));
            provider.point(PAYMENTS_API, "Errors", at, 20.0);
            provider.point(PAYMENTS_API, "Invocations", at, 1000.0 / 6);
            provider.point(PAYMENTS_API, "Throttles", at, 0.0);
            provider.point(PAYMENTS_API, "Throttles", at.minus(Duration.ofDays(1)), 0.0);
        }
        return provider.build();
    }
}
