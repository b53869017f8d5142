package com.investigator.engine.primitive;

import com.investigator.core.provider.MetricId;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a logical metric name ("cpu", "connections") for a resource type
 * into the provider metric that measures it.
 * 
 * This is what keeps the primitives provider-agnostic: the same utilization
 * primitive reads AWS/RDS CPUUtilization for a database and AWS/Lambda
 * ConcurrentExecutions for a function. Unknown pairs resolve to a generic
 * namespace with the logical name unchanged.
 */
public final class MetricCatalog {
    
    public static final String GENERIC_NAMESPACE = "Generic";
    
    private static final Map<String, String> TYPE_ALIASES = Map.ofEntries(
        Map.entry("instance", "ec2"),
        Map.entry("vm", "ec2"),
        Map.entry("server", "ec2"),
        Map.entry("database", "rds"),
        Map.entry("db", "rds"),
        Map.entry("postgres", "rds"),
        Map.entry("postgresql", "rds"),
        Map.entry("mysql", "rds"),
        Map.entry("aurora", "rds"),
        Map.entry("function", "lambda"),
        Map.entry("table", "dynamodb"),
        Map.entry("dynamo", "dynamodb")
    );
    
    private static final Map<String, String> METRIC_ALIASES = Map.ofEntries(
        Map.entry("cpuutilization", "cpu"),
        Map.entry("cpu_utilization", "cpu"),
        Map.entry("mem", "memory"),
        Map.entry("ram", "memory"),
        Map.entry("connection", "connections"),
        Map.entry("error", "errors"),
        Map.entry("error_rate", "errors"),
        Map.entry("invocations", "requests"),
        Map.entry("request", "requests"),
        Map.entry("throttle", "throttles"),
        Map.entry("throttling", "throttles"),
        Map.entry("lag", "replication_lag"),
        Map.entry("replica_lag", "replication_lag"),
        Map.entry("response_time", "latency"),
        Map.entry("spend", "cost")
    );
    
    private final Map<String, Map<String, MetricId>> table;
    
    private MetricCatalog(Map<String, Map<String, MetricId>> table) {
        this.table = table;
    }
    
    /**
     * The built-in AWS mapping.
     */
    public static MetricCatalog standard() {
        Map<String, Map<String, MetricId>> table = new HashMap<>();
        
        table.put("ec2", Map.of(
            "cpu", new MetricId("AWS/EC2", "CPUUtilization", "Percent"),
            "memory", new MetricId("CWAgent", "mem_used_percent", "Percent"),
            "disk", new MetricId("CWAgent", "disk_used_percent", "Percent"),
            "network", new MetricId("AWS/EC2", "NetworkIn", "Bytes"),
            "errors", new MetricId("AWS/EC2", "StatusCheckFailed", "Count")
        ));
        table.put("rds", Map.of(
            "cpu", new MetricId("AWS/RDS", "CPUUtilization", "Percent"),
            "connections", new MetricId("AWS/RDS", "DatabaseConnections", "Count"),
            "memory", new MetricId("AWS/RDS", "FreeableMemory", "Bytes"),
            "iops", new MetricId("AWS/RDS", "ReadIOPS", "Count/Second"),
            "latency", new MetricId("AWS/RDS", "ReadLatency", "Seconds"),
            "replication_lag", new MetricId("AWS/RDS", "ReplicaLag", "Seconds"),
            "disk", new MetricId("AWS/RDS", "FreeStorageSpace", "Bytes")
        ));
        table.put("lambda", Map.of(
            "cpu", new MetricId("AWS/Lambda", "ConcurrentExecutions", "Count"),
            "concurrency", new MetricId("AWS/Lambda", "ConcurrentExecutions", "Count"),
            "duration", new MetricId("AWS/Lambda", "Duration", "Milliseconds"),
            "latency", new MetricId("AWS/Lambda", "Duration", "Milliseconds"),
            "errors", new MetricId("AWS/Lambda", "Errors", "Count"),
            "throttles", new MetricId("AWS/Lambda", "Throttles", "Count"),
            "requests", new MetricId("AWS/Lambda", "Invocations", "Count")
        ));
        table.put("dynamodb", Map.of(
            "read_capacity", new MetricId("AWS/DynamoDB", "ConsumedReadCapacityUnits", "Count"),
            "write_capacity", new MetricId("AWS/DynamoDB", "ConsumedWriteCapacityUnits", "Count"),
            "cpu", new MetricId("AWS/DynamoDB", "ConsumedReadCapacityUnits", "Count"),
            "throttles", new MetricId("AWS/DynamoDB", "UserErrors", "Count"),
            "errors", new MetricId("AWS/DynamoDB", "SystemErrors", "Count"),
            "latency", new MetricId("AWS/DynamoDB", "SuccessfulRequestLatency", "Milliseconds"),
            "replication_lag", new MetricId("AWS/DynamoDB", "ReplicationLatency", "Milliseconds")
        ));
        
        Map<String, Map<String, MetricId>> frozen = new HashMap<>();
        table.forEach((type, metrics) -> frozen.put(type, Map.copyOf(metrics)));
        return new MetricCatalog(Map.copyOf(frozen));
    }
    
    /**
     * Resolve a logical metric for a resource type.
     */
    public MetricId resolve(String resourceType, String logicalMetric) {
        String metric = normalizeMetric(logicalMetric);
        if ("cost".equals(metric)) {
            return new MetricId("AWS/Billing", "EstimatedCharges", "USD");
        }
        Map<String, MetricId> metrics = table.get(normalizeType(resourceType));
        if (metrics != null && metrics.containsKey(metric)) {
            return metrics.get(metric);
        }
        return new MetricId(GENERIC_NAMESPACE, metric, null);
    }
    
    public boolean isMapped(String resourceType, String logicalMetric) {
        Map<String, MetricId> metrics = table.get(normalizeType(resourceType));
        return metrics != null && metrics.containsKey(normalizeMetric(logicalMetric));
    }
    
    public static String normalizeType(String resourceType) {
        if (resourceType == null) {
            return "";
        }
        String type = resourceType.trim().toLowerCase(Locale.ROOT);
        return TYPE_ALIASES.getOrDefault(type, type);
    }
    
    public static String normalizeMetric(String logicalMetric) {
        if (logicalMetric == null) {
            return "";
        }
        String metric = logicalMetric.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        return METRIC_ALIASES.getOrDefault(metric, metric);
    }
}
