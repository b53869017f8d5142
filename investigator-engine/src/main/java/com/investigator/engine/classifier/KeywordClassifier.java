package com.investigator.engine.classifier;

import com.investigator.core.model.IncidentClass;
import com.investigator.core.model.IncidentContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic classification by ordered keyword patterns, plus context extraction.
 * 
 * The first matching rule gives the primary class; later matching rules give
 * secondary classes in rule order. Rule order matters: more specific symptoms
 * ("connection refused", "access denied") come before generic ones ("timeout", "slow").
 */
public final class KeywordClassifier {
    
    record Rule(IncidentClass incidentClass, Pattern pattern) {
        
        static Rule of(IncidentClass incidentClass, String regex) {
            return new Rule(incidentClass, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        
        boolean matches(String query) {
            return pattern.matcher(query).find();
        }
    }
    
    static final List<Rule> RULES = List.of(
        Rule.of(IncidentClass.PERMISSION_FAILURE,
            "access denied|permission|unauthori[sz]ed|forbidden|\\b403\\b|not authorized|\\biam\\b|rbac"),
        Rule.of(IncidentClass.DEPENDENCY_FAILURE,
            "connection refused|upstream|downstream|dependency|dependencies|\\b50[23]\\b|bad gateway|cannot connect to"),
        Rule.of(IncidentClass.NETWORK_CONNECTIVITY,
            "network|unreachable|dns|packet loss|security group|firewall|\\bvpc\\b|routing"),
        Rule.of(IncidentClass.COST_ANOMALY,
            "cost|spend|billing|bill\\b|expensive|budget"),
        Rule.of(IncidentClass.RESOURCE_SATURATION,
            "\\bcpu\\b|memory|\\boom\\b|out of memory|disk (?:is )?full|disk space|too many connections"
                + "|saturat|exhaust|high load|iops"),
        Rule.of(IncidentClass.LOAD_SPIKE,
            "spike|surge|traffic|burst|sudden increase|flood"),
        Rule.of(IncidentClass.SCALING_FAILURE,
            "scal(?:e|ing)|autoscal|capacity|not enough (?:instances|nodes|pods)"),
        Rule.of(IncidentClass.DEPLOYMENT_REGRESSION,
            "deploy|release|rollout|new version|after (?:the )?(?:update|upgrade)"),
        Rule.of(IncidentClass.CONFIGURATION_DRIFT,
            "config|setting|parameter group|drift|changed"),
        Rule.of(IncidentClass.AVAILABILITY_LOSS,
            "\\bdown\\b|outage|unavailable|crash|not responding|stopped|\\b500\\b|offline"),
        Rule.of(IncidentClass.PERFORMANCE_DEGRADATION,
            "slow|latency|timeout|timing out|timed out|degrad|sluggish|response time"),
        Rule.of(IncidentClass.DATA_INCONSISTENCY,
            "replication|replica lag|inconsisten|stale data|corrupt|out of sync")
    );
    
    private static final List<String> RESOURCE_TYPES =
        List.of("ec2", "rds", "lambda", "dynamodb", "s3", "ecs", "eks", "elb", "sqs", "pod");
    
    private static final List<String> SCOPES = List.of("production", "staging", "development");
    
    private static final Pattern RESOURCE_TYPE = Pattern.compile(
        "\\b(ec2|rds|lambda|dynamodb|dynamo|s3|ecs|eks|elb|alb|sqs|pods?|database|postgres|mysql|instance|function|bucket|queue)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern INSTANCE_ID = Pattern.compile("\\b(i-[0-9a-f]{8,17})\\b");
    private static final Pattern ARN = Pattern.compile("\\barn:aws[\\w-]*:([\\w-]+):[\\w-]*:\\d*:([^\\s\"']+)");
    private static final Pattern QUOTED = Pattern.compile("[\"'`]([A-Za-z0-9][\\w./:-]*)[\"'`]");
    private static final Pattern NAMED = Pattern.compile(
        "\\b(?:name|named|id|instance|function|db|database|bucket|table|queue|pod)[:=]?\\s+([A-Za-z0-9][\\w.-]*-[\\w.-]+|[a-z0-9]+\\d[\\w.-]*)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern METRIC = Pattern.compile(
        "\\b(cpu|memory|mem|disk|connections|latency|errors?|iops|throttl\\w*|requests|traffic)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern SCOPE = Pattern.compile(
        "\\b(production|prod|staging|stage|development|dev)\\b", Pattern.CASE_INSENSITIVE);
    
    private KeywordClassifier() {
    }
    
    /**
     * Classes matched by the query: primary first, then secondaries in rule order.
     * Empty when no rule matches.
     */
    public static List<IncidentClass> match(String query) {
        List<IncidentClass> matched = new ArrayList<>();
        if (query == null) {
            return matched;
        }
        for (Rule rule : RULES) {
            if (rule.matches(query) && !matched.contains(rule.incidentClass())) {
                matched.add(rule.incidentClass());
            }
        }
        return matched;
    }
    
    /**
     * Extract resource, metric and scope from the query text.
     */
    public static IncidentContext extractContext(String query) {
        if (query == null || query.isBlank()) {
            return IncidentContext.empty();
        }
        IncidentContext.Builder context = IncidentContext.builder();
        
        Matcher arn = ARN.matcher(query);
        if (arn.find()) {
            context.resourceType(normalizeResourceType(arn.group(1)).orElse(arn.group(1).toLowerCase(Locale.ROOT)));
            String resource = arn.group(2);
            context.resourceId(resource.substring(resource.lastIndexOf(resource.contains("/") ? '/' : ':') + 1));
        } else {
            findResourceType(query).ifPresent(context::resourceType);
            findResourceId(query).ifPresent(context::resourceId);
        }
        
        Matcher metric = METRIC.matcher(query);
        if (metric.find()) {
            context.metric(normalizeMetric(metric.group(1)));
        }
        
        Matcher scope = SCOPE.matcher(query);
        if (scope.find()) {
            context.scope(normalizeScope(scope.group(1)));
        }
        return context.build();
    }
    
    static Optional<String> findResourceType(String query) {
        Matcher matcher = RESOURCE_TYPE.matcher(query);
        while (matcher.find()) {
            Optional<String> type = normalizeResourceType(matcher.group(1));
            if (type.isPresent()) {
                return type;
            }
        }
        if (INSTANCE_ID.matcher(query).find()) {
            return Optional.of("ec2");
        }
        return Optional.empty();
    }
    
    static Optional<String> findResourceId(String query) {
        Matcher instance = INSTANCE_ID.matcher(query);
        if (instance.find()) {
            return Optional.of(instance.group(1));
        }
        Matcher quoted = QUOTED.matcher(query);
        if (quoted.find()) {
            return Optional.of(quoted.group(1));
        }
        Matcher named = NAMED.matcher(query);
        while (named.find()) {
            String candidate = named.group(1);
            if (!RESOURCE_TYPES.contains(candidate.toLowerCase(Locale.ROOT))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
    
    static Optional<String> normalizeResourceType(String raw) {
        String value = raw.toLowerCase(Locale.ROOT);
        return switch (value) {
            case "ec2", "instance" -> Optional.of("ec2");
            case "rds", "database", "postgres", "mysql" -> Optional.of("rds");
            case "lambda", "function" -> Optional.of("lambda");
            case "dynamodb", "dynamo" -> Optional.of("dynamodb");
            case "s3", "bucket" -> Optional.of("s3");
            case "elb", "alb", "elasticloadbalancing" -> Optional.of("elb");
            case "sqs", "queue" -> Optional.of("sqs");
            case "pod", "pods" -> Optional.of("pod");
            case "ecs", "eks" -> Optional.of(value);
            default -> Optional.empty();
        };
    }
    
    static String normalizeMetric(String raw) {
        String value = raw.toLowerCase(Locale.ROOT);
        if (value.startsWith("throttl")) {
            return "throttles";
        }
        return switch (value) {
            case "mem" -> "memory";
            case "error" -> "errors";
            case "traffic" -> "requests";
            default -> value;
        };
    }
    
    static String normalizeScope(String raw) {
        String value = raw.toLowerCase(Locale.ROOT);
        return switch (value) {
            case "prod" -> "production";
            case "stage" -> "staging";
            case "dev" -> "development";
            default -> SCOPES.contains(value) ? value : IncidentContext.DEFAULT_SCOPE;
        };
    }
}
