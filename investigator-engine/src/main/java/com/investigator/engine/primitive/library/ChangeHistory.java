package com.investigator.engine.primitive.library;

import com.investigator.core.provider.ChangeCategory;
import com.investigator.core.provider.ChangeEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Shared handling of change events for the change, diff and deployment primitives.
 */
final class ChangeHistory {
    
    static final Duration LOOKBACK = Duration.ofHours(24);
    
    static final Set<String> MODIFICATION_ACTIONS = Set.of(
        "ModifyDBInstance", "ModifyDBParameterGroup", "ModifyDBCluster", "UpdateFunctionConfiguration",
        "ModifyInstanceAttribute", "PutBucketPolicy", "UpdateTable", "PutParameter",
        "AuthorizeSecurityGroupIngress", "RevokeSecurityGroupIngress", "UpdateAutoScalingGroup");
    
    static final Set<String> DEPLOYMENT_ACTIONS = Set.of(
        "CreateDeployment", "UpdateService", "RunTask", "UpdateFunctionCode", "PublishVersion", "RollingUpdate");
    
    private ChangeHistory() {
    }
    
    /**
     * Category of an event, inferring from the action name when the provider reported OTHER.
     */
    static ChangeCategory categorize(ChangeEvent event) {
        if (event.category() != ChangeCategory.OTHER) {
            return event.category();
        }
        if (DEPLOYMENT_ACTIONS.contains(event.action())) {
            return ChangeCategory.DEPLOYMENT;
        }
        if (MODIFICATION_ACTIONS.contains(event.action())) {
            return ChangeCategory.CONFIGURATION;
        }
        return ChangeCategory.OTHER;
    }
    
    /**
     * Newest first, ties by event id.
     */
    static List<ChangeEvent> newestFirst(List<ChangeEvent> events) {
        return events.stream()
            .sorted(Comparator.comparing(ChangeEvent::occurredAt).reversed()
                .thenComparing(event -> event.eventId() == null ? "" : event.eventId()))
            .toList();
    }
    
    static long minutesBefore(Instant now, Instant occurredAt) {
        return Duration.between(occurredAt, now).toMinutes();
    }
}
