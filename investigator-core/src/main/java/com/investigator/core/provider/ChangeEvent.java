package com.investigator.core.provider;

import com.investigator.core.model.ResourceRef;
import java.time.Instant;
import java.util.Map;

/**
 * A change recorded against a resource (API call, deployment, policy edit).
 * 
 * @param action          provider action name, e.g. ModifyDBParameterGroup
 * @param previousValues  changed keys and their values before the change, when known
 * @param newValues       changed keys and their values after the change, when known
 */
public record ChangeEvent(
    String eventId,
    String action,
    ChangeCategory category,
    String actor,
    Instant occurredAt,
    ResourceRef resource,
    Map<String, String> previousValues,
    Map<String, String> newValues
) {
    public ChangeEvent {
        previousValues = previousValues == null ? Map.of() : Map.copyOf(previousValues);
        newValues = newValues == null ? Map.of() : Map.copyOf(newValues);
        category = category == null ? ChangeCategory.OTHER : category;
    }
}
