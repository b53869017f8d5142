package com.investigator.core.provider;

/**
 * Whether the investigated resource's identity may perform an action.
 */
public record PermissionCheck(
    String action,
    boolean allowed,
    String reason
) {}
