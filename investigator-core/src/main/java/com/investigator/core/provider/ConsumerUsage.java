package com.investigator.core.provider;

/**
 * Load attributed to a single consumer (client, query, caller) of a resource.
 */
public record ConsumerUsage(
    String consumer,
    double value
) {}
