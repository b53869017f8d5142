package com.investigator.core.model;

/**
 * Where a hypothesis came from.
 */
public enum HypothesisSource {
    RULE,
    MODEL
}
