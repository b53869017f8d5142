package com.investigator.core.model;

/**
 * How an incident classification was reached.
 */
public enum ClassificationMethod {
    /**
     * Language model produced a well-formed classification.
     */
    MODEL,
    
    /**
     * Model unavailable, disabled or malformed; keyword rules matched.
     */
    KEYWORD_FALLBACK,
    
    /**
     * Nothing matched. Best-effort default class at the lowest confidence.
     */
    UNMATCHED_DEFAULT
}
