package com.investigator.core.provider;

/**
 * Coarse category of a change event.
 */
public enum ChangeCategory {
    CONFIGURATION,
    DEPLOYMENT,
    SCALING,
    PERMISSION,
    OTHER
}
