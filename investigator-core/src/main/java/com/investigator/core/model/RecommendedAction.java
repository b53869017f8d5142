package com.investigator.core.model;

/**
 * Recommended next step for an operator.
 * Recommendations are never executed by the investigator itself.
 * 
 * @param rank              1-based position in the final ordering
 * @param priority          declared priority from the action table (1 = most urgent)
 * @param description       what to do
 * @param command           executable command, or null when none applies
 * @param hypothesisType    hypothesis that suggested the action
 * @param requiresApproval  true when the command would change the resource
 */
public record RecommendedAction(
    int rank,
    int priority,
    String description,
    String command,
    HypothesisType hypothesisType,
    boolean requiresApproval
) {}
