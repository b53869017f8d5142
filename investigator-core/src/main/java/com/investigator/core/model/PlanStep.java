package com.investigator.core.model;

/**
 * One primitive invocation in a diagnostic plan.
 * 
 * @param index         zero-based position in the plan
 * @param primitive     primitive to run
 * @param parameters    bound parameters
 * @param sourceClass   incident class whose strategy contributed this step
 */
public record PlanStep(
    int index,
    PrimitiveName primitive,
    PrimitiveParameters parameters,
    IncidentClass sourceClass
) {
    public PlanStep {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
        if (primitive == null || parameters == null || sourceClass == null) {
            throw new IllegalArgumentException("primitive, parameters and sourceClass are required");
        }
    }
}
