package com.investigator.engine.planner;

import com.investigator.core.model.IncidentClass;
import com.investigator.core.model.PrimitiveName;
import java.util.List;

/**
 * Ordered diagnostic primitives for one incident class.
 * 
 * @param incidentClass  the class this strategy investigates
 * @param primitives     primitives in the order they should run
 * @param defaultMetric  metric bound when the classification context names none, may be null
 * @param rationale      one-line description of the investigation approach
 */
public record Strategy(
    IncidentClass incidentClass,
    List<PrimitiveName> primitives,
    String defaultMetric,
    String rationale
) {
    public Strategy {
        primitives = primitives == null ? List.of() : List.copyOf(primitives);
    }
}
