package com.investigator.engine.planner;

import com.investigator.core.exception.PlanningException;
import com.investigator.core.model.DiagnosticPlan;
import com.investigator.core.model.IncidentClass;
import com.investigator.core.model.IncidentClassification;
import com.investigator.core.model.PlanStep;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.model.PrimitiveParameters;
import com.investigator.engine.primitive.PrimitiveRegistry;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a classification into a diagnostic plan.
 * 
 * Fully deterministic: no model calls, no clock, no randomness. The primary
 * class's primitives come first in strategy order, then each secondary class
 * in turn contributes the primitives not already planned. The first occurrence
 * of a primitive keeps its position and its parameter binding.
 * 
 * Primitives whose required context is missing are still planned; they fail
 * at execution time rather than vanish here.
 */
public class ReasoningPlanner {
    
    private static final Logger log = LoggerFactory.getLogger(ReasoningPlanner.class);
    
    private final StrategyTable strategies;
    
    /**
     * @throws PlanningException when the table references a primitive the registry lacks
     */
    public ReasoningPlanner(StrategyTable strategies, PrimitiveRegistry registry) {
        for (Strategy strategy : strategies.strategies()) {
            for (PrimitiveName primitive : strategy.primitives()) {
                if (!registry.contains(primitive)) {
                    throw new PlanningException(strategy.incidentClass().wireName(),
                        "primitive " + primitive.wireName() + " has no registered implementation");
                }
            }
        }
        this.strategies = strategies;
    }
    
    /**
     * Build the plan for a classification.
     * 
     * @throws PlanningException when a class has no strategy
     */
    public DiagnosticPlan plan(IncidentClassification classification) {
        if (classification == null) {
            throw new PlanningException("classification", "must not be null");
        }
        
        List<PlanStep> steps = new ArrayList<>();
        Set<PrimitiveName> planned = EnumSet.noneOf(PrimitiveName.class);
        
        for (IncidentClass incidentClass : classification.allClasses()) {
            Strategy strategy = strategies.strategyFor(incidentClass);
            for (PrimitiveName primitive : strategy.primitives()) {
                if (!planned.add(primitive)) {
                    continue;
                }
                PrimitiveParameters parameters = PrimitiveParameters.fromContext(
                    classification.context(), strategy.defaultMetric());
                steps.add(new PlanStep(steps.size(), primitive, parameters, incidentClass));
            }
        }
        
        DiagnosticPlan plan = DiagnosticPlan.create(
            classification.primaryClass(), classification.secondaryClasses(), steps);
        
        log.debug("Planned {} steps for {} (+{}): {}",
            steps.size(), classification.primaryClass(), classification.secondaryClasses(), plan.primitiveNames());
        
        return plan;
    }
    
    public StrategyTable strategies() {
        return strategies;
    }
}
