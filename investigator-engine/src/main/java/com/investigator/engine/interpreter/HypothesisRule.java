package com.investigator.engine.interpreter;

import com.investigator.core.model.Hypothesis;
import java.util.Optional;

/**
 * Deterministic heuristic from facts to one hypothesis.
 */
@FunctionalInterface
public interface HypothesisRule {
    
    /**
     * @return a hypothesis citing the facts that support it, or empty when the rule does not apply
     */
    Optional<Hypothesis> evaluate(EvidenceView evidence);
}
