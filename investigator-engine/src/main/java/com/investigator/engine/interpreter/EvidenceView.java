package com.investigator.engine.interpreter;

import com.investigator.core.model.DiagnosticExecution;
import com.investigator.core.model.Fact;
import com.investigator.core.model.FactRef;
import com.investigator.core.model.Hypothesis;
import com.investigator.core.model.HypothesisSource;
import com.investigator.core.model.HypothesisType;
import com.investigator.core.model.IncidentClassification;
import com.investigator.core.model.PrimitiveName;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over the usable facts of one execution, for hypothesis rules.
 */
public final class EvidenceView {
    
    private final DiagnosticExecution execution;
    
    public EvidenceView(DiagnosticExecution execution) {
        this.execution = execution;
    }
    
    public DiagnosticExecution execution() {
        return execution;
    }
    
    /**
     * First usable fact from a primitive.
     */
    public Optional<Fact> first(PrimitiveName primitive) {
        return execution.factsFrom(primitive).stream().filter(Fact::isUsable).findFirst();
    }
    
    /**
     * All usable facts from a primitive, in plan order.
     */
    public List<Fact> all(PrimitiveName primitive) {
        return execution.factsFrom(primitive).stream().filter(Fact::isUsable).toList();
    }
    
    /**
     * Build a rule hypothesis citing the given facts. Absent (null) facts are skipped;
     * at least one must be present.
     */
    public Hypothesis hypothesis(HypothesisType type, String description, double confidence, Fact... facts) {
        List<Fact> cited = Arrays.stream(facts).filter(Objects::nonNull).toList();
        return hypothesis(type, description, confidence, HypothesisSource.RULE, cited);
    }
    
    public Hypothesis hypothesis(HypothesisType type, String description, double confidence,
                                 HypothesisSource source, List<Fact> cited) {
        List<FactRef> refs = new ArrayList<>(cited.size());
        int planOrder = Integer.MAX_VALUE;
        for (Fact fact : cited) {
            if (!refs.contains(fact.ref())) {
                refs.add(fact.ref());
            }
            planOrder = Math.min(planOrder, fact.stepIndex());
        }
        return new Hypothesis(type, description, IncidentClassification.clamp(confidence), refs, source, planOrder);
    }
}
