package com.investigator.engine.interpreter;

import com.investigator.core.llm.LanguageModelCollaborator;
import com.investigator.core.model.DiagnosticExecution;
import com.investigator.core.model.DiagnosticInterpretation;
import com.investigator.core.model.Fact;
import com.investigator.core.model.Hypothesis;
import com.investigator.core.model.HypothesisType;
import com.investigator.core.model.RecommendedAction;
import com.investigator.core.model.ResourceRef;
import com.investigator.engine.json.ObjectMappers;
import com.investigator.engine.metrics.InvestigationMetrics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a sealed execution into findings, ranked hypotheses and recommended actions.
 * 
 * Interpretation is a pure function of the execution (plus the model's answer,
 * when a model is enabled): rules read only recorded facts, and every hypothesis
 * cites the facts it was derived from.
 * 
 * Ranking:
 * 1. confidence, descending
 * 2. plan order of the earliest cited fact
 * 3. rule hypotheses before model hypotheses
 * 4. hypothesis type, then description
 */
public class DiagnosticInterpreter {
    
    private static final Logger log = LoggerFactory.getLogger(DiagnosticInterpreter.class);
    
    static final Comparator<Hypothesis> RANKING = Comparator
        .comparingDouble(Hypothesis::confidence).reversed()
        .thenComparingInt(Hypothesis::planOrder)
        .thenComparing(Hypothesis::source)
        .thenComparing(Hypothesis::type)
        .thenComparing(Hypothesis::description);
    
    private final List<HypothesisRule> rules;
    private final ActionTable actions;
    private final InterpreterSettings settings;
    private final ModelHypothesisProposer proposer;
    private final InvestigationMetrics metrics;
    
    public DiagnosticInterpreter(
            List<HypothesisRule> rules,
            ActionTable actions,
            InterpreterSettings settings,
            LanguageModelCollaborator collaborator,
            InvestigationMetrics metrics) {
        
        this.rules = List.copyOf(rules);
        this.actions = actions;
        this.settings = settings;
        this.metrics = metrics;
        this.proposer = new ModelHypothesisProposer(collaborator, settings, ObjectMappers.standard(), metrics);
    }
    
    /**
     * Rules-only interpreter with the built-in rule set and action table.
     */
    public DiagnosticInterpreter() {
        this(HypothesisRules.standard(), ActionTable.standard(), InterpreterSettings.rulesOnly(),
            LanguageModelCollaborator.disabled(), new InvestigationMetrics());
    }
    
    /**
     * Interpret an execution.
     * 
     * @throws IllegalStateException when the execution is FATAL; there is nothing to interpret
     */
    public DiagnosticInterpretation interpret(DiagnosticExecution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution is required");
        }
        if (!execution.status().isInterpretable()) {
            throw new IllegalStateException(
                "Execution " + execution.executionId() + " is " + execution.status() + " and cannot be interpreted");
        }
        
        EvidenceView evidence = new EvidenceView(execution);
        List<String> findings = execution.usableFacts().stream().map(FindingFormatter::format).toList();
        
        List<Hypothesis> hypotheses = new ArrayList<>();
        for (HypothesisRule rule : rules) {
            rule.evaluate(evidence).ifPresent(hypotheses::add);
        }
        int ruleCount = hypotheses.size();
        hypotheses.addAll(proposer.propose(evidence));
        metrics.hypothesesGenerated("rule", ruleCount);
        metrics.hypothesesGenerated("model", hypotheses.size() - ruleCount);
        
        boolean degraded = execution.status().isDegraded();
        if (degraded) {
            hypotheses.replaceAll(hypothesis -> hypothesis.scaled(settings.degradedPenalty()));
        }
        hypotheses.sort(RANKING);
        
        List<RecommendedAction> recommended = recommend(hypotheses, resourceOf(execution));
        double overall = hypotheses.isEmpty() ? 0.0 : hypotheses.get(0).confidence();
        boolean review = hypotheses.isEmpty() || overall < settings.reviewThreshold() || degraded;
        
        log.debug("Interpreted execution {}: {} hypotheses, overall confidence {}, review={}",
            execution.executionId(), hypotheses.size(), overall, review);
        
        return new DiagnosticInterpretation(execution.executionId(), execution.status(), findings,
            hypotheses, recommended, overall, review);
    }
    
    private List<RecommendedAction> recommend(List<Hypothesis> ranked, ResourceRef resource) {
        Set<HypothesisType> seenTypes = new LinkedHashSet<>();
        Set<String> seenActions = new LinkedHashSet<>();
        List<RecommendedAction> recommended = new ArrayList<>();
        for (Hypothesis hypothesis : ranked) {
            if (!seenTypes.add(hypothesis.type())) {
                continue;
            }
            List<ActionTable.ActionTemplate> templates = actions.actionsFor(hypothesis.type()).stream()
                .sorted(Comparator.comparingInt(ActionTable.ActionTemplate::priority))
                .toList();
            for (ActionTable.ActionTemplate template : templates) {
                if (!seenActions.add(template.description())) {
                    continue;
                }
                recommended.add(new RecommendedAction(recommended.size() + 1, template.priority(),
                    template.description(), template.render(resource), hypothesis.type(),
                    template.requiresApproval()));
            }
        }
        return recommended;
    }
    
    private static ResourceRef resourceOf(DiagnosticExecution execution) {
        return execution.facts().stream()
            .map(Fact::resource)
            .filter(ResourceRef::hasId)
            .findFirst()
            .orElse(ResourceRef.of(null, null));
    }
}
