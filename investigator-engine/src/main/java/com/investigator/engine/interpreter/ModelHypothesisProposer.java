package com.investigator.engine.interpreter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investigator.core.llm.LanguageModelCollaborator;
import com.investigator.core.llm.ModelUnavailableException;
import com.investigator.core.model.DiagnosticExecution;
import com.investigator.core.model.Fact;
import com.investigator.core.model.FactRef;
import com.investigator.core.model.Hypothesis;
import com.investigator.core.model.HypothesisSource;
import com.investigator.core.model.HypothesisType;
import com.investigator.engine.json.ObjectMappers;
import com.investigator.engine.metrics.InvestigationMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the language model for causes the rules did not produce.
 * 
 * The model sees only usable facts, numbered by fact index, and must cite those
 * numbers. A proposal is accepted only when every cited index names a usable fact
 * of this execution; anything else is discarded and counted as a rejection.
 * Model failures never fail the interpretation.
 */
public class ModelHypothesisProposer {
    
    private static final Logger log = LoggerFactory.getLogger(ModelHypothesisProposer.class);
    
    static final String COMPONENT = "interpreter";
    
    static final String SYSTEM_PROMPT = """
        You are assisting with a cloud incident investigation.
        You are given numbered observations. Propose up to %d likely root causes that
        are supported by the observations. Respond with JSON only, in the form:
        {"hypotheses": [{"cause": "...", "confidence": 0.0, "evidence": [0, 2]}]}
        "evidence" must list the numbers of the observations that support the cause.
        Do not propose causes that no observation supports.
        """;
    
    private final LanguageModelCollaborator collaborator;
    private final InterpreterSettings settings;
    private final ObjectMapper mapper;
    private final InvestigationMetrics metrics;
    
    public ModelHypothesisProposer(
            LanguageModelCollaborator collaborator,
            InterpreterSettings settings,
            ObjectMapper mapper,
            InvestigationMetrics metrics) {
        
        this.collaborator = collaborator;
        this.settings = settings;
        this.mapper = mapper;
        this.metrics = metrics;
    }
    
    public boolean isActive() {
        return settings.modelHypothesesEnabled()
            && settings.maxModelHypotheses() > 0
            && settings.modelMode().isEnabled()
            && collaborator.isEnabled();
    }
    
    /**
     * Propose validated model hypotheses, or an empty list when the model is
     * disabled, unavailable or returns nothing usable.
     */
    public List<Hypothesis> propose(EvidenceView evidence) {
        DiagnosticExecution execution = evidence.execution();
        List<Fact> usable = execution.usableFacts();
        if (!isActive() || usable.isEmpty()) {
            return List.of();
        }
        
        Optional<String> response;
        try {
            response = collaborator.generate(buildPrompt(usable),
                SYSTEM_PROMPT.formatted(settings.maxModelHypotheses()), settings.modelMode());
        } catch (ModelUnavailableException e) {
            log.warn("Model unavailable for hypothesis proposal, continuing with rule hypotheses: {}", e.getMessage());
            metrics.modelResponseRejected(COMPONENT, "unavailable");
            return List.of();
        }
        if (response.isEmpty() || response.get().isBlank()) {
            return List.of();
        }
        
        JsonNode root;
        try {
            root = ObjectMappers.readModelJson(mapper, response.get());
        } catch (JsonProcessingException e) {
            log.warn("Discarding malformed model response: {}", e.getOriginalMessage());
            metrics.modelResponseRejected(COMPONENT, "malformed");
            return List.of();
        }
        
        JsonNode proposals = root.isArray() ? root : root.path("hypotheses");
        if (!proposals.isArray()) {
            log.warn("Model response has no hypotheses array");
            metrics.modelResponseRejected(COMPONENT, "malformed");
            return List.of();
        }
        
        List<Hypothesis> accepted = new ArrayList<>();
        for (JsonNode proposal : proposals) {
            if (accepted.size() >= settings.maxModelHypotheses()) {
                break;
            }
            toHypothesis(proposal, evidence).ifPresent(accepted::add);
        }
        return accepted;
    }
    
    String buildPrompt(List<Fact> usable) {
        StringBuilder prompt = new StringBuilder("Observations:\n");
        for (Fact fact : usable) {
            prompt.append('[').append(fact.index()).append("] ")
                .append(fact.primitive().wireName()).append(" on ").append(fact.resource()).append(": ");
            try {
                prompt.append(mapper.writeValueAsString(fact.observations()));
            } catch (JsonProcessingException e) {
                prompt.append(fact.observations());
            }
            prompt.append('\n');
        }
        return prompt.toString();
    }
    
    private Optional<Hypothesis> toHypothesis(JsonNode proposal, EvidenceView evidence) {
        String cause = proposal.path("cause").asText("").trim();
        if (cause.isEmpty()) {
            reject("missing_cause", proposal);
            return Optional.empty();
        }
        JsonNode cited = proposal.path("evidence");
        if (!cited.isArray() || cited.isEmpty()) {
            reject("missing_evidence", proposal);
            return Optional.empty();
        }
        
        DiagnosticExecution execution = evidence.execution();
        List<Fact> facts = new ArrayList<>();
        for (JsonNode index : cited) {
            if (!index.isIntegralNumber() || !index.canConvertToInt() || index.asInt() < 0) {
                reject("invalid_evidence", proposal);
                return Optional.empty();
            }
            Optional<Fact> fact = execution.find(new FactRef(execution.executionId(), index.asInt()));
            if (fact.isEmpty() || !fact.get().isUsable()) {
                reject("invalid_evidence", proposal);
                return Optional.empty();
            }
            facts.add(fact.get());
        }
        
        double confidence = proposal.path("confidence").asDouble(0.0);
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        return Optional.of(evidence.hypothesis(HypothesisType.MODEL_PROPOSED, cause, confidence,
            HypothesisSource.MODEL, facts));
    }
    
    private void reject(String reason, JsonNode proposal) {
        log.info("Discarding model hypothesis ({}): {}", reason, proposal);
        metrics.modelResponseRejected(COMPONENT, reason);
    }
}
