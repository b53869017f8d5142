package com.investigator.engine.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investigator.core.llm.LanguageModelCollaborator;
import com.investigator.core.llm.ModelUnavailableException;
import com.investigator.core.model.ClassificationMethod;
import com.investigator.core.model.IncidentClass;
import com.investigator.core.model.IncidentClassification;
import com.investigator.core.model.IncidentContext;
import com.investigator.engine.json.ObjectMappers;
import com.investigator.engine.metrics.InvestigationMetrics;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a free-text incident description onto the fixed incident taxonomy.
 * 
 * The language model is asked first when one is enabled. Its answer is only a
 * candidate: unknown class names are dropped, an unknown primary class makes
 * the answer malformed, and confidence is clamped. Any model failure falls back
 * to {@link KeywordClassifier}. Classification never fails.
 */
public class IncidentClassifier {
    
    private static final Logger log = LoggerFactory.getLogger(IncidentClassifier.class);
    
    static final String COMPONENT = "classifier";
    
    static final String SYSTEM_PROMPT = """
        You classify cloud operations incidents. Respond with JSON only, in the form:
        {"primary_class": "...", "secondary_classes": ["..."], "confidence": 0.0,
         "context": {"resource_type": "...", "resource_id": "...", "metric": "...", "scope": "..."}}
        Use only these incident classes:
        %s
        Use null for context fields that the description does not mention.
        """;
    
    private final LanguageModelCollaborator collaborator;
    private final ClassifierSettings settings;
    private final ObjectMapper mapper;
    private final InvestigationMetrics metrics;
    
    public IncidentClassifier(
            LanguageModelCollaborator collaborator,
            ClassifierSettings settings,
            InvestigationMetrics metrics) {
        
        this.collaborator = collaborator;
        this.settings = settings;
        this.metrics = metrics;
        this.mapper = ObjectMappers.standard();
    }
    
    /**
     * Keyword-only classifier.
     */
    public IncidentClassifier() {
        this(LanguageModelCollaborator.disabled(), ClassifierSettings.defaults(), new InvestigationMetrics());
    }
    
    /**
     * Classify a query.
     * 
     * @param query free-text incident description
     * @param hints caller-supplied context; present fields override extracted ones. May be null.
     */
    public IncidentClassification classify(String query, IncidentContext hints) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        
        IncidentClassification classification = classifyWithModel(query, hints)
            .orElseGet(() -> classifyWithKeywords(query, hints));
        
        metrics.classified(classification.method(), classification.primaryClass());
        log.info("Classified incident as {} (secondary={}, confidence={}, method={}{})",
            classification.primaryClass().wireName(),
            classification.secondaryClasses().stream().map(IncidentClass::wireName).toList(),
            classification.confidence(), classification.method(),
            classification.belowThreshold() ? ", below threshold" : "");
        return classification;
    }
    
    IncidentClassification classifyWithKeywords(String query, IncidentContext hints) {
        IncidentContext context = merge(hints, KeywordClassifier.extractContext(query));
        List<IncidentClass> matched = KeywordClassifier.match(query);
        if (matched.isEmpty()) {
            return IncidentClassification.create(IncidentClass.PERFORMANCE_DEGRADATION, List.of(), context,
                settings.unmatchedConfidence(), ClassificationMethod.UNMATCHED_DEFAULT, settings.confidenceThreshold());
        }
        return IncidentClassification.create(matched.get(0), matched.subList(1, matched.size()), context,
            settings.fallbackConfidence(), ClassificationMethod.KEYWORD_FALLBACK, settings.confidenceThreshold());
    }
    
    private Optional<IncidentClassification> classifyWithModel(String query, IncidentContext hints) {
        if (!settings.modelMode().isEnabled() || !collaborator.isEnabled()) {
            return Optional.empty();
        }
        
        Optional<String> response;
        try {
            response = collaborator.generate("Incident description: " + query, systemPrompt(), settings.modelMode());
        } catch (ModelUnavailableException e) {
            log.warn("Model unavailable for classification, using keyword fallback: {}", e.getMessage());
            metrics.modelResponseRejected(COMPONENT, "unavailable");
            return Optional.empty();
        }
        if (response.isEmpty() || response.get().isBlank()) {
            return Optional.empty();
        }
        
        try {
            return parse(response.get(), query, hints);
        } catch (JsonProcessingException e) {
            log.warn("Malformed classification response, using keyword fallback: {}", e.getOriginalMessage());
            metrics.modelResponseRejected(COMPONENT, "malformed");
            return Optional.empty();
        }
    }
    
    Optional<IncidentClassification> parse(String response, String query, IncidentContext hints)
            throws JsonProcessingException {
        
        JsonNode root = ObjectMappers.readModelJson(mapper, response);
        Optional<IncidentClass> primary = IncidentClass.fromWireName(root.path("primary_class").asText(null));
        if (primary.isEmpty()) {
            log.warn("Classification response names no known primary class: {}", root.path("primary_class"));
            metrics.modelResponseRejected(COMPONENT, "unknown_class");
            return Optional.empty();
        }
        
        List<IncidentClass> secondaries = new ArrayList<>();
        for (JsonNode name : root.path("secondary_classes")) {
            Optional<IncidentClass> secondary = IncidentClass.fromWireName(name.asText(null));
            if (secondary.isPresent()) {
                secondaries.add(secondary.get());
            } else {
                log.debug("Dropping unknown secondary class {}", name);
            }
        }
        
        JsonNode contextNode = root.path("context");
        IncidentContext modelContext = IncidentContext.builder()
            .resourceType(text(contextNode, "resource_type"))
            .resourceId(text(contextNode, "resource_id"))
            .metric(text(contextNode, "metric"))
            .scope(text(contextNode, "scope"))
            .build();
        IncidentContext context = merge(hints, modelContext.orElse(KeywordClassifier.extractContext(query)));
        
        double confidence = root.path("confidence").isNumber() ? root.path("confidence").asDouble() : 0.0;
        return Optional.of(IncidentClassification.create(primary.get(), secondaries, context, confidence,
            ClassificationMethod.MODEL, settings.confidenceThreshold()));
    }
    
    private static IncidentContext merge(IncidentContext hints, IncidentContext extracted) {
        return hints == null ? extracted : hints.orElse(extracted);
    }
    
    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() || "null".equalsIgnoreCase(text) ? null : text;
    }
    
    private static String systemPrompt() {
        String classes = Arrays.stream(IncidentClass.values())
            .map(incidentClass -> "- " + incidentClass.wireName() + ": " + incidentClass.description())
            .collect(Collectors.joining("\n"));
        return SYSTEM_PROMPT.formatted(classes);
    }
}
