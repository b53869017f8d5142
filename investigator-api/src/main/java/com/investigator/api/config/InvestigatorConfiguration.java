package com.investigator.api.config;

import com.investigator.advisory.ChatClientLanguageModel;
import com.investigator.advisory.ChatModelSettings;
import com.investigator.core.llm.LanguageModelCollaborator;
import com.investigator.core.llm.ModelMode;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.audit.AuditSink;
import com.investigator.engine.audit.LoggingAuditSink;
import com.investigator.engine.classifier.IncidentClassifier;
import com.investigator.engine.executor.DiagnosticExecutor;
import com.investigator.engine.interpreter.ActionTable;
import com.investigator.engine.interpreter.DiagnosticInterpreter;
import com.investigator.engine.interpreter.HypothesisRules;
import com.investigator.engine.json.ObjectMappers;
import com.investigator.engine.metrics.InvestigationMetrics;
import com.investigator.engine.planner.ReasoningPlanner;
import com.investigator.engine.planner.StrategyTable;
import com.investigator.engine.primitive.PrimitiveRegistry;
import com.investigator.engine.provider.InMemoryResourceProvider;
import com.investigator.engine.service.DiagnosticInvestigator;
import com.investigator.engine.service.InvestigationService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the investigation pipeline from {@link InvestigatorProperties}.
 * 
 * The language model is used only when {@code investigator.llm.mode} is not
 * {@code none} and a Spring AI {@link ChatModel} bean is present; otherwise the
 * classifier and interpreter run deterministically.
 */
@Configuration
public class InvestigatorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(InvestigatorConfiguration.class);

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "incident-investigator");
    }

    @Bean
    public InvestigationMetrics investigationMetrics() {
        return new InvestigationMetrics();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock investigatorClock() {
        return Clock.systemUTC();
    }

    @Bean
    public LanguageModelCollaborator languageModelCollaborator(
            InvestigatorProperties properties,
            ObjectProvider<ChatModel> chatModel) {
        
        InvestigatorProperties.Llm llm = properties.getLlm();
        ChatModel model = chatModel.getIfAvailable();
        if (!llm.getMode().isEnabled() || model == null) {
            log.info("Language model disabled (mode={}, chat model {}); using deterministic classification",
                llm.getMode(), model == null ? "absent" : "present");
            return LanguageModelCollaborator.disabled();
        }
        log.info("Language model enabled (mode={})", llm.getMode());
        return new ChatClientLanguageModel(ChatClient.builder(model).build(),
            new ChatModelSettings(llm.getTemperature(), llm.getMaxTokens()));
    }

    @Bean
    public PrimitiveRegistry primitiveRegistry() {
        return PrimitiveRegistry.standard();
    }

    @Bean
    public StrategyTable strategyTable() {
        return StrategyTable.standard();
    }

    @Bean
    public IncidentClassifier incidentClassifier(
            LanguageModelCollaborator collaborator,
            InvestigatorProperties properties,
            InvestigationMetrics metrics) {
        
        return new IncidentClassifier(collaborator, properties.getClassifier().toSettings()
            .withModelMode(effectiveMode(properties, properties.getClassifier().getModelMode())), metrics);
    }

    @Bean
    public ReasoningPlanner reasoningPlanner(StrategyTable strategyTable, PrimitiveRegistry primitiveRegistry) {
        return new ReasoningPlanner(strategyTable, primitiveRegistry);
    }

    @Bean
    public DiagnosticExecutor diagnosticExecutor(
            PrimitiveRegistry primitiveRegistry,
            InvestigatorProperties properties,
            Clock clock,
            InvestigationMetrics metrics) {
        
        return new DiagnosticExecutor(primitiveRegistry, properties.getExecutor().toSettings(), clock, metrics);
    }

    @Bean
    public DiagnosticInterpreter diagnosticInterpreter(
            LanguageModelCollaborator collaborator,
            InvestigatorProperties properties,
            InvestigationMetrics metrics) {
        
        return new DiagnosticInterpreter(HypothesisRules.standard(), ActionTable.standard(),
            properties.getInterpreter().toSettings(), collaborator, metrics);
    }

    @Bean
    public AuditSink auditSink(InvestigatorProperties properties) {
        if (!properties.getAudit().isEnabled()) {
            return AuditSink.noop();
        }
        return new LoggingAuditSink(ObjectMappers.standard());
    }

    /**
     * Placeholder provider with no data. Deployments supply a provider bound to
     * their cloud account.
     */
    @Bean
    @ConditionalOnMissingBean
    public ResourceProvider resourceProvider() {
        log.warn("No ResourceProvider configured; investigations will run against an empty in-memory provider");
        return InMemoryResourceProvider.empty();
    }

    @Bean
    public InvestigationService investigationService(
            IncidentClassifier classifier,
            ReasoningPlanner planner,
            DiagnosticExecutor executor,
            DiagnosticInterpreter interpreter,
            AuditSink auditSink,
            InvestigationMetrics metrics,
            Clock clock) {
        
        return new DiagnosticInvestigator(classifier, planner, executor, interpreter, auditSink, metrics, clock);
    }

    private static ModelMode effectiveMode(
            InvestigatorProperties properties,
            ModelMode componentMode) {
        
        return properties.getLlm().getMode().isEnabled()
            ? componentMode
            : ModelMode.NONE;
    }
}
