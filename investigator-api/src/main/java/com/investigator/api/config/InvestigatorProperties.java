package com.investigator.api.config;

import com.investigator.core.llm.ModelMode;
import com.investigator.core.model.PrimitiveName;
import com.investigator.engine.classifier.ClassifierSettings;
import com.investigator.engine.executor.ExecutorSettings;
import com.investigator.engine.interpreter.InterpreterSettings;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration bound from {@code investigator.*}.
 */
@ConfigurationProperties(prefix = "investigator")
public class InvestigatorProperties {

    private final Classifier classifier = new Classifier();
    private final Executor executor = new Executor();
    private final Interpreter interpreter = new Interpreter();
    private final Llm llm = new Llm();
    private final Audit audit = new Audit();

    public Classifier getClassifier() {
        return classifier;
    }

    public Executor getExecutor() {
        return executor;
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    public Llm getLlm() {
        return llm;
    }

    public Audit getAudit() {
        return audit;
    }

    public static class Classifier {
        private double confidenceThreshold = ClassifierSettings.DEFAULT_CONFIDENCE_THRESHOLD;
        private double fallbackConfidence = ClassifierSettings.DEFAULT_FALLBACK_CONFIDENCE;
        private double unmatchedConfidence = ClassifierSettings.DEFAULT_UNMATCHED_CONFIDENCE;
        private ModelMode modelMode = ModelMode.BALANCED;

        public ClassifierSettings toSettings() {
            return new ClassifierSettings(confidenceThreshold, fallbackConfidence, unmatchedConfidence, modelMode);
        }

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public double getFallbackConfidence() {
            return fallbackConfidence;
        }

        public void setFallbackConfidence(double fallbackConfidence) {
            this.fallbackConfidence = fallbackConfidence;
        }

        public double getUnmatchedConfidence() {
            return unmatchedConfidence;
        }

        public void setUnmatchedConfidence(double unmatchedConfidence) {
            this.unmatchedConfidence = unmatchedConfidence;
        }

        public ModelMode getModelMode() {
            return modelMode;
        }

        public void setModelMode(ModelMode modelMode) {
            this.modelMode = modelMode;
        }
    }

    public static class Executor {
        private Duration stepTimeout = ExecutorSettings.DEFAULT_STEP_TIMEOUT;
        private Map<PrimitiveName, Duration> stepTimeouts = new EnumMap<>(PrimitiveName.class);

        public ExecutorSettings toSettings() {
            ExecutorSettings.Builder builder = ExecutorSettings.builder().stepTimeout(stepTimeout);
            stepTimeouts.forEach(builder::stepTimeout);
            return builder.build();
        }

        public Duration getStepTimeout() {
            return stepTimeout;
        }

        public void setStepTimeout(Duration stepTimeout) {
            this.stepTimeout = stepTimeout;
        }

        public Map<PrimitiveName, Duration> getStepTimeouts() {
            return stepTimeouts;
        }

        public void setStepTimeouts(Map<PrimitiveName, Duration> stepTimeouts) {
            this.stepTimeouts = stepTimeouts;
        }
    }

    public static class Interpreter {
        private double degradedPenalty = InterpreterSettings.DEFAULT_DEGRADED_PENALTY;
        private double reviewThreshold = InterpreterSettings.DEFAULT_REVIEW_THRESHOLD;
        private boolean modelHypothesesEnabled = true;
        private int maxModelHypotheses = InterpreterSettings.DEFAULT_MAX_MODEL_HYPOTHESES;
        private ModelMode modelMode = ModelMode.BALANCED;

        public InterpreterSettings toSettings() {
            return new InterpreterSettings(degradedPenalty, reviewThreshold, modelHypothesesEnabled,
                maxModelHypotheses, modelMode);
        }

        public double getDegradedPenalty() {
            return degradedPenalty;
        }

        public void setDegradedPenalty(double degradedPenalty) {
            this.degradedPenalty = degradedPenalty;
        }

        public double getReviewThreshold() {
            return reviewThreshold;
        }

        public void setReviewThreshold(double reviewThreshold) {
            this.reviewThreshold = reviewThreshold;
        }

        public boolean isModelHypothesesEnabled() {
            return modelHypothesesEnabled;
        }

        public void setModelHypothesesEnabled(boolean modelHypothesesEnabled) {
            this.modelHypothesesEnabled = modelHypothesesEnabled;
        }

        public int getMaxModelHypotheses() {
            return maxModelHypotheses;
        }

        public void setMaxModelHypotheses(int maxModelHypotheses) {
            this.maxModelHypotheses = maxModelHypotheses;
        }

        public ModelMode getModelMode() {
            return modelMode;
        }

        public void setModelMode(ModelMode modelMode) {
            this.modelMode = modelMode;
        }
    }

    public static class Llm {
        private ModelMode mode = ModelMode.NONE;
        private double temperature = 0.0;
        private int maxTokens = 1000;

        public ModelMode getMode() {
            return mode;
        }

        public void setMode(ModelMode mode) {
            this.mode = mode;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    public static class Audit {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
