package com.investigator.core.llm;

import java.util.Optional;

/**
 * Collaborator used when no model is configured.
 */
final class DisabledLanguageModel implements LanguageModelCollaborator {
    
    static final DisabledLanguageModel INSTANCE = new DisabledLanguageModel();
    
    private DisabledLanguageModel() {
    }
    
    @Override
    public Optional<String> generate(String prompt, String systemPrompt, ModelMode mode) {
        return Optional.empty();
    }
    
    @Override
    public boolean isEnabled() {
        return false;
    }
}
