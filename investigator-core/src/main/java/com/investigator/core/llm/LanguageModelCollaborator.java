package com.investigator.core.llm;

import java.util.Optional;

/**
 * Optional language-model collaborator used by the classifier and interpreter.
 * 
 * READ-ONLY: the model only ever sees text it is given and only ever returns
 * text. Its output is an untrusted candidate that callers validate.
 */
public interface LanguageModelCollaborator {
    
    /**
     * Generate a response.
     * 
     * @param prompt       user prompt
     * @param systemPrompt system instructions
     * @param mode         reasoning effort; NONE returns empty without calling anything
     * @return the response text, or empty when the collaborator is disabled
     * @throws ModelUnavailableException when the backend fails
     */
    Optional<String> generate(String prompt, String systemPrompt, ModelMode mode) throws ModelUnavailableException;
    
    /**
     * Whether this collaborator can produce responses at all.
     */
    boolean isEnabled();
    
    /**
     * A collaborator that never calls a model.
     */
    static LanguageModelCollaborator disabled() {
        return DisabledLanguageModel.INSTANCE;
    }
}
