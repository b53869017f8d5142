package com.investigator.advisory;

import com.investigator.core.llm.LanguageModelCollaborator;
import com.investigator.core.llm.ModelMode;
import com.investigator.core.llm.ModelUnavailableException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

/**
 * Language-model collaborator backed by a Spring AI {@link ChatClient}.
 * 
 * CRITICAL: This collaborator is READ-ONLY. It registers no tools, so the model
 * can only return text, and callers treat that text as an untrusted candidate.
 * 
 * Prompts are sent as prebuilt messages rather than templates, so JSON examples
 * in a prompt are passed through verbatim.
 */
public class ChatClientLanguageModel implements LanguageModelCollaborator {
    
    private static final Logger log = LoggerFactory.getLogger(ChatClientLanguageModel.class);
    
    private final ChatClient chatClient;
    private final ChatModelSettings settings;
    
    public ChatClientLanguageModel(ChatClient chatClient, ChatModelSettings settings) {
        if (chatClient == null) {
            throw new IllegalArgumentException("chatClient is required");
        }
        this.chatClient = chatClient;
        this.settings = settings == null ? ChatModelSettings.defaults() : settings;
    }
    
    @Override
    public Optional<String> generate(String prompt, String systemPrompt, ModelMode mode)
            throws ModelUnavailableException {
        
        if (mode == null || !mode.isEnabled()) {
            return Optional.empty();
        }
        
        List<Message> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new SystemMessage(systemPrompt));
        }
        messages.add(new UserMessage(prompt));
        ChatOptions options = ChatOptions.builder()
            .temperature(settings.temperature())
            .maxTokens(settings.maxTokensFor(mode))
            .build();
        
        long start = System.currentTimeMillis();
        String content;
        try {
            content = chatClient.prompt(new Prompt(messages, options)).call().content();
        } catch (RuntimeException e) {
            throw new ModelUnavailableException("Model call failed: " + e.getMessage(), e);
        }
        log.debug("Model responded in {}ms (mode={}, {} chars)",
            System.currentTimeMillis() - start, mode, content == null ? 0 : content.length());
        
        return content == null || content.isBlank() ? Optional.empty() : Optional.of(content);
    }
    
    @Override
    public boolean isEnabled() {
        return true;
    }
}
