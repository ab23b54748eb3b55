package com.example.FinSolve.service;

import com.example.FinSolve.config.FinSolveProperties;
import com.example.FinSolve.exception.GenerationUnavailableException;
import com.example.FinSolve.model.GenerationRequest;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Generation through a Spring AI ChatClient.
 * The system prompt is the client's default, configured in {@link com.example.FinSolve.config.AiConfig}.
 */
@Service
@RequiredArgsConstructor
public class ChatClientGenerationService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationService.class);

    private static final String DEFAULT_MODEL = "deepseek";

    private final Map<String, ChatClient> chatClients;
    private final FinSolveProperties properties;

    @Override
    public String complete(GenerationRequest request) {
        ChatClient chatClient = resolveClient(properties.getGeneration().getModel());
        try {
            return chatClient.prompt()
                    .user(request.userPrompt())
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            log.error("Generation service error for query='{}': {}", request.query(), ex.getMessage());
            throw new GenerationUnavailableException("Generation service call failed", ex);
        }
    }

    /**
     * Resolve ChatClient bean based on the configured model identifier.
     * Supported lookup keys:
     *  - "<model>ChatClient"
     *  - "<model>"
     * Fallback:
     *  - default model "deepseekChatClient"
     *  - any available ChatClient if nothing matches
     */
    ChatClient resolveClient(String model) {
        String key = Optional.ofNullable(model)
                .filter(m -> !m.isBlank())
                .map(m -> m.toLowerCase(Locale.ROOT))
                .orElse(DEFAULT_MODEL);
        if (chatClients.containsKey(key + "ChatClient")) {
            return chatClients.get(key + "ChatClient");
        }
        if (chatClients.containsKey(key)) {
            return chatClients.get(key);
        }
        ChatClient fallback = chatClients.get(DEFAULT_MODEL + "ChatClient");
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new GenerationUnavailableException("No ChatClient beans are available"));
    }
}
