package com.example.FinSolve.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class AiConfig {

    /**
     * DeepSeek is the default ChatClient.
     * Only created when a DeepSeekChatModel bean exists,
     * so a missing DeepSeek API key does not stop the app from starting.
     */
    @Bean
    @Primary
    @ConditionalOnBean(DeepSeekChatModel.class)
    public ChatClient deepseekChatClient(DeepSeekChatModel model, FinSolveProperties properties) {
        return ChatClient.builder(model)
                .defaultSystem(properties.getGeneration().getSystemPrompt())
                .build();
    }

    /**
     * OpenAI ChatClient as an alternative.
     */
    @Bean
    @ConditionalOnBean(OpenAiChatModel.class)
    public ChatClient openaiChatClient(OpenAiChatModel model, FinSolveProperties properties) {
        return ChatClient.builder(model)
                .defaultSystem(properties.getGeneration().getSystemPrompt())
                .build();
    }

    /**
     * If no ChatClient beans are registered, build one from DeepSeek when available,
     * otherwise fall back to OpenAI.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient defaultChatClient(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider,
            FinSolveProperties properties
    ) {
        String systemPrompt = properties.getGeneration().getSystemPrompt();
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel)
                    .defaultSystem(systemPrompt)
                    .build();
        }

        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel)
                    .defaultSystem(systemPrompt)
                    .build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }
}
