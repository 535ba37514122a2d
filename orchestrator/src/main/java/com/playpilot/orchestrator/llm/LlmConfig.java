package com.playpilot.orchestrator.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.playpilot.orchestrator.config.PlayPilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the completion backend once, at startup.
 *
 * A missing API key or an unknown provider string fails the context here
 * instead of on the first generation request.
 */
@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    public LlmProvider llmProvider(PlayPilotProperties properties, ObjectMapper objectMapper) {
        PlayPilotProperties.Llm llm = properties.llm();
        ProviderType type = ProviderType.from(llm.provider());

        if (llm.apiKey() == null || llm.apiKey().isBlank()) {
            throw new IllegalStateException(
                    "playpilot.llm.api-key is required when playpilot.llm.provider is '" + type.label() + "'");
        }
        String model   = isBlank(llm.model())   ? type.defaultModel()   : llm.model();
        String baseUrl = isBlank(llm.baseUrl()) ? type.defaultBaseUrl() : stripTrailingSlash(llm.baseUrl());

        log.info("LLM provider: {} (model={}, maxTokens={}, temperature={}, timeout={})",
                type.label(), model, llm.maxTokens(), llm.temperature(), llm.requestTimeout());

        return switch (type) {
            case OPENAI    -> new OpenAiProvider(baseUrl, llm.apiKey(), model, llm.requestTimeout(), objectMapper);
            case ANTHROPIC -> new AnthropicProvider(baseUrl, llm.apiKey(), model, llm.requestTimeout(), objectMapper);
        };
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
