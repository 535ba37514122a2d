package com.playpilot.orchestrator.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.playpilot.orchestrator.config.PlayPilotProperties;
import com.playpilot.orchestrator.config.TestProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmConfigTest {

    private final LlmConfig    config = new LlmConfig();
    private final ObjectMapper json   = new ObjectMapper();

    private static PlayPilotProperties props(String provider, String model, String apiKey) {
        return TestProperties.withLlm(new PlayPilotProperties.Llm(
                provider, model, apiKey, null, 2000, 0.3, Duration.ofSeconds(5)));
    }

    @Test
    void openai_selectedWithDefaultModel() {
        LlmProvider p = config.llmProvider(props("openai", null, "k"), json);
        assertThat(p).isInstanceOf(OpenAiProvider.class);
        assertThat(p.name()).isEqualTo("openai");
        assertThat(p.model()).isEqualTo(ProviderType.OPENAI.defaultModel());
    }

    @Test
    void anthropic_caseInsensitiveWithExplicitModel() {
        LlmProvider p = config.llmProvider(props("Anthropic", "claude-3-sonnet-20240229", "k"), json);
        assertThat(p).isInstanceOf(AnthropicProvider.class);
        assertThat(p.model()).isEqualTo("claude-3-sonnet-20240229");
    }

    @Test
    void unknownProvider_failsStartup() {
        assertThatThrownBy(() -> config.llmProvider(props("cohere", null, "k"), json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported LLM provider");
    }

    @Test
    void missingApiKey_failsStartup() {
        assertThatThrownBy(() -> config.llmProvider(props("anthropic", null, " "), json))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api-key");
    }

    @Test
    void forStatus_classifiesHttpFailures() {
        assertThat(LlmProviderException.forStatus("openai", 401, "").getKind())
                .isEqualTo(LlmProviderException.Kind.AUTHENTICATION);
        assertThat(LlmProviderException.forStatus("openai", 403, "").getKind())
                .isEqualTo(LlmProviderException.Kind.AUTHENTICATION);
        assertThat(LlmProviderException.forStatus("openai", 429, "").getKind())
                .isEqualTo(LlmProviderException.Kind.QUOTA);
        assertThat(LlmProviderException.forStatus("openai", 504, "").getKind())
                .isEqualTo(LlmProviderException.Kind.TIMEOUT);
        assertThat(LlmProviderException.forStatus("openai", 500, "").getKind())
                .isEqualTo(LlmProviderException.Kind.UNAVAILABLE);
    }
}
