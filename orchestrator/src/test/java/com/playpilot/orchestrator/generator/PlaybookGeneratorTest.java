package com.playpilot.orchestrator.generator;

import com.playpilot.orchestrator.config.TestProperties;
import com.playpilot.orchestrator.llm.LlmProvider;
import com.playpilot.orchestrator.llm.LlmProviderException;
import com.playpilot.orchestrator.model.SafetyLevel;
import com.playpilot.orchestrator.safety.SafetyPolicyEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PlaybookGenerator.
 *
 * The provider is mocked; the safety engine and prompt builder are real,
 * so these tests cover the whole pipeline short of the network.
 */
@ExtendWith(MockitoExtension.class)
class PlaybookGeneratorTest {

    @Mock LlmProvider provider;

    SimpleMeterRegistry meters;
    PlaybookGenerator   generator;

    private static final String NGINX_REPLY = """
            Here is your playbook:
            ```yaml
            - name: Install nginx
              hosts: web
              become: yes
              tasks:
                - name: Install nginx
                  apt:
                    name: nginx
                    state: present
            ```
            """;

    @BeforeEach
    void setUp() {
        lenient().when(provider.name()).thenReturn("openai");
        lenient().when(provider.model()).thenReturn("gpt-4");
        meters    = new SimpleMeterRegistry();
        generator = new PlaybookGenerator(provider, new SafetyPolicyEngine(), new PromptBuilder(),
                TestProperties.defaults(), meters);
    }

    @Test
    void installNginx_medium_validWithWarning() {
        when(provider.complete(contains("install nginx"), eq(2000), eq(0.3))).thenReturn(NGINX_REPLY);

        GenerationResult r = generator.generate(GenerationRequest.of("install nginx", "web", SafetyLevel.MEDIUM));

        assertThat(r.valid()).isTrue();
        assertThat(r.errors()).isEmpty();
        assertThat(r.safetyScore()).isBetween(75, 100);
        assertThat(r.warnings()).anyMatch(w -> w.contains("become"));
        assertThat(r.playbook()).startsWith("- name: Install nginx");
        assertThat(r.metadata().provider()).isEqualTo("openai");
        assertThat(r.metadata().model()).isEqualTo("gpt-4");
        assertThat(r.metadata().safetyLevel()).isEqualTo(SafetyLevel.MEDIUM);
        assertThat(r.metadata().failureKind()).isNull();
        assertThat(meters.counter("playpilot.generation.results", "provider", "openai", "outcome", "valid").count())
                .isEqualTo(1.0);
    }

    @Test
    void dangerousPattern_invalidButPlaybookReturned() {
        when(provider.complete(anyString(), anyInt(), anyDouble())).thenReturn("""
                - hosts: all
                  tasks:
                    - name: wipe
                      command: rm -rf /
                """);

        GenerationResult r = generator.generate(GenerationRequest.of("clean disk", null, SafetyLevel.LOW));

        assertThat(r.valid()).isFalse();
        assertThat(r.errors()).contains("Dangerous pattern detected: rm -rf");
        assertThat(r.safetyScore()).isLessThanOrEqualTo(80);
        assertThat(r.playbook()).contains("rm -rf");
        assertThat(meters.counter("playpilot.generation.results", "provider", "openai", "outcome", "rejected").count())
                .isEqualTo(1.0);
    }

    @Test
    void emptyReply_structuralFailure() {
        when(provider.complete(anyString(), anyInt(), anyDouble())).thenReturn("   ");

        GenerationResult r = generator.generate(GenerationRequest.of("anything", null, null));

        assertThat(r.valid()).isFalse();
        assertThat(r.safetyScore()).isZero();
        assertThat(r.errors()).containsExactly("Empty or invalid YAML content");
    }

    @Test
    void missingLevel_usesConfiguredDefault() {
        when(provider.complete(anyString(), anyInt(), anyDouble())).thenReturn(NGINX_REPLY);

        GenerationResult r = generator.generate(GenerationRequest.of("install nginx", "web", null));

        assertThat(r.metadata().safetyLevel()).isEqualTo(SafetyLevel.MEDIUM);
    }

    @Test
    void providerTimeout_degradesToInvalidResult() {
        when(provider.complete(anyString(), anyInt(), anyDouble()))
                .thenThrow(new LlmProviderException(LlmProviderException.Kind.TIMEOUT, "openai", "no reply within 5s"));

        GenerationResult r = generator.generate(GenerationRequest.of("install nginx", "web", SafetyLevel.MEDIUM));

        assertThat(r.valid()).isFalse();
        assertThat(r.playbook()).isNull();
        assertThat(r.safetyScore()).isZero();
        assertThat(r.errors()).hasSize(1);
        assertThat(r.errors().get(0)).startsWith("Provider error (timeout)");
        assertThat(r.metadata().failureKind()).isEqualTo("TIMEOUT");
        assertThat(meters.counter("playpilot.generation.results", "provider", "openai", "outcome", "provider_error").count())
                .isEqualTo(1.0);
    }

    @Test
    void truncatedReply_reportedAsTruncatedOutput() {
        when(provider.complete(anyString(), anyInt(), anyDouble()))
                .thenThrow(new LlmProviderException(LlmProviderException.Kind.TRUNCATED, "openai", "stopped at limit"));

        GenerationResult r = generator.generate(GenerationRequest.of("install nginx", "web", SafetyLevel.MEDIUM));

        assertThat(r.valid()).isFalse();
        assertThat(r.safetyScore()).isZero();
        assertThat(r.errors()).hasSize(1);
        assertThat(r.errors().get(0)).startsWith("Truncated output");
    }

    @Test
    void everyCallIsTimed() {
        when(provider.complete(anyString(), anyInt(), anyDouble())).thenReturn(NGINX_REPLY);

        generator.generate(GenerationRequest.of("install nginx", "web", null));
        generator.generate(GenerationRequest.of("install nginx", "web", null));

        assertThat(meters.timer("playpilot.generation.duration", "provider", "openai").count()).isEqualTo(2);
    }
}
