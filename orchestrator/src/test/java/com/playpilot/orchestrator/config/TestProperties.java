package com.playpilot.orchestrator.config;

import com.playpilot.orchestrator.model.SafetyLevel;

import java.time.Duration;

/** Properties as application.yml would bind them, for tests without a Spring context. */
public final class TestProperties {

    private TestProperties() {}

    public static PlayPilotProperties defaults() {
        return withLlm(new PlayPilotProperties.Llm("openai", "gpt-4", "test-key", null, 2000, 0.3, Duration.ofSeconds(5)));
    }

    public static PlayPilotProperties withLlm(PlayPilotProperties.Llm llm) {
        return new PlayPilotProperties(
                llm,
                new PlayPilotProperties.Safety(SafetyLevel.MEDIUM),
                new PlayPilotProperties.Queue(2),
                new PlayPilotProperties.Execution("ansible-playbook", ".", Duration.ofMinutes(1)),
                new PlayPilotProperties.Templates(true));
    }
}
