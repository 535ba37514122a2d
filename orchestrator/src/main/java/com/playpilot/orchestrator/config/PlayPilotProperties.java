package com.playpilot.orchestrator.config;

import com.playpilot.orchestrator.model.SafetyLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * The single configuration value for the orchestrator.
 *
 * Bound once at startup from application.yml (and the environment variables
 * it references), then passed into each component's constructor. Nothing
 * else in the codebase reads environment state.
 */
@ConfigurationProperties(prefix = "playpilot")
public record PlayPilotProperties(
        @DefaultValue Llm       llm,
        @DefaultValue Safety    safety,
        @DefaultValue Queue     queue,
        @DefaultValue Execution execution,
        @DefaultValue Templates templates) {

    /**
     * @param provider       "openai" or "anthropic"; selected once at startup
     * @param model          provider model id; blank means the provider default
     * @param apiKey         required for the selected provider
     * @param baseUrl        API root; blank means the provider's public endpoint
     * @param maxTokens      output bound for a single completion
     * @param temperature    fixed sampling temperature
     * @param requestTimeout bounded wait on one provider call
     */
    public record Llm(
            @DefaultValue("openai") String   provider,
            String                           model,
            String                           apiKey,
            String                           baseUrl,
            @DefaultValue("2000")   int      maxTokens,
            @DefaultValue("0.3")    double   temperature,
            @DefaultValue("60s")    Duration requestTimeout) {}

    public record Safety(@DefaultValue("medium") SafetyLevel defaultLevel) {}

    public record Queue(@DefaultValue("4") int workerThreads) {}

    /**
     * @param command          the ansible-playbook executable
     * @param workingDirectory directory playbook paths are resolved against
     * @param timeout          a run still going after this is killed and marked failed
     */
    public record Execution(
            @DefaultValue("ansible-playbook") String   command,
            @DefaultValue(".")                String   workingDirectory,
            @DefaultValue("30m")              Duration timeout) {}

    public record Templates(@DefaultValue("true") boolean seedDefaults) {}
}
