package com.playpilot.orchestrator.generator;

import com.playpilot.orchestrator.config.PlayPilotProperties;
import com.playpilot.orchestrator.llm.LlmProvider;
import com.playpilot.orchestrator.llm.LlmProviderException;
import com.playpilot.orchestrator.model.SafetyLevel;
import com.playpilot.orchestrator.safety.SafetyPolicyEngine;
import com.playpilot.orchestrator.safety.SafetyVerdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;

/**
 * Natural language in, validated playbook out.
 *
 * Flow per request:
 *   prompt → provider.complete → extract YAML → safety evaluation → result
 *
 * Provider failures never escape: they become an invalid result with a
 * single error naming the failure class, so the caller can retry. Stateless,
 * safe to call from any number of threads.
 */
@Service
public class PlaybookGenerator {

    private static final Logger log = LoggerFactory.getLogger(PlaybookGenerator.class);

    private final LlmProvider         provider;
    private final SafetyPolicyEngine  safetyPolicy;
    private final PromptBuilder       promptBuilder;
    private final PlayPilotProperties properties;

    // Metrics
    private final Timer   generationTimer;
    private final Counter validCounter;
    private final Counter rejectedCounter;
    private final Counter providerErrorCounter;

    public PlaybookGenerator(LlmProvider provider,
                             SafetyPolicyEngine safetyPolicy,
                             PromptBuilder promptBuilder,
                             PlayPilotProperties properties,
                             MeterRegistry meterRegistry) {
        this.provider      = provider;
        this.safetyPolicy  = safetyPolicy;
        this.promptBuilder = promptBuilder;
        this.properties    = properties;

        this.generationTimer = Timer.builder("playpilot.generation.duration")
                .description("Wall time of one provider call")
                .tag("provider", provider.name())
                .register(meterRegistry);
        this.validCounter         = resultCounter(meterRegistry, "valid");
        this.rejectedCounter      = resultCounter(meterRegistry, "rejected");
        this.providerErrorCounter = resultCounter(meterRegistry, "provider_error");
    }

    private Counter resultCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("playpilot.generation.results")
                .tag("provider", provider.name())
                .tag("outcome", outcome)
                .register(registry);
    }

    public GenerationResult generate(GenerationRequest request) {
        SafetyLevel level = request.safetyLevel() != null
                ? request.safetyLevel()
                : properties.safety().defaultLevel();
        PlayPilotProperties.Llm llm = properties.llm();

        String raw;
        Timer.Sample sample = Timer.start();
        try {
            raw = provider.complete(promptBuilder.build(request), llm.maxTokens(), llm.temperature());
        } catch (LlmProviderException e) {
            log.warn("Generation failed for '{}': {}", abbreviate(request.description()), e.getMessage());
            providerErrorCounter.increment();
            return GenerationResult.failure(describe(e), metadata(level, e.getKind().name()));
        } finally {
            sample.stop(generationTimer);
        }

        String playbook = ResponseParser.extractPlaybook(raw);
        SafetyVerdict verdict = safetyPolicy.evaluate(playbook, level);

        if (verdict.accepted()) {
            validCounter.increment();
            log.info("Generated playbook accepted (level={}, score={}, warnings={})",
                    level.label(), verdict.score(), verdict.warnings().size());
        } else {
            rejectedCounter.increment();
            log.info("Generated playbook rejected (level={}, score={}): {}",
                    level.label(), verdict.score(), verdict.errors());
        }
        return GenerationResult.fromVerdict(playbook, verdict, metadata(level, null));
    }

    private GenerationMetadata metadata(SafetyLevel level, String failureKind) {
        return new GenerationMetadata(provider.name(), provider.model(), level, Instant.now(), failureKind);
    }

    private static String describe(LlmProviderException e) {
        return switch (e.getKind()) {
            case TRUNCATED -> "Truncated output: " + e.getMessage();
            default        -> "Provider error (" + e.getKind().name().toLowerCase(Locale.ROOT) + "): " + e.getMessage();
        };
    }

    private static String abbreviate(String s) {
        return s.length() <= 60 ? s : s.substring(0, 57) + "...";
    }
}
