package com.playpilot.orchestrator.generator;

import com.playpilot.orchestrator.model.SafetyLevel;

import java.time.Instant;

/**
 * Where a generated playbook came from. Stored as JSON on the Task it is
 * scheduled as.
 *
 * @param failureKind provider failure class, null when the provider answered
 */
public record GenerationMetadata(
        String      provider,
        String      model,
        SafetyLevel safetyLevel,
        Instant     generatedAt,
        String      failureKind) {}
