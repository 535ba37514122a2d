package com.playpilot.orchestrator.api.dto;

import com.playpilot.orchestrator.generator.GenerationRequest;
import com.playpilot.orchestrator.model.SafetyLevel;

import java.time.Instant;
import java.util.Map;

/**
 * Request body for POST /playbooks/generate.
 *
 * Required: description
 * Optional: schedule=true submits the playbook as a task when it is accepted,
 *   against {@code inventory} at {@code runAt} (defaults: targetHosts, now).
 */
public record GeneratePlaybookRequest(
        String              description,
        String              targetHosts,
        String              additionalContext,
        SafetyLevel         safetyLevel,
        Map<String, Object> variables,
        boolean             schedule,
        String              inventory,
        Instant             runAt) {

    public GenerationRequest toGenerationRequest() {
        return new GenerationRequest(description, targetHosts, additionalContext, safetyLevel, variables);
    }
}
