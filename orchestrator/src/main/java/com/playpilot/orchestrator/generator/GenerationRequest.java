package com.playpilot.orchestrator.generator;

import com.playpilot.orchestrator.model.SafetyLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the caller wants a playbook to do.
 *
 * @param description       free-text intent, required
 * @param targetHosts       inventory group the playbook targets; defaults to "all"
 * @param additionalContext optional extra constraints passed to the model verbatim
 * @param safetyLevel       null means the configured default level
 * @param variables         optional variables the model should declare and use
 */
public record GenerationRequest(
        String              description,
        String              targetHosts,
        String              additionalContext,
        SafetyLevel         safetyLevel,
        Map<String, Object> variables) {

    public GenerationRequest {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description is required");
        }
        if (targetHosts == null || targetHosts.isBlank()) {
            targetHosts = "all";
        }
        if (additionalContext == null) {
            additionalContext = "";
        }
        variables = variables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static GenerationRequest of(String description, String targetHosts, SafetyLevel level) {
        return new GenerationRequest(description, targetHosts, null, level, null);
    }
}
