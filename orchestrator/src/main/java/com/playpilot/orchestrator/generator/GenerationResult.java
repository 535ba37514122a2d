package com.playpilot.orchestrator.generator;

import com.playpilot.orchestrator.safety.SafetyVerdict;

import java.util.List;

/**
 * Outcome of one generation request. Built once, never mutated.
 *
 * @param playbook         extracted YAML; null when the provider call failed
 * @param valid            true only when the safety verdict accepted the playbook
 * @param errors           structural errors and violations, or the provider failure
 * @param warnings         permitted but risky usage
 * @param safetyScore      0..100
 * @param requiresApproval accepted but uses elevated or unrestricted capabilities
 */
public record GenerationResult(
        String             playbook,
        boolean            valid,
        List<String>       errors,
        List<String>       warnings,
        int                safetyScore,
        boolean            requiresApproval,
        GenerationMetadata metadata) {

    public GenerationResult {
        errors   = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    static GenerationResult fromVerdict(String playbook, SafetyVerdict verdict, GenerationMetadata metadata) {
        return new GenerationResult(
                playbook,
                verdict.accepted(),
                verdict.errors(),
                verdict.warnings(),
                verdict.score(),
                verdict.requiresApproval(),
                metadata);
    }

    static GenerationResult failure(String error, GenerationMetadata metadata) {
        return new GenerationResult(null, false, List.of(error), List.of(), 0, false, metadata);
    }
}
