package com.playpilot.orchestrator.safety;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of evaluating one playbook against one safety level.
 *
 * Derived purely from the playbook text and level: evaluating the same
 * input twice yields an equal verdict.
 *
 * @param accepted         score meets the level threshold, no violations, structure valid
 * @param score            0..100
 * @param violations       denylist and capability breaches, in detection order
 * @param structuralErrors malformed YAML or playbook shape; non-empty means score 0
 * @param warnings         risky but permitted usage (e.g. become at medium)
 * @param requiresApproval accepted, but uses elevated or unrestricted capabilities
 */
public record SafetyVerdict(
        boolean         accepted,
        int             score,
        List<Violation> violations,
        List<String>    structuralErrors,
        List<String>    warnings,
        boolean         requiresApproval) {

    public SafetyVerdict {
        violations       = List.copyOf(violations);
        structuralErrors = List.copyOf(structuralErrors);
        warnings         = List.copyOf(warnings);
    }

    static SafetyVerdict structuralFailure(List<String> errors) {
        return structuralFailure(errors, List.of());
    }

    static SafetyVerdict structuralFailure(List<String> errors, List<Violation> violations) {
        return new SafetyVerdict(false, 0, violations, errors, List.of(), false);
    }

    /** Structural errors followed by violation messages, as reported to callers. */
    public List<String> errors() {
        List<String> all = new ArrayList<>(structuralErrors);
        violations.forEach(v -> all.add(v.message()));
        return List.copyOf(all);
    }
}
