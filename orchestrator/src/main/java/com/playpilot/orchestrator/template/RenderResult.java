package com.playpilot.orchestrator.template;

import java.util.List;

/**
 * Either a rendered playbook or the complete list of validation errors,
 * never both.
 */
public record RenderResult(String playbook, List<String> errors) {

    public RenderResult {
        errors = List.copyOf(errors);
    }

    static RenderResult rendered(String playbook) {
        return new RenderResult(playbook, List.of());
    }

    static RenderResult invalid(List<String> errors) {
        return new RenderResult(null, errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
