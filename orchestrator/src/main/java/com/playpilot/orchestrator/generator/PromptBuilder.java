package com.playpilot.orchestrator.generator;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/** Renders the fixed instruction prompt for one request. */
@Component
public class PromptBuilder {

    private static final String PROMPT = """
            You are an expert Ansible playbook developer. Create a safe and well-structured \
            Ansible playbook based on the following requirements:

            DESCRIPTION: %s
            HOSTS: %s
            ADDITIONAL CONTEXT: %s
            %s
            Requirements:
            1. Use only safe, idempotent operations
            2. Include proper error handling and validation
            3. Use handlers for service restarts
            4. Give every task a clear, descriptive name
            5. Follow Ansible best practices
            6. Avoid destructive operations such as rm -rf, dd, mkfs, disk partitioning, \
            shutdown or reboot, firewall resets and account deletion
            7. Use become: yes only when necessary
            8. Prefer dedicated modules over shell and command
            9. Include proper variable usage where appropriate

            Return one complete, valid YAML playbook in a single ```yaml fenced block.
            """;

    public String build(GenerationRequest request) {
        return PROMPT.formatted(
                request.description().strip(),
                request.targetHosts(),
                request.additionalContext().isBlank() ? "none" : request.additionalContext().strip(),
                variablesSection(request.variables()));
    }

    private static String variablesSection(Map<String, Object> variables) {
        if (variables.isEmpty()) {
            return "";
        }
        String lines = variables.entrySet().stream()
                .map(e -> "- " + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
        return "VARIABLES (declare these under vars: and reference them):\n" + lines + "\n";
    }
}
