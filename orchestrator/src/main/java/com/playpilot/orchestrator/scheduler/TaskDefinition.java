package com.playpilot.orchestrator.scheduler;

import com.playpilot.orchestrator.generator.GenerationMetadata;
import com.playpilot.orchestrator.generator.GenerationResult;

import java.time.Instant;

/**
 * Everything needed to create a Task.
 *
 * Exactly one of {@code playbookPath} (authored playbook on disk) and
 * {@code playbookContent} (full playbook text) is set.
 */
public record TaskDefinition(
        String             playbookPath,
        String             playbookContent,
        String             inventory,
        Instant            runAt,
        boolean            generated,
        boolean            safetyValidated,
        Integer            safetyScore,
        GenerationMetadata generationMetadata) {

    public TaskDefinition {
        boolean hasPath    = playbookPath != null && !playbookPath.isBlank();
        boolean hasContent = playbookContent != null && !playbookContent.isBlank();
        if (hasPath == hasContent) {
            throw new IllegalArgumentException("Exactly one of playbookPath or playbookContent is required");
        }
        if (inventory == null || inventory.isBlank()) {
            throw new IllegalArgumentException("inventory is required");
        }
        if (runAt == null) {
            runAt = Instant.now();
        }
    }

    public static TaskDefinition authored(String playbookPath, String inventory, Instant runAt) {
        return new TaskDefinition(playbookPath, null, inventory, runAt, false, false, null, null);
    }

    public static TaskDefinition authoredContent(String playbookContent, String inventory, Instant runAt) {
        return new TaskDefinition(null, playbookContent, inventory, runAt, false, false, null, null);
    }

    /**
     * @throws IllegalArgumentException if the result was not accepted; an
     *         invalid generation must never reach the scheduler
     */
    public static TaskDefinition fromGeneration(GenerationResult result, String inventory, Instant runAt) {
        if (!result.valid()) {
            throw new IllegalArgumentException("Only a valid generation result can be scheduled: " + result.errors());
        }
        return new TaskDefinition(null, result.playbook(), inventory, runAt,
                true, true, result.safetyScore(), result.metadata());
    }
}
