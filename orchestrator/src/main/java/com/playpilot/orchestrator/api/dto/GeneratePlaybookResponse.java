package com.playpilot.orchestrator.api.dto;

import com.playpilot.orchestrator.generator.GenerationMetadata;
import com.playpilot.orchestrator.generator.GenerationResult;
import com.playpilot.orchestrator.model.Task;

import java.util.List;

/** Response body for POST /playbooks/generate. {@code task} is set only when a task was scheduled. */
public record GeneratePlaybookResponse(
        String             playbook,
        boolean            valid,
        List<String>       errors,
        List<String>       warnings,
        int                safetyScore,
        boolean            requiresApproval,
        GenerationMetadata metadata,
        TaskResponse       task
) {
    public static GeneratePlaybookResponse from(GenerationResult r, Task task) {
        return new GeneratePlaybookResponse(
                r.playbook(),
                r.valid(),
                r.errors(),
                r.warnings(),
                r.safetyScore(),
                r.requiresApproval(),
                r.metadata(),
                task == null ? null : TaskResponse.from(task)
        );
    }
}
