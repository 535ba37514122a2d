package com.playpilot.orchestrator.api.dto;

import com.playpilot.orchestrator.model.Task;
import com.playpilot.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a task for POST /tasks, GET /tasks and GET /tasks/{id}.
 * {@code jobId} is the handle for POST /tasks/jobs/{jobId}/cancel.
 */
public record TaskResponse(
        UUID       id,
        String     jobId,
        TaskStatus status,
        String     playbookPath,
        String     playbookContent,
        String     inventory,
        Instant    runAt,
        boolean    generated,
        boolean    safetyValidated,
        Integer    safetyScore,
        String     generationMetadata,
        String     output,
        Instant    createdAt,
        Instant    startedAt,
        Instant    finishedAt
) {
    public static TaskResponse from(Task t) {
        return new TaskResponse(
                t.getId(),
                t.getQueueJobId(),
                t.getStatus(),
                t.getPlaybookPath(),
                t.getPlaybookContent(),
                t.getInventory(),
                t.getRunAt(),
                t.isGenerated(),
                t.isSafetyValidated(),
                t.getSafetyScore(),
                t.getGenerationMetadata(),
                t.getOutput(),
                t.getCreatedAt(),
                t.getStartedAt(),
                t.getFinishedAt()
        );
    }
}
