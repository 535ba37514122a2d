package com.playpilot.orchestrator.scheduler;

import java.util.UUID;

/** What the queue needs to run a task later: its own job id and the task it points at. */
public record JobSpec(String jobId, UUID taskId) {}
