package com.playpilot.orchestrator.execution;

import java.util.UUID;

/**
 * @param playbookPath    authored playbook on disk; used when content is null
 * @param playbookContent full generated playbook text
 */
public record ExecutionRequest(UUID taskId, String playbookPath, String playbookContent, String inventory) {}
