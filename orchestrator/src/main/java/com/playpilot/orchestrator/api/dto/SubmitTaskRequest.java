package com.playpilot.orchestrator.api.dto;

import java.time.Instant;

/**
 * Request body for POST /tasks: an authored playbook, by path or inline.
 *
 * Exactly one of playbookPath / playbookContent. runAt defaults to now.
 */
public record SubmitTaskRequest(String playbookPath, String playbookContent, String inventory, Instant runAt) {}
