package com.playpilot.orchestrator.model;

/**
 * Execution status of a scheduled Task.
 *
 * Transitions:
 *   PENDING → RUNNING  (queue worker picked the job up)
 *   RUNNING → SUCCESS  (engine reported success)
 *   RUNNING → FAILURE  (engine reported failure)
 *   PENDING → REVOKED  (explicit cancel accepted by the queue)
 *
 * SUCCESS, FAILURE and REVOKED are terminal.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE,
    REVOKED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == REVOKED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == REVOKED;
            case RUNNING -> next == SUCCESS || next == FAILURE;
            case SUCCESS, FAILURE, REVOKED -> false;
        };
    }
}
