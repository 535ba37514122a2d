package com.playpilot.orchestrator.model;

import java.util.UUID;

/**
 * Thrown when a status change would move a Task backwards or out of a
 * terminal state. Callers in the scheduler report it as a refused
 * operation rather than letting it escape.
 */
public class IllegalTaskTransitionException extends RuntimeException {

    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTaskTransitionException(UUID taskId, TaskStatus from, TaskStatus to) {
        super("Task %s cannot move from %s to %s".formatted(taskId, from, to));
        this.from = from;
        this.to   = to;
    }

    public TaskStatus from() { return from; }
    public TaskStatus to()   { return to; }
}
