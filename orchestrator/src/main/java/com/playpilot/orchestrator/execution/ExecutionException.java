package com.playpilot.orchestrator.execution;

/**
 * Thrown when the execution engine cannot be launched (missing binary,
 * unwritable temp directory). The worker records it as a failed run.
 */
public class ExecutionException extends RuntimeException {

    public ExecutionException(String message) {
        super(message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
