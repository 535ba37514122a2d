package com.playpilot.orchestrator.execution;

public record ExecutionOutcome(boolean success, String output) {

    public static ExecutionOutcome failed(String output) {
        return new ExecutionOutcome(false, output);
    }
}
