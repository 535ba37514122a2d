package com.playpilot.orchestrator.execution;

/**
 * Runs one playbook against one inventory and reports how it went.
 *
 * Called by queue workers only; nothing in the request path runs playbooks.
 */
public interface ExecutionEngine {

    /**
     * @throws ExecutionException if the engine could not be started at all;
     *         a playbook that ran and failed is a failed outcome, not an exception
     */
    ExecutionOutcome run(ExecutionRequest request);
}
