package com.playpilot.orchestrator.scheduler;

/**
 * Counts from one restart reconciliation pass.
 *
 * @param reenqueued PENDING tasks put back on the queue
 * @param overdue    PENDING tasks whose run time passed while the process was down; not run
 * @param running    tasks left RUNNING by a crash; left for manual reconciliation
 */
public record RecoveryReport(int reenqueued, int overdue, int running) {}
