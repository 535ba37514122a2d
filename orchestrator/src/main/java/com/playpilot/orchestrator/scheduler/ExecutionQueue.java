package com.playpilot.orchestrator.scheduler;

import java.time.Instant;

/**
 * Deferred-job system that later hands each task to a worker.
 *
 * Implementations may run any number of jobs in parallel. Revocation is
 * best-effort: it reports whether the queue accepted the request, which is
 * only possible before the job has started.
 */
public interface ExecutionQueue {

    /** Schedule {@code job} to start at {@code runAt} (immediately if past). Returns the job id. */
    String enqueue(JobSpec job, Instant runAt);

    /** True if the job had not started and will now never start. */
    boolean revoke(String jobId);

    /** True while the job is waiting or running on this queue. */
    boolean isKnown(String jobId);
}
