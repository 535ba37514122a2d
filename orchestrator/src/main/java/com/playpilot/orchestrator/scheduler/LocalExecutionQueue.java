package com.playpilot.orchestrator.scheduler;

import com.playpilot.orchestrator.config.PlayPilotProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process delayed-job queue on a {@link ScheduledThreadPoolExecutor}.
 *
 * Holds nothing across restarts: after a restart every job id is unknown,
 * which is what the scheduler's recovery pass looks for.
 *
 * Each job moves WAITING → STARTED or WAITING → REVOKED exactly once
 * (compare-and-set), so a revoke that returns true guarantees the worker
 * never runs, and a job that has started can no longer be revoked.
 */
@Component
public class LocalExecutionQueue implements ExecutionQueue {

    private static final Logger log = LoggerFactory.getLogger(LocalExecutionQueue.class);

    private enum JobState { WAITING, STARTED, REVOKED }

    private static final class QueuedJob {
        final JobSpec                   spec;
        final AtomicReference<JobState> state = new AtomicReference<>(JobState.WAITING);
        volatile ScheduledFuture<?>     future;

        QueuedJob(JobSpec spec) {
            this.spec = spec;
        }
    }

    private final TaskExecutionWorker            worker;
    private final ScheduledThreadPoolExecutor    executor;
    private final ConcurrentHashMap<String, QueuedJob> jobs = new ConcurrentHashMap<>();

    public LocalExecutionQueue(TaskExecutionWorker worker, PlayPilotProperties properties) {
        this.worker = worker;

        AtomicInteger counter = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(properties.queue().workerThreads(), r -> {
            Thread t = new Thread(r, "playpilot-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public String enqueue(JobSpec spec, Instant runAt) {
        QueuedJob job = new QueuedJob(spec);
        if (jobs.putIfAbsent(spec.jobId(), job) != null) {
            throw new IllegalArgumentException("Job already queued: " + spec.jobId());
        }
        long delayMs = Math.max(0, Duration.between(Instant.now(), runAt).toMillis());
        try {
            job.future = executor.schedule(() -> runJob(job), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            jobs.remove(spec.jobId());
            throw e;
        }
        log.info("Queued job {} for task {} (in {} ms)", spec.jobId(), spec.taskId(), delayMs);
        return spec.jobId();
    }

    @Override
    public boolean revoke(String jobId) {
        QueuedJob job = jobs.get(jobId);
        if (job == null || !job.state.compareAndSet(JobState.WAITING, JobState.REVOKED)) {
            return false;
        }
        ScheduledFuture<?> future = job.future;
        if (future != null) {
            future.cancel(false);
        }
        jobs.remove(jobId);
        log.info("Revoked job {}", jobId);
        return true;
    }

    @Override
    public boolean isKnown(String jobId) {
        return jobId != null && jobs.containsKey(jobId);
    }

    private void runJob(QueuedJob job) {
        if (!job.state.compareAndSet(JobState.WAITING, JobState.STARTED)) {
            return;
        }
        try {
            worker.execute(job.spec);
        } catch (RuntimeException e) {
            log.error("Worker failed on job {}: {}", job.spec.jobId(), e.getMessage(), e);
        } finally {
            jobs.remove(job.spec.jobId());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
