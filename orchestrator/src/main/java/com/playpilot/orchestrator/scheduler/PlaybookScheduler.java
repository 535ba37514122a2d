package com.playpilot.orchestrator.scheduler;

import com.playpilot.orchestrator.model.Task;
import com.playpilot.orchestrator.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Front door for task lifecycle: submit, cancel, remove, read, recover.
 *
 * Not transactional itself. Each TaskStore call commits on its own, so a
 * write that loses an optimistic-lock race surfaces here as an exception we
 * can turn into a plain false.
 */
@Service
public class PlaybookScheduler {

    private static final Logger log = LoggerFactory.getLogger(PlaybookScheduler.class);

    private final TaskStore      taskStore;
    private final ExecutionQueue queue;

    public PlaybookScheduler(TaskStore taskStore, ExecutionQueue queue) {
        this.taskStore = taskStore;
        this.queue     = queue;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Persist the task as PENDING, then queue it for its run time.
     *
     * The job id is chosen before the row is written so the row never
     * exists without it. If the queue refuses the job the row is removed
     * and the error is rethrown.
     *
     * @return the persisted task; {@link Task#getQueueJobId()} is the handle for {@link #cancel}
     */
    public Task submit(TaskDefinition definition) {
        String jobId = UUID.randomUUID().toString();
        Task task = taskStore.create(definition, jobId);
        try {
            queue.enqueue(new JobSpec(jobId, task.getId()), task.getRunAt());
        } catch (RuntimeException e) {
            log.error("Could not queue task {}: {}", task.getId(), e.getMessage());
            taskStore.delete(task.getId());
            throw e;
        }
        log.info("Submitted task {} (job={}, runAt={}, generated={})",
                task.getId(), jobId, task.getRunAt(), task.isGenerated());
        return task;
    }

    // ------------------------------------------------------------------
    // Cancellation / removal
    // ------------------------------------------------------------------

    /**
     * Revoke a job that has not started yet.
     *
     * @return false if the job is unknown, its task is no longer PENDING, or
     *         the queue refused the revocation; the task is unchanged then
     */
    public boolean cancel(String jobId) {
        Optional<Task> found = taskStore.findByJobId(jobId);
        if (found.isEmpty()) {
            log.info("Cancel refused: no task for job {}", jobId);
            return false;
        }
        Task task = found.get();
        if (task.getStatus() != TaskStatus.PENDING) {
            log.info("Cancel refused: task {} is {}", task.getId(), task.getStatus());
            return false;
        }
        if (!queue.revoke(jobId)) {
            log.info("Cancel refused: queue did not revoke job {}", jobId);
            return false;
        }
        try {
            return taskStore.markRevoked(task.getId());
        } catch (OptimisticLockingFailureException e) {
            log.warn("Cancel of task {} lost a concurrent update", task.getId());
            return false;
        }
    }

    /**
     * Delete a task, first trying to revoke its queue job.
     *
     * @return whether the queue accepted the revocation
     * @throws TaskNotFoundException if there is no such task
     */
    public boolean remove(UUID taskId) {
        Task task = taskStore.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        boolean revoked = task.getQueueJobId() != null && queue.revoke(task.getQueueJobId());
        taskStore.delete(taskId);
        log.info("Removed task {} (job revoked={})", taskId, revoked);
        return revoked;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Task get(UUID taskId) {
        return taskStore.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public List<Task> list() {
        return taskStore.findAll();
    }

    // ------------------------------------------------------------------
    // Restart reconciliation
    // ------------------------------------------------------------------

    /**
     * Compare persisted PENDING tasks against the queue's live jobs.
     *
     * PENDING with a future run time and no live job: queued again under the
     * same job id. PENDING whose run time passed while we were down: logged,
     * not run. RUNNING: logged for manual reconciliation; re-running could
     * execute a playbook twice.
     *
     * Safe to call more than once.
     */
    public RecoveryReport recoverOnRestart() {
        Instant now = Instant.now();
        int reenqueued = 0;
        int overdue    = 0;

        for (Task task : taskStore.findByStatus(TaskStatus.PENDING)) {
            if (queue.isKnown(task.getQueueJobId())) {
                continue;
            }
            if (!task.getRunAt().isAfter(now)) {
                overdue++;
                log.warn("Task {} was due at {} while the queue was down; not re-running it",
                        task.getId(), task.getRunAt());
                continue;
            }
            String jobId = task.getQueueJobId();
            if (jobId == null) {
                jobId = UUID.randomUUID().toString();
                taskStore.reassignJob(task.getId(), jobId);
            }
            queue.enqueue(new JobSpec(jobId, task.getId()), task.getRunAt());
            reenqueued++;
        }

        List<Task> running = taskStore.findByStatus(TaskStatus.RUNNING);
        for (Task task : running) {
            log.warn("Task {} was RUNNING at shutdown; needs manual reconciliation", task.getId());
        }

        RecoveryReport report = new RecoveryReport(reenqueued, overdue, running.size());
        log.info("Recovery: {} re-queued, {} overdue, {} left RUNNING",
                report.reenqueued(), report.overdue(), report.running());
        return report;
    }
}
