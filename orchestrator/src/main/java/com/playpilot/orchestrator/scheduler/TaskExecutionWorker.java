package com.playpilot.orchestrator.scheduler;

import com.playpilot.orchestrator.execution.ExecutionEngine;
import com.playpilot.orchestrator.execution.ExecutionOutcome;
import com.playpilot.orchestrator.execution.ExecutionRequest;
import com.playpilot.orchestrator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The queue callback: runs one job on a queue thread.
 *
 *   markRunning → engine.run → markFinished(SUCCESS | FAILURE)
 *
 * If the task can no longer start (removed, or already moved on) the job is
 * dropped. An engine that throws counts as a failed run.
 */
@Component
public class TaskExecutionWorker {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutionWorker.class);

    private final TaskStore       taskStore;
    private final ExecutionEngine engine;

    public TaskExecutionWorker(TaskStore taskStore, ExecutionEngine engine) {
        this.taskStore = taskStore;
        this.engine    = engine;
    }

    public void execute(JobSpec job) {
        MDC.put("taskId", job.taskId().toString());
        MDC.put("jobId", job.jobId());
        try {
            Optional<Task> claimed = taskStore.markRunning(job.taskId());
            if (claimed.isEmpty()) {
                log.info("Job {} dropped: task {} cannot start", job.jobId(), job.taskId());
                return;
            }
            Task task = claimed.get();

            ExecutionOutcome outcome;
            try {
                outcome = engine.run(new ExecutionRequest(
                        task.getId(), task.getPlaybookPath(), task.getPlaybookContent(), task.getInventory()));
            } catch (RuntimeException e) {
                log.error("Execution of task {} threw: {}", task.getId(), e.getMessage(), e);
                outcome = ExecutionOutcome.failed("Execution error: " + e.getMessage());
            }
            taskStore.markFinished(task.getId(), outcome.success(), outcome.output());
        } finally {
            MDC.remove("taskId");
            MDC.remove("jobId");
        }
    }
}
