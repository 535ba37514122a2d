package com.playpilot.orchestrator.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playpilot.orchestrator.model.IllegalTaskTransitionException;
import com.playpilot.orchestrator.model.Task;
import com.playpilot.orchestrator.model.TaskStatus;
import com.playpilot.orchestrator.repository.TaskRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Durable task state.
 *
 * Every public write is one transaction: load, apply, flush. The Task's
 * version column makes two concurrent writers on one row conflict instead of
 * interleaving; the loser gets an OptimisticLockingFailureException.
 *
 * Refused transitions (task gone, or the move is not legal from its current
 * status) are logged and reported as false, never thrown.
 */
@Service
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    private final TaskRepository taskRepo;
    private final ObjectMapper   objectMapper;
    private final MeterRegistry  meterRegistry;

    public TaskStore(TaskRepository taskRepo, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.taskRepo      = taskRepo;
        this.objectMapper  = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    @Transactional
    public Task create(TaskDefinition def, String jobId) {
        Task task = new Task(def.playbookPath(), def.playbookContent(), def.inventory(), def.runAt());
        task.setGenerated(def.generated());
        task.setSafetyValidated(def.safetyValidated());
        task.setSafetyScore(def.safetyScore());
        task.setGenerationMetadata(toJson(def.generationMetadata()));
        task.setQueueJobId(jobId);
        Task saved = taskRepo.saveAndFlush(task);
        countTransition(TaskStatus.PENDING);
        return saved;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** PENDING → RUNNING. Returns the task as it now stands, or empty if refused. */
    @Transactional
    public Optional<Task> markRunning(UUID taskId) {
        return transition(taskId, TaskStatus.RUNNING, t -> {});
    }

    /** RUNNING → SUCCESS or FAILURE, recording the engine output. */
    @Transactional
    public boolean markFinished(UUID taskId, boolean success, String output) {
        TaskStatus next = success ? TaskStatus.SUCCESS : TaskStatus.FAILURE;
        return transition(taskId, next, t -> t.setOutput(output)).isPresent();
    }

    /** PENDING → REVOKED. */
    @Transactional
    public boolean markRevoked(UUID taskId) {
        return transition(taskId, TaskStatus.REVOKED, t -> {}).isPresent();
    }

    private Optional<Task> transition(UUID taskId, TaskStatus next, Consumer<Task> apply) {
        Optional<Task> found = taskRepo.findById(taskId);
        if (found.isEmpty()) {
            log.warn("Task {} not found; cannot move to {}", taskId, next);
            return Optional.empty();
        }
        Task task = found.get();
        try {
            task.transitionTo(next);
        } catch (IllegalTaskTransitionException e) {
            log.warn(e.getMessage());
            return Optional.empty();
        }
        apply.accept(task);
        Task saved = taskRepo.saveAndFlush(task);
        countTransition(next);
        log.info("Task {} -> {}", taskId, next);
        return Optional.of(saved);
    }

    @Transactional
    public void reassignJob(UUID taskId, String jobId) {
        Task task = taskRepo.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        task.setQueueJobId(jobId);
        taskRepo.saveAndFlush(task);
    }

    @Transactional
    public void delete(UUID taskId) {
        taskRepo.deleteById(taskId);
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Task> findById(UUID taskId) {
        return taskRepo.findById(taskId);
    }

    @Transactional(readOnly = true)
    public Optional<Task> findByJobId(String jobId) {
        return taskRepo.findByQueueJobId(jobId);
    }

    @Transactional(readOnly = true)
    public List<Task> findByStatus(TaskStatus status) {
        return taskRepo.findByStatusOrderByRunAtAsc(status);
    }

    @Transactional(readOnly = true)
    public List<Task> findAll() {
        return taskRepo.findAllByOrderByRunAtAsc();
    }

    private void countTransition(TaskStatus status) {
        meterRegistry.counter("playpilot.tasks.transitions", "status", status.name()).increment();
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize generation metadata", e);
        }
    }
}
