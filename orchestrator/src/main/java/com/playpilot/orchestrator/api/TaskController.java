package com.playpilot.orchestrator.api;

import com.playpilot.orchestrator.api.dto.SubmitTaskRequest;
import com.playpilot.orchestrator.api.dto.TaskResponse;
import com.playpilot.orchestrator.model.Task;
import com.playpilot.orchestrator.scheduler.PlaybookScheduler;
import com.playpilot.orchestrator.scheduler.TaskDefinition;
import com.playpilot.orchestrator.scheduler.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for task lifecycle.
 *
 * POST   /tasks                       schedule an authored playbook
 * GET    /tasks                       all tasks, by run time
 * GET    /tasks/{id}                  one task
 * DELETE /tasks/{id}                  revoke (best-effort) and delete
 * POST   /tasks/jobs/{jobId}/cancel   revoke a job that has not started; 409 if refused
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final PlaybookScheduler scheduler;

    public TaskController(PlaybookScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @PostMapping
    public ResponseEntity<TaskResponse> submit(@RequestBody SubmitTaskRequest req) {
        TaskDefinition definition;
        try {
            definition = new TaskDefinition(req.playbookPath(), req.playbookContent(), req.inventory(),
                    req.runAt(), false, false, null, null);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        Task task = scheduler.submit(definition);
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(task));
    }

    @GetMapping
    public List<TaskResponse> list() {
        return scheduler.list().stream()
                .map(TaskResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public TaskResponse get(@PathVariable UUID id) {
        try {
            return TaskResponse.from(scheduler.get(id));
        } catch (TaskNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable UUID id) {
        try {
            scheduler.remove(id);
        } catch (TaskNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * HTTP 200  the queue accepted the revocation; the task is REVOKED
     * HTTP 409  job unknown, already started, or already finished; task unchanged
     */
    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String jobId) {
        boolean cancelled = scheduler.cancel(jobId);
        return ResponseEntity.status(cancelled ? HttpStatus.OK : HttpStatus.CONFLICT)
                .body(Map.of("jobId", jobId, "cancelled", cancelled));
    }
}
