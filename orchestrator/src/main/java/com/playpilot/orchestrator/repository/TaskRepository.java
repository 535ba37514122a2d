package com.playpilot.orchestrator.repository;

import com.playpilot.orchestrator.model.Task;
import com.playpilot.orchestrator.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the tasks table.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    Optional<Task> findByQueueJobId(String queueJobId);

    /** Used by the restart reconciliation pass. */
    List<Task> findByStatusOrderByRunAtAsc(TaskStatus status);

    List<Task> findAllByOrderByRunAtAsc();
}
