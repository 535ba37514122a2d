package com.playpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One scheduled playbook run.
 *
 * A Task holds either a path to an authored playbook or the full text of a
 * generated one, plus the inventory it runs against and the time it should
 * run. Only the scheduler and the queue worker change it after creation, and
 * only through {@link #transitionTo}.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "playbook_path")
    private String playbookPath;

    @Column(name = "playbook_content", columnDefinition = "TEXT")
    private String playbookContent;

    @Column(nullable = false)
    private String inventory;

    @Column(name = "run_at", nullable = false)
    private Instant runAt;

    // true when the playbook came from the LLM generator
    @Column(nullable = false)
    private boolean generated;

    @Column(name = "safety_validated", nullable = false)
    private boolean safetyValidated;

    @Column(name = "safety_score")
    private Integer safetyScore;

    // GenerationMetadata, JSON-encoded. Null for authored playbooks.
    @Column(name = "generation_metadata", columnDefinition = "TEXT")
    private String generationMetadata;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.PENDING;

    // Identifier of the deferred job on the execution queue.
    @Column(name = "queue_job_id", unique = true)
    private String queueJobId;

    // Engine output captured when the run finishes.
    @Column(columnDefinition = "TEXT")
    private String output;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // Optimistic lock: two concurrent writers on one row cannot both commit.
    @Version
    private long version;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(String playbookPath, String playbookContent, String inventory, Instant runAt) {
        this.playbookPath    = playbookPath;
        this.playbookContent = playbookContent;
        this.inventory       = inventory;
        this.runAt           = runAt;
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    /**
     * Move to the next status, stamping start/finish times.
     *
     * @throws IllegalTaskTransitionException if the move is not one of the
     *         forward transitions listed on {@link TaskStatus}
     */
    public void transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalTaskTransitionException(id, status, next);
        }
        this.status = next;
        if (next == TaskStatus.RUNNING) {
            this.startedAt = Instant.now();
        } else if (next.isTerminal()) {
            this.finishedAt = Instant.now();
        }
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()                 { return id; }
    public String     getPlaybookPath()       { return playbookPath; }
    public String     getPlaybookContent()    { return playbookContent; }
    public String     getInventory()          { return inventory; }
    public Instant    getRunAt()              { return runAt; }
    public boolean    isGenerated()           { return generated; }
    public boolean    isSafetyValidated()     { return safetyValidated; }
    public Integer    getSafetyScore()        { return safetyScore; }
    public String     getGenerationMetadata() { return generationMetadata; }
    public TaskStatus getStatus()             { return status; }
    public String     getQueueJobId()         { return queueJobId; }
    public String     getOutput()             { return output; }
    public Instant    getCreatedAt()          { return createdAt; }
    public Instant    getUpdatedAt()          { return updatedAt; }
    public Instant    getStartedAt()          { return startedAt; }
    public Instant    getFinishedAt()         { return finishedAt; }

    public void setGenerated(boolean generated)             { this.generated = generated; }
    public void setSafetyValidated(boolean safetyValidated) { this.safetyValidated = safetyValidated; }
    public void setSafetyScore(Integer safetyScore)         { this.safetyScore = safetyScore; }
    public void setGenerationMetadata(String json)          { this.generationMetadata = json; }
    public void setQueueJobId(String queueJobId)            { this.queueJobId = queueJobId; }
    public void setOutput(String output)                    { this.output = output; }
}
