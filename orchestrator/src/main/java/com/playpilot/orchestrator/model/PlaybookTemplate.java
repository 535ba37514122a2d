package com.playpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A parameterised playbook body plus the schema of variables it accepts.
 *
 * Templates are never purged: delete sets {@code deleted = true} so the
 * audit trail survives. Read paths filter on the flag unless they ask for
 * deleted rows explicitly.
 *
 * DB table: playbook_templates  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "playbook_templates")
public class PlaybookTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String body;

    // {"properties": {...}, "required": [...]}, JSON-encoded.
    @Column(name = "variables_schema", columnDefinition = "TEXT")
    private String variablesSchema;

    @Column(nullable = false)
    private boolean deleted = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected PlaybookTemplate() {}   // required by JPA

    public PlaybookTemplate(String name, String description, String body, String variablesSchema) {
        this.name            = name;
        this.description     = description;
        this.body            = body;
        this.variablesSchema = variablesSchema;
    }

    public UUID    getId()              { return id; }
    public String  getName()            { return name; }
    public String  getDescription()     { return description; }
    public String  getBody()            { return body; }
    public String  getVariablesSchema() { return variablesSchema; }
    public boolean isDeleted()          { return deleted; }
    public Instant getCreatedAt()       { return createdAt; }
    public Instant getUpdatedAt()       { return updatedAt; }

    public void setName(String name)                       { this.name = name; }
    public void setDescription(String description)         { this.description = description; }
    public void setBody(String body)                       { this.body = body; }
    public void setVariablesSchema(String variablesSchema) { this.variablesSchema = variablesSchema; }
    public void markDeleted()                              { this.deleted = true; }
}
