package com.playpilot.orchestrator.repository;

import com.playpilot.orchestrator.model.PlaybookTemplate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the playbook_templates table.
 *
 * Methods without "Deleted" in their name see soft-deleted rows too; they
 * exist for audit tooling and the default-template seeder.
 */
public interface TemplateRepository extends JpaRepository<PlaybookTemplate, UUID> {

    Optional<PlaybookTemplate> findByIdAndDeletedFalse(UUID id);

    List<PlaybookTemplate> findByDeletedFalseOrderByCreatedAtAsc();

    List<PlaybookTemplate> findAllByOrderByCreatedAtAsc();

    boolean existsByName(String name);

    boolean existsByNameAndDeletedFalse(String name);
}
