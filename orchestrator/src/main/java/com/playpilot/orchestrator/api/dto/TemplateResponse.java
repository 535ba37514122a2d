package com.playpilot.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playpilot.orchestrator.model.PlaybookTemplate;

import java.time.Instant;
import java.util.UUID;

public record TemplateResponse(
        UUID     id,
        String   name,
        String   description,
        String   body,
        JsonNode variablesSchema,
        boolean  deleted,
        Instant  createdAt,
        Instant  updatedAt
) {
    public static TemplateResponse from(PlaybookTemplate t, ObjectMapper objectMapper) {
        JsonNode schema;
        try {
            schema = t.getVariablesSchema() == null ? null : objectMapper.readTree(t.getVariablesSchema());
        } catch (Exception e) {
            // Stored schemas are validated on write; surface anything odd as text.
            schema = objectMapper.getNodeFactory().textNode(t.getVariablesSchema());
        }
        return new TemplateResponse(
                t.getId(),
                t.getName(),
                t.getDescription(),
                t.getBody(),
                schema,
                t.isDeleted(),
                t.getCreatedAt(),
                t.getUpdatedAt()
        );
    }
}
