package com.playpilot.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.playpilot.orchestrator.template.TemplateDraft;

/** Request body for POST /templates and PUT /templates/{id}. */
public record TemplateRequest(String name, String description, String body, JsonNode variablesSchema) {

    public TemplateDraft toDraft() {
        return new TemplateDraft(name, description, body, variablesSchema);
    }
}
