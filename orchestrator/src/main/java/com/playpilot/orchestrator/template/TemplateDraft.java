package com.playpilot.orchestrator.template;

import com.fasterxml.jackson.databind.JsonNode;

/** Operator input for creating or replacing a template. */
public record TemplateDraft(String name, String description, String body, JsonNode variablesSchema) {}
