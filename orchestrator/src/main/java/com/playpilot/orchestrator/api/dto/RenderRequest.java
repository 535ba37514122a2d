package com.playpilot.orchestrator.api.dto;

import java.util.Map;

/** Request body for POST /templates/{id}/render. */
public record RenderRequest(Map<String, Object> variables) {

    public RenderRequest {
        if (variables == null) variables = Map.of();
    }
}
