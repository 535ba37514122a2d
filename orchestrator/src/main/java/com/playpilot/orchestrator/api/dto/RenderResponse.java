package com.playpilot.orchestrator.api.dto;

import java.util.List;

/** 200 with the playbook, or 422 with every validation error. */
public record RenderResponse(String playbook, List<String> errors) {}
