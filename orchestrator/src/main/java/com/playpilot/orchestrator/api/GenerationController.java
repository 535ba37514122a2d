package com.playpilot.orchestrator.api;

import com.playpilot.orchestrator.api.dto.GeneratePlaybookRequest;
import com.playpilot.orchestrator.api.dto.GeneratePlaybookResponse;
import com.playpilot.orchestrator.generator.GenerationRequest;
import com.playpilot.orchestrator.service.AutomationService;
import com.playpilot.orchestrator.service.AutomationService.GenerationOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * POST /playbooks/generate  generate and validate a playbook; optionally
 *                            schedule it when it is accepted
 *
 * A rejected playbook is still a 200: validity is part of the body.
 */
@RestController
@RequestMapping("/playbooks")
public class GenerationController {

    private final AutomationService automationService;

    public GenerationController(AutomationService automationService) {
        this.automationService = automationService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/playbooks/generate \
     *     -H "Content-Type: application/json" \
     *     -d '{"description":"install nginx","targetHosts":"web","safetyLevel":"medium"}'
     */
    @PostMapping("/generate")
    public GeneratePlaybookResponse generate(@RequestBody GeneratePlaybookRequest req) {
        GenerationRequest request;
        try {
            request = req.toGenerationRequest();
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        String inventory = req.inventory() == null || req.inventory().isBlank()
                ? request.targetHosts()
                : req.inventory();

        GenerationOutcome outcome = automationService.generateAndSchedule(
                request, inventory, req.runAt(), !req.schedule());
        return GeneratePlaybookResponse.from(outcome.result(), outcome.task());
    }
}
