package com.playpilot.orchestrator.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.playpilot.orchestrator.api.dto.RenderRequest;
import com.playpilot.orchestrator.api.dto.RenderResponse;
import com.playpilot.orchestrator.api.dto.TemplateRequest;
import com.playpilot.orchestrator.api.dto.TemplateResponse;
import com.playpilot.orchestrator.model.PlaybookTemplate;
import com.playpilot.orchestrator.template.RenderResult;
import com.playpilot.orchestrator.template.TemplateNotFoundException;
import com.playpilot.orchestrator.template.TemplateService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * REST API for the template catalogue.
 *
 * GET    /templates[?includeDeleted=true]
 * POST   /templates
 * GET    /templates/{id}
 * PUT    /templates/{id}
 * DELETE /templates/{id}           soft delete
 * POST   /templates/{id}/render    422 with the full error list on bad variables
 */
@RestController
@RequestMapping("/templates")
public class TemplateController {

    private final TemplateService templateService;
    private final ObjectMapper    objectMapper;

    public TemplateController(TemplateService templateService, ObjectMapper objectMapper) {
        this.templateService = templateService;
        this.objectMapper    = objectMapper;
    }

    @GetMapping
    public List<TemplateResponse> list(@RequestParam(defaultValue = "false") boolean includeDeleted) {
        return templateService.list(includeDeleted).stream()
                .map(t -> TemplateResponse.from(t, objectMapper))
                .toList();
    }

    @PostMapping
    public ResponseEntity<TemplateResponse> create(@RequestBody TemplateRequest req) {
        PlaybookTemplate created = call(() -> templateService.create(req.toDraft()));
        return ResponseEntity.status(HttpStatus.CREATED).body(TemplateResponse.from(created, objectMapper));
    }

    @GetMapping("/{id}")
    public TemplateResponse get(@PathVariable UUID id) {
        return TemplateResponse.from(call(() -> templateService.get(id)), objectMapper);
    }

    @PutMapping("/{id}")
    public TemplateResponse update(@PathVariable UUID id, @RequestBody TemplateRequest req) {
        return TemplateResponse.from(call(() -> templateService.update(id, req.toDraft())), objectMapper);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        call(() -> {
            templateService.delete(id);
            return null;
        });
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/render")
    public ResponseEntity<RenderResponse> render(@PathVariable UUID id, @RequestBody(required = false) RenderRequest req) {
        RenderRequest body = req == null ? new RenderRequest(null) : req;
        RenderResult result = call(() -> templateService.render(id, body.variables()));
        RenderResponse response = new RenderResponse(result.playbook(), result.errors());
        return result.valid()
                ? ResponseEntity.ok(response)
                : ResponseEntity.unprocessableEntity().body(response);
    }

    // Not-found → 404, bad input → 400.
    private static <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (TemplateNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }
}
