package com.playpilot.orchestrator.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playpilot.orchestrator.model.PlaybookTemplate;
import com.playpilot.orchestrator.repository.TemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The template catalogue.
 *
 * Reads filter out soft-deleted templates unless the caller explicitly asks
 * for them; deleting only sets the flag, rows are never purged.
 */
@Service
public class TemplateService {

    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

    private final TemplateRepository templateRepository;
    private final TemplateRenderer   renderer;
    private final ObjectMapper       objectMapper;

    public TemplateService(TemplateRepository templateRepository,
                           TemplateRenderer renderer,
                           ObjectMapper objectMapper) {
        this.templateRepository = templateRepository;
        this.renderer           = renderer;
        this.objectMapper       = objectMapper;
    }

    /**
     * @throws IllegalArgumentException if name or body is blank, the schema is
     *         malformed, or an active template already has this name
     */
    @Transactional
    public PlaybookTemplate create(TemplateDraft draft) {
        String schema = checkDraft(draft);
        if (templateRepository.existsByNameAndDeletedFalse(draft.name().strip())) {
            throw new IllegalArgumentException("Template name already in use: " + draft.name().strip());
        }
        PlaybookTemplate template = templateRepository.save(new PlaybookTemplate(
                draft.name().strip(), draft.description(), draft.body(), schema));
        log.info("Created template '{}' ({})", template.getName(), template.getId());
        return template;
    }

    @Transactional
    public PlaybookTemplate update(UUID id, TemplateDraft draft) {
        PlaybookTemplate template = get(id);
        String schema = checkDraft(draft);
        String name = draft.name().strip();
        if (!name.equals(template.getName()) && templateRepository.existsByNameAndDeletedFalse(name)) {
            throw new IllegalArgumentException("Template name already in use: " + name);
        }
        template.setName(name);
        template.setDescription(draft.description());
        template.setBody(draft.body());
        template.setVariablesSchema(schema);
        log.info("Updated template '{}' ({})", template.getName(), id);
        return template;
    }

    @Transactional(readOnly = true)
    public PlaybookTemplate get(UUID id) {
        return templateRepository.findByIdAndDeletedFalse(id)
                .orElseThrow(() -> new TemplateNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<PlaybookTemplate> list(boolean includeDeleted) {
        return includeDeleted
                ? templateRepository.findAllByOrderByCreatedAtAsc()
                : templateRepository.findByDeletedFalseOrderByCreatedAtAsc();
    }

    @Transactional
    public void delete(UUID id) {
        PlaybookTemplate template = get(id);
        template.markDeleted();
        log.info("Soft-deleted template '{}' ({})", template.getName(), id);
    }

    @Transactional(readOnly = true)
    public RenderResult render(UUID id, Map<String, ?> variables) {
        return renderer.render(get(id), variables);
    }

    // Returns the schema as stored JSON text, null when absent.
    private String checkDraft(TemplateDraft draft) {
        if (draft.name() == null || draft.name().isBlank()) {
            throw new IllegalArgumentException("Template name is required");
        }
        if (draft.body() == null || draft.body().isBlank()) {
            throw new IllegalArgumentException("Template body is required");
        }
        if (draft.variablesSchema() == null || draft.variablesSchema().isNull()) {
            return null;
        }
        VariableSchema.fromNode(draft.variablesSchema(), objectMapper);
        try {
            return objectMapper.writeValueAsString(draft.variablesSchema());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid variables schema", e);
        }
    }
}
