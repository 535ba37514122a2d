package com.playpilot.orchestrator.api;

import com.playpilot.orchestrator.model.PlaybookTemplate;
import com.playpilot.orchestrator.template.RenderResult;
import com.playpilot.orchestrator.template.TemplateNotFoundException;
import com.playpilot.orchestrator.template.TemplateService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TemplateController.class)
class TemplateControllerTest {

    @Autowired MockMvc           mockMvc;
    @MockitoBean TemplateService templateService;

    private static final String SCHEMA =
            "{\"properties\":{\"hosts\":{\"type\":\"string\"}},\"required\":[\"hosts\"]}";

    @Test
    void list_activeByDefault() throws Exception {
        when(templateService.list(false)).thenReturn(List.of(
                new PlaybookTemplate("Web Server Setup", "web", "- hosts: {{ hosts }}", SCHEMA)));

        mockMvc.perform(get("/templates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Web Server Setup"))
                .andExpect(jsonPath("$[0].variablesSchema.required[0]").value("hosts"))
                .andExpect(jsonPath("$[0].deleted").value(false));
    }

    @Test
    void list_includeDeleted() throws Exception {
        when(templateService.list(true)).thenReturn(List.of());

        mockMvc.perform(get("/templates").param("includeDeleted", "true"))
                .andExpect(status().isOk());
        verify(templateService).list(true);
    }

    @Test
    void create_returns201() throws Exception {
        when(templateService.create(any())).thenReturn(new PlaybookTemplate("Users", null, "- hosts: all", null));

        mockMvc.perform(post("/templates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Users","body":"- hosts: all"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Users"));
    }

    @Test
    void create_invalid_returns400() throws Exception {
        when(templateService.create(any())).thenThrow(new IllegalArgumentException("Template body is required"));

        mockMvc.perform(post("/templates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Users\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void get_deleted_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(templateService.get(id)).thenThrow(new TemplateNotFoundException(id));

        mockMvc.perform(get("/templates/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void delete_returns204() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/templates/{id}", id))
                .andExpect(status().isNoContent());
        verify(templateService).delete(id);
    }

    @Test
    void render_ok() throws Exception {
        UUID id = UUID.randomUUID();
        when(templateService.render(eq(id), anyMap())).thenReturn(new RenderResult("- hosts: web", List.of()));

        mockMvc.perform(post("/templates/{id}/render", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"variables\":{\"hosts\":\"web\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.playbook").value("- hosts: web"));
    }

    @Test
    void render_validationErrors_returns422WithFullList() throws Exception {
        UUID id = UUID.randomUUID();
        when(templateService.render(eq(id), anyMap())).thenReturn(new RenderResult(null,
                List.of("Required field missing: hosts", "Unknown field: colour")));

        mockMvc.perform(post("/templates/{id}/render", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"variables\":{\"colour\":\"blue\"}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors.length()").value(2))
                .andExpect(jsonPath("$.errors[0]").value("Required field missing: hosts"));
    }
}
