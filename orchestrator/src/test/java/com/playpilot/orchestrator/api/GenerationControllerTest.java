package com.playpilot.orchestrator.api;

import com.playpilot.orchestrator.generator.GenerationMetadata;
import com.playpilot.orchestrator.generator.GenerationRequest;
import com.playpilot.orchestrator.generator.GenerationResult;
import com.playpilot.orchestrator.model.SafetyLevel;
import com.playpilot.orchestrator.model.Task;
import com.playpilot.orchestrator.service.AutomationService;
import com.playpilot.orchestrator.service.AutomationService.GenerationOutcome;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(GenerationController.class)
class GenerationControllerTest {

    @Autowired MockMvc           mockMvc;
    @MockitoBean AutomationService automationService;

    private static final GenerationMetadata META =
            new GenerationMetadata("openai", "gpt-4", SafetyLevel.MEDIUM, Instant.now(), null);

    @Test
    void generate_dryRunByDefault_returnsResult() throws Exception {
        GenerationResult result = new GenerationResult("- hosts: web", true, List.of(),
                List.of("Play 0 uses become - ensure this is necessary"), 95, true, META);
        when(automationService.generateAndSchedule(any(), eq("web"), isNull(), eq(true)))
                .thenReturn(new GenerationOutcome(result, null));

        mockMvc.perform(post("/playbooks/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"description":"install nginx","targetHosts":"web","safetyLevel":"MEDIUM"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.safetyScore").value(95))
                .andExpect(jsonPath("$.requiresApproval").value(true))
                .andExpect(jsonPath("$.metadata.safetyLevel").value("medium"))
                .andExpect(jsonPath("$.task").doesNotExist());

        ArgumentCaptor<GenerationRequest> req = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(automationService).generateAndSchedule(req.capture(), any(), any(), anyBoolean());
        assertThat(req.getValue().safetyLevel()).isEqualTo(SafetyLevel.MEDIUM);
    }

    @Test
    void generate_schedule_returnsTask() throws Exception {
        GenerationResult result = new GenerationResult("- hosts: web", true, List.of(), List.of(), 100, false, META);
        Task task = new Task(null, "- hosts: web", "prod.ini", Instant.now());
        task.setQueueJobId("job-1");
        when(automationService.generateAndSchedule(any(), eq("prod.ini"), any(), eq(false)))
                .thenReturn(new GenerationOutcome(result, task));

        mockMvc.perform(post("/playbooks/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"description":"install nginx","schedule":true,"inventory":"prod.ini"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task.jobId").value("job-1"))
                .andExpect(jsonPath("$.task.status").value("PENDING"));
    }

    @Test
    void generate_missingDescription_returns400() throws Exception {
        mockMvc.perform(post("/playbooks/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetHosts\":\"web\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(automationService);
    }

    @Test
    void generate_unknownSafetyLevel_returns400() throws Exception {
        mockMvc.perform(post("/playbooks/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"x\",\"safetyLevel\":\"paranoid\"}"))
                .andExpect(status().isBadRequest());
    }
}
