package com.playpilot.orchestrator.template;

import com.playpilot.orchestrator.config.PlayPilotProperties;
import com.playpilot.orchestrator.config.TestProperties;
import com.playpilot.orchestrator.model.PlaybookTemplate;
import com.playpilot.orchestrator.repository.TemplateRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DefaultTemplateSeederTest {

    @Mock TemplateRepository templateRepo;

    @Test
    void seedsOnlyMissingNames() {
        when(templateRepo.existsByName("Web Server Setup")).thenReturn(true);
        when(templateRepo.existsByName("Database Server Setup")).thenReturn(false);

        new DefaultTemplateSeeder(templateRepo, TestProperties.defaults()).run();

        ArgumentCaptor<PlaybookTemplate> saved = ArgumentCaptor.forClass(PlaybookTemplate.class);
        verify(templateRepo).save(saved.capture());
        assertThat(saved.getValue().getName()).isEqualTo("Database Server Setup");
        assertThat(saved.getValue().getVariablesSchema()).contains("\"db_port\"");
    }

    @Test
    void disabled_touchesNothing() {
        PlayPilotProperties d = TestProperties.defaults();
        PlayPilotProperties off = new PlayPilotProperties(d.llm(), d.safety(), d.queue(), d.execution(),
                new PlayPilotProperties.Templates(false));

        new DefaultTemplateSeeder(templateRepo, off).run();

        verifyNoInteractions(templateRepo);
    }
}
