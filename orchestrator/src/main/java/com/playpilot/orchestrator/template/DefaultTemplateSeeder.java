package com.playpilot.orchestrator.template;

import com.playpilot.orchestrator.config.PlayPilotProperties;
import com.playpilot.orchestrator.model.PlaybookTemplate;
import com.playpilot.orchestrator.repository.TemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts the default templates at startup when no template (active or
 * deleted) carries their name. An operator who deleted one keeps it deleted.
 */
@Component
public class DefaultTemplateSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultTemplateSeeder.class);

    private final TemplateRepository  templateRepository;
    private final PlayPilotProperties properties;

    public DefaultTemplateSeeder(TemplateRepository templateRepository, PlayPilotProperties properties) {
        this.templateRepository = templateRepository;
        this.properties         = properties;
    }

    @Override
    @Transactional
    public void run(String... args) {
        if (!properties.templates().seedDefaults()) {
            return;
        }
        int seeded = 0;
        for (DefaultTemplates.Definition d : DefaultTemplates.ALL) {
            if (templateRepository.existsByName(d.name())) {
                continue;
            }
            templateRepository.save(new PlaybookTemplate(d.name(), d.description(), d.body(), d.variablesSchema()));
            seeded++;
        }
        if (seeded > 0) {
            log.info("Seeded {} default template(s)", seeded);
        }
    }
}
