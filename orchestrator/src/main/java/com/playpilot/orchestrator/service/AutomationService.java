package com.playpilot.orchestrator.service;

import com.playpilot.orchestrator.generator.GenerationRequest;
import com.playpilot.orchestrator.generator.GenerationResult;
import com.playpilot.orchestrator.generator.PlaybookGenerator;
import com.playpilot.orchestrator.model.Task;
import com.playpilot.orchestrator.scheduler.PlaybookScheduler;
import com.playpilot.orchestrator.scheduler.TaskDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Generate, then schedule only what passed the safety policy.
 *
 *   generator.generate → valid && !dryRun ? scheduler.submit : return as-is
 */
@Service
public class AutomationService {

    private static final Logger log = LoggerFactory.getLogger(AutomationService.class);

    /** @param task null when the result was invalid or this was a dry run */
    public record GenerationOutcome(GenerationResult result, Task task) {}

    private final PlaybookGenerator generator;
    private final PlaybookScheduler scheduler;

    public AutomationService(PlaybookGenerator generator, PlaybookScheduler scheduler) {
        this.generator = generator;
        this.scheduler = scheduler;
    }

    /**
     * @param inventory inventory the scheduled task runs against
     * @param runAt     null means as soon as possible
     * @param dryRun    generate and validate only
     */
    public GenerationOutcome generateAndSchedule(GenerationRequest request, String inventory,
                                                 Instant runAt, boolean dryRun) {
        GenerationResult result = generator.generate(request);
        if (!result.valid()) {
            log.info("Not scheduling rejected playbook: {}", result.errors());
            return new GenerationOutcome(result, null);
        }
        if (dryRun) {
            return new GenerationOutcome(result, null);
        }
        Task task = scheduler.submit(TaskDefinition.fromGeneration(result, inventory, runAt));
        return new GenerationOutcome(result, task);
    }
}
