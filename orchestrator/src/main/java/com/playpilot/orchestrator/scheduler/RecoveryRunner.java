package com.playpilot.orchestrator.scheduler;

import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/** Runs the reconciliation pass once the context is up. */
@Component
public class RecoveryRunner implements CommandLineRunner {

    private final PlaybookScheduler playbookScheduler;

    public RecoveryRunner(PlaybookScheduler playbookScheduler) {
        this.playbookScheduler = playbookScheduler;
    }

    @Override
    public void run(String... args) {
        playbookScheduler.recoverOnRestart();
    }
}
