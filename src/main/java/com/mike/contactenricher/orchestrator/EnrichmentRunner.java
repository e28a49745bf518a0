package com.mike.contactenricher.orchestrator;

import com.mike.contactenricher.config.EnricherProperties;
import com.mike.contactenricher.dto.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Starts one enrichment run when the application is up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "enricher.run", name = "auto-start", havingValue = "true", matchIfMissing = true)
public class EnrichmentRunner implements CommandLineRunner {

    private final EnrichmentOrchestrator orchestrator;
    private final EnricherProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        RunSummary summary;
        boolean interrupted;
        try (InterruptSignalHandler signals = InterruptSignalHandler.install(orchestrator)) {
            summary = orchestrator.run();
            interrupted = signals.wasInterrupted();
        }

        if (properties.getRun().isExitOnCompletion() || interrupted) {
            int code = summary.getOutcome().exitCode();
            log.info("EnrichmentRunner: run ended with {}, closing application (exit code {})",
                    summary.getOutcome(), code);
            System.exit(SpringApplication.exit(context, () -> code));
        }
    }
}
