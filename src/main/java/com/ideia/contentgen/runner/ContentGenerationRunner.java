package com.ideia.contentgen.runner;

import com.ideia.contentgen.dto.GenerationDtos;
import com.ideia.contentgen.service.GenerationRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Starts the generation run once the context is up. Any exception escapes to Spring Boot, which
 * logs it and makes the process exit non-zero.
 */
@Component
public class ContentGenerationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ContentGenerationRunner.class);
    private final GenerationRunService runService;

    public ContentGenerationRunner(GenerationRunService runService) {
        this.runService = runService;
    }

    @Override
    public void run(String... args) {
        GenerationDtos.RunReport report = runService.run();
        log.info("Content generation completed: {} new items, {} categories{}.",
                report.getGenerated_total(), report.getCategories(), report.isDryRun() ? " (dry-run)" : "");
    }
}
