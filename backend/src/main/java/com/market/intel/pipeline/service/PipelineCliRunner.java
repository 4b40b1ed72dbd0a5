package com.market.intel.pipeline.service;

import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.model.RunStatus;
import com.market.intel.pipeline.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

@Component
public class PipelineCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineCliRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CANCELLED = 2;

    private final PipelineProperties properties;
    private final PipelineOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public PipelineCliRunner(
        PipelineProperties properties,
        PipelineOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        PipelineProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        Thread cancelHook = new Thread(orchestratorService::cancelActiveRun, "pipeline-cancel");
        Runtime.getRuntime().addShutdownHook(cancelHook);
        int exitCode;
        try {
            exitCode = execute(cli);
        } finally {
            removeHook(cancelHook);
        }

        if (cli.isExitAfterRun()) {
            int code = exitCode;
            int springExit = SpringApplication.exit(applicationContext, () -> code);
            System.exit(springExit);
        }
    }

    int execute(PipelineProperties.Cli cli) {
        String command = cli.getCommand().trim().toLowerCase(Locale.ROOT);
        Path output = Paths.get(cli.getOutput());
        RunSummary summary;
        switch (command) {
            case PipelineOrchestratorService.COMMAND_RUN -> summary = orchestratorService.run(Paths.get(cli.getSources()), output);
            case PipelineOrchestratorService.COMMAND_ANALYZE -> {
                String cleaned = cli.getCleaned();
                Path cleanedPath = cleaned == null || cleaned.isBlank()
                    ? output.resolve("cleaned-documents.json")
                    : Paths.get(cleaned);
                summary = orchestratorService.analyze(cleanedPath, output);
            }
            default -> {
                log.warn("Unknown pipeline command '{}', expected '{}' or '{}'",
                    cli.getCommand(), PipelineOrchestratorService.COMMAND_RUN, PipelineOrchestratorService.COMMAND_ANALYZE);
                return EXIT_FAILED;
            }
        }
        log.info(
            "Pipeline {} {} finished with status {}: sources={}, documents={}, profiles={}, failures={}",
            summary.command(),
            summary.runId(),
            summary.status(),
            summary.sourceCount(),
            summary.documentCount(),
            summary.profileCount(),
            summary.failureCount()
        );
        return exitCode(summary.status());
    }

    static int exitCode(RunStatus status) {
        return switch (status) {
            case COMPLETED, COMPLETED_WITH_ERRORS -> EXIT_OK;
            case CANCELLED -> EXIT_CANCELLED;
            case FAILED -> EXIT_FAILED;
        };
    }

    private void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, cancel hook stays registered");
        }
    }
}
