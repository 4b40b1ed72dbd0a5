package com.market.intel.pipeline.service;

import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.model.RunStatus;
import com.market.intel.pipeline.model.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineCliRunnerTest {
    @Mock
    private PipelineOrchestratorService orchestratorService;

    @Mock
    private ConfigurableApplicationContext applicationContext;

    private PipelineProperties properties;
    private PipelineCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        runner = new PipelineCliRunner(properties, orchestratorService, applicationContext);
    }

    @Test
    void exitCodesFollowRunStatus() {
        assertEquals(0, PipelineCliRunner.exitCode(RunStatus.COMPLETED));
        assertEquals(0, PipelineCliRunner.exitCode(RunStatus.COMPLETED_WITH_ERRORS));
        assertEquals(1, PipelineCliRunner.exitCode(RunStatus.FAILED));
        assertEquals(2, PipelineCliRunner.exitCode(RunStatus.CANCELLED));
    }

    @Test
    void runCommandUsesConfiguredPaths() {
        properties.getCli().setCommand("RUN");
        properties.getCli().setSources("in/sources.csv");
        properties.getCli().setOutput("out");
        when(orchestratorService.run(Paths.get("in/sources.csv"), Paths.get("out")))
            .thenReturn(summary(PipelineOrchestratorService.COMMAND_RUN, RunStatus.CANCELLED));

        assertEquals(PipelineCliRunner.EXIT_CANCELLED, runner.execute(properties.getCli()));
    }

    @Test
    void analyzeDefaultsToCleanedDocumentsInOutputDirectory() {
        properties.getCli().setCommand("analyze");
        properties.getCli().setOutput("out");
        when(orchestratorService.analyze(any(Path.class), any(Path.class)))
            .thenReturn(summary(PipelineOrchestratorService.COMMAND_ANALYZE, RunStatus.COMPLETED));

        assertEquals(PipelineCliRunner.EXIT_OK, runner.execute(properties.getCli()));
        verify(orchestratorService).analyze(Paths.get("out", "cleaned-documents.json"), Paths.get("out"));
    }

    @Test
    void unknownCommandFails() {
        properties.getCli().setCommand("crawl");

        assertEquals(PipelineCliRunner.EXIT_FAILED, runner.execute(properties.getCli()));
        verifyNoInteractions(orchestratorService);
    }

    @Test
    void noCommandLeavesApplicationRunning() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(orchestratorService, applicationContext);
    }

    private static RunSummary summary(String command, RunStatus status) {
        Instant now = Instant.parse("2024-03-01T10:00:00Z");
        return new RunSummary("run-1", command, status, now, now, 1, 1, 1, 1, 0, 0, 0, 1, 0, "out", null);
    }
}
