package com.market.intel.pipeline.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.market.intel.config.PipelineConfig;
import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.aggregate.ProfileAggregator;
import com.market.intel.pipeline.analysis.AnalysisEngine;
import com.market.intel.pipeline.analysis.CooccurrenceCounter;
import com.market.intel.pipeline.analysis.CorpusSynthesizer;
import com.market.intel.pipeline.analysis.ExtractiveSummarizer;
import com.market.intel.pipeline.analysis.FallbackSummarizer;
import com.market.intel.pipeline.analysis.GenerativeSummarizer;
import com.market.intel.pipeline.analysis.KeywordClusterer;
import com.market.intel.pipeline.analysis.TextPreprocessor;
import com.market.intel.pipeline.analysis.TfIdfCalculator;
import com.market.intel.pipeline.analysis.ThemeClassifier;
import com.market.intel.pipeline.extract.SectionExtractor;
import com.market.intel.pipeline.fetch.BrowserContentFetcher;
import com.market.intel.pipeline.fetch.SectionLinkFinder;
import com.market.intel.pipeline.fetch.SourceFetcher;
import com.market.intel.pipeline.fetch.StaticContentFetcher;
import com.market.intel.pipeline.fetch.WebDriverFactory;
import com.market.intel.pipeline.http.PoliteHttpClient;
import com.market.intel.pipeline.io.CorpusReader;
import com.market.intel.pipeline.io.RecordWriter;
import com.market.intel.pipeline.io.SourceListReader;
import com.market.intel.pipeline.model.RunStatus;
import com.market.intel.pipeline.model.RunSummary;
import com.market.intel.pipeline.normalize.DocumentNormalizer;
import com.market.intel.pipeline.normalize.LanguageDetector;
import com.market.intel.pipeline.normalize.TextCleaner;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PipelineOrchestratorServiceTest {
    private MockWebServer acmeServer;
    private MockWebServer missingServer;
    private MockWebServer studioServer;
    private ExecutorService crawlExecutor;
    private ExecutorService httpExecutor;
    private ExecutorService analysisExecutor;
    private ObjectMapper objectMapper;
    private PipelineOrchestratorService service;

    @TempDir
    Path workDir;

    @BeforeEach
    void setUp() throws Exception {
        acmeServer = server(page("Acme Cloud",
            "Acme builds cloud platforms and API tooling for retailers across Europe. "
                + "Our engineers run deployment automation, hosting and monitoring for online shops. "
                + "Contact us at hello@acme.example to plan your migration to the cloud."));
        missingServer = new MockWebServer();
        missingServer.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse().setResponseCode(404).setBody("missing");
            }
        });
        missingServer.start();
        studioServer = server(page("Pixel Studio",
            "Pixel Studio is a creative design agency crafting logos, visual identity and illustration. "
                + "We prototype interfaces with mockups and photo shoots for ambitious brands. "
                + "Write to studio@pixel.example to start a project with our designers."));

        objectMapper = new PipelineConfig().objectMapper();
        PipelineProperties properties = new PipelineProperties();
        properties.getFetch().setGlobalConcurrency(2);
        properties.getFetch().setPerHostDelayMs(1);
        properties.getFetch().setRequestTimeoutSeconds(5);
        properties.getFetch().setRequestMaxRetries(0);
        properties.getFetch().setRequestRetryBaseDelayMs(1);
        properties.getFetch().setRequestRetryMaxDelayMs(5);
        properties.getBrowser().setEnabled(false);

        crawlExecutor = Executors.newFixedThreadPool(2);
        httpExecutor = Executors.newFixedThreadPool(2);
        analysisExecutor = Executors.newFixedThreadPool(2);

        SourceFetcher sourceFetcher = new SourceFetcher(
            properties,
            new StaticContentFetcher(new PoliteHttpClient(properties, httpExecutor)),
            new BrowserContentFetcher(properties, new WebDriverFactory(properties)),
            new SectionLinkFinder()
        );
        TextPreprocessor preprocessor = new TextPreprocessor();
        AnalysisEngine analysisEngine = new AnalysisEngine(
            properties,
            preprocessor,
            new FallbackSummarizer(
                new GenerativeSummarizer(properties, HttpClient.newHttpClient(), objectMapper),
                new ExtractiveSummarizer(preprocessor)
            ),
            new TfIdfCalculator(),
            new ThemeClassifier(),
            new KeywordClusterer(),
            new CooccurrenceCounter(),
            new CorpusSynthesizer(),
            analysisExecutor
        );
        service = new PipelineOrchestratorService(
            properties,
            new SourceListReader(),
            new CorpusReader(objectMapper),
            new RecordWriter(objectMapper),
            sourceFetcher,
            new SectionExtractor(properties),
            new DocumentNormalizer(properties, new TextCleaner(), new LanguageDetector(properties)),
            analysisEngine,
            new ProfileAggregator(properties),
            objectMapper,
            crawlExecutor
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        for (MockWebServer server : List.of(acmeServer, missingServer, studioServer)) {
            server.shutdown();
        }
        crawlExecutor.shutdownNow();
        httpExecutor.shutdownNow();
        analysisExecutor.shutdownNow();
    }

    @Test
    void failingSourceDoesNotStopTheOthers() throws Exception {
        Path sources = sources(
            acmeServer.url("/").toString() + ",Acme,static,company",
            missingServer.url("/").toString() + ",Missing,static,company",
            studioServer.url("/").toString() + ",Pixel Studio,static,freelance"
        );
        Path output = workDir.resolve("out");

        RunSummary summary = service.run(sources, output);

        assertEquals(RunStatus.COMPLETED_WITH_ERRORS, summary.status());
        assertEquals(PipelineOrchestratorService.COMMAND_RUN, summary.command());
        assertEquals(3, summary.sourceCount());
        assertEquals(2, summary.liveSourceCount());
        assertEquals(2, summary.documentCount());
        assertEquals(2, summary.profileCount());
        assertEquals(1, summary.failureCount());
        assertEquals(PipelineCliRunner.EXIT_OK, PipelineCliRunner.exitCode(summary.status()));

        for (String file : List.of(
            RecordWriter.RAW_CAPTURES,
            RecordWriter.CLEANED_DOCUMENTS,
            RecordWriter.ANALYSIS_RESULTS,
            RecordWriter.CORPUS_SYNTHESIS,
            RecordWriter.PROFILES,
            RecordWriter.RUN_SUMMARY
        )) {
            assertThat(output.resolve(file)).exists();
        }
        List<String> failures = Files.readAllLines(output.resolve(RecordWriter.FAILURES));
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0)).contains("FETCH_FAILED").contains("HTTP_404");
        assertThat(Files.readString(output.resolve(RecordWriter.PROFILES)))
            .contains("hello@acme.example")
            .contains("studio@pixel.example");
    }

    @Test
    void analyzeCommandReusesCleanedDocuments() throws Exception {
        Path sources = sources(
            acmeServer.url("/").toString() + ",Acme,static,company",
            studioServer.url("/").toString() + ",Pixel Studio,static,freelance"
        );
        Path first = workDir.resolve("first");
        service.run(sources, first);
        int requestsAfterRun = acmeServer.getRequestCount() + studioServer.getRequestCount();

        RunSummary summary = service.analyze(first.resolve(RecordWriter.CLEANED_DOCUMENTS), workDir.resolve("second"));

        assertEquals(RunStatus.COMPLETED, summary.status());
        assertEquals(PipelineOrchestratorService.COMMAND_ANALYZE, summary.command());
        assertEquals(2, summary.documentCount());
        assertEquals(2, summary.profileCount());
        assertEquals(requestsAfterRun, acmeServer.getRequestCount() + studioServer.getRequestCount());
        assertThat(workDir.resolve("second").resolve(RecordWriter.PROFILES)).exists();
    }

    @Test
    void analyzeAcceptsDocumentsWithoutCaptureTime() throws Exception {
        Path sources = sources(
            acmeServer.url("/").toString() + ",Acme,static,company",
            studioServer.url("/").toString() + ",Pixel Studio,static,freelance"
        );
        Path first = workDir.resolve("first");
        service.run(sources, first);
        Path cleaned = first.resolve(RecordWriter.CLEANED_DOCUMENTS);
        ArrayNode documents = (ArrayNode) objectMapper.readTree(cleaned.toFile());
        for (JsonNode document : documents) {
            ((ObjectNode) document).remove("capturedAt");
        }
        objectMapper.writeValue(cleaned.toFile(), documents);

        RunSummary summary = service.analyze(cleaned, workDir.resolve("second"));

        assertEquals(RunStatus.COMPLETED, summary.status());
        assertEquals(2, summary.documentCount());
        assertEquals(2, summary.profileCount());
        JsonNode profiles = objectMapper.readTree(workDir.resolve("second").resolve(RecordWriter.PROFILES).toFile());
        assertEquals(2, profiles.size());
        for (JsonNode profile : profiles) {
            assertThat(profile.path("firstCapturedAt").isNull()).isTrue();
            assertThat(profile.path("lastCapturedAt").isNull()).isTrue();
        }
    }

    @Test
    void unreadableSourceListFailsTheRun() {
        Path output = workDir.resolve("out");

        RunSummary summary = service.run(workDir.resolve("missing.csv"), output);

        assertEquals(RunStatus.FAILED, summary.status());
        assertEquals(PipelineCliRunner.EXIT_FAILED, PipelineCliRunner.exitCode(summary.status()));
        assertThat(summary.notes()).contains("missing.csv");
        assertThat(output.resolve(RecordWriter.RUN_SUMMARY)).exists();
    }

    @Test
    void runWithoutLiveSourcesFails() throws Exception {
        Path sources = sources(missingServer.url("/").toString() + ",Missing,static,company");

        RunSummary summary = service.run(sources, workDir.resolve("out"));

        assertEquals(RunStatus.FAILED, summary.status());
        assertEquals(0, summary.liveSourceCount());
        assertEquals(0, summary.profileCount());
    }

    @Test
    void cancelWithoutActiveRunIsNoOp() {
        assertThat(service.cancelActiveRun()).isFalse();
    }

    private Path sources(String... rows) throws Exception {
        Path file = workDir.resolve("sources.csv");
        String csv = "url,name,strategy,category\n" + String.join("\n", rows) + "\n";
        Files.writeString(file, csv, StandardCharsets.UTF_8);
        return file;
    }

    private static MockWebServer server(String html) throws Exception {
        MockWebServer server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("/".equals(request.getPath())) {
                    return new MockResponse()
                        .setResponseCode(200)
                        .setHeader("Content-Type", "text/html; charset=utf-8")
                        .setBody(html);
                }
                return new MockResponse().setResponseCode(404);
            }
        });
        server.start();
        return server;
    }

    private static String page(String title, String text) {
        return "<html><head><title>" + title + "</title></head><body><h1>" + title + "</h1><p>"
            + text + "</p></body></html>";
    }
}
