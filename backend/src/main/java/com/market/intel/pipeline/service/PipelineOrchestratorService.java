package com.market.intel.pipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.aggregate.ProfileAggregator;
import com.market.intel.pipeline.analysis.AnalysisEngine;
import com.market.intel.pipeline.analysis.AnalysisOutcome;
import com.market.intel.pipeline.extract.SectionExtractor;
import com.market.intel.pipeline.fetch.SourceFetcher;
import com.market.intel.pipeline.io.CorpusReader;
import com.market.intel.pipeline.io.FailureLog;
import com.market.intel.pipeline.io.RecordWriter;
import com.market.intel.pipeline.io.SourceListReader;
import com.market.intel.pipeline.model.AggregatedProfile;
import com.market.intel.pipeline.model.AnalysisResult;
import com.market.intel.pipeline.model.CleanedDocument;
import com.market.intel.pipeline.model.ErrorKind;
import com.market.intel.pipeline.model.ExtractedRecord;
import com.market.intel.pipeline.model.PageCapture;
import com.market.intel.pipeline.model.PipelineStage;
import com.market.intel.pipeline.model.RunStatus;
import com.market.intel.pipeline.model.RunSummary;
import com.market.intel.pipeline.model.Source;
import com.market.intel.pipeline.normalize.CorpusStore;
import com.market.intel.pipeline.normalize.DocumentNormalizer;
import com.market.intel.pipeline.run.PolitenessGate;
import com.market.intel.pipeline.run.RunCancelledException;
import com.market.intel.pipeline.run.RunContext;
import com.market.intel.pipeline.util.HashUtils;
import com.market.intel.pipeline.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one run end to end. Every completed stage is written to the output directory before the
 * next stage starts, so a failed or cancelled run keeps what it already produced.
 */
@Service
public class PipelineOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestratorService.class);

    public static final String COMMAND_RUN = "run";
    public static final String COMMAND_ANALYZE = "analyze";

    private final PipelineProperties properties;
    private final SourceListReader sourceListReader;
    private final CorpusReader corpusReader;
    private final RecordWriter recordWriter;
    private final SourceFetcher sourceFetcher;
    private final SectionExtractor extractor;
    private final DocumentNormalizer normalizer;
    private final AnalysisEngine analysisEngine;
    private final ProfileAggregator aggregator;
    private final ObjectMapper objectMapper;
    private final ExecutorService crawlExecutor;
    private final AtomicReference<RunContext> activeRun = new AtomicReference<>();

    public PipelineOrchestratorService(
        PipelineProperties properties,
        SourceListReader sourceListReader,
        CorpusReader corpusReader,
        RecordWriter recordWriter,
        SourceFetcher sourceFetcher,
        SectionExtractor extractor,
        DocumentNormalizer normalizer,
        AnalysisEngine analysisEngine,
        ProfileAggregator aggregator,
        ObjectMapper objectMapper,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor
    ) {
        this.properties = properties;
        this.sourceListReader = sourceListReader;
        this.corpusReader = corpusReader;
        this.recordWriter = recordWriter;
        this.sourceFetcher = sourceFetcher;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.analysisEngine = analysisEngine;
        this.aggregator = aggregator;
        this.objectMapper = objectMapper;
        this.crawlExecutor = crawlExecutor;
    }

    public RunSummary run(Path sourcesPath, Path outputDirectory) {
        Instant startedAt = Instant.now();
        RunContext context = startRun(startedAt, outputDirectory);
        RunTally tally = new RunTally();
        try {
            List<Source> sources;
            try {
                sources = sourceListReader.read(sourcesPath);
            } catch (IOException e) {
                log.warn("Failed to read source list {}", sourcesPath, e);
                return finish(context, COMMAND_RUN, RunStatus.FAILED, startedAt, tally, outputDirectory,
                    "cannot read source list " + sourcesPath + ": " + e.getMessage());
            }
            tally.sources = sources.size();
            log.info("Run {} started: sources={}, output={}", context.runId(), sources.size(), outputDirectory);

            CorpusStore corpus = new CorpusStore();
            List<PageCapture> captures = crawl(sources, corpus, context, tally);
            write(outputDirectory, RecordWriter.RAW_CAPTURES, captures);

            List<CleanedDocument> documents = corpus.close();
            tally.documents = documents.size();
            tally.duplicates = corpus.duplicateCount();
            write(outputDirectory, RecordWriter.CLEANED_DOCUMENTS, sortedDocuments(documents));
            log.info(
                "Run {} ingestion complete: sources={}, liveSources={}, captures={}, documents={}, duplicates={}, empty={}",
                context.runId(),
                tally.sources,
                tally.liveSources,
                tally.captures,
                tally.documents,
                tally.duplicates,
                tally.droppedEmpty
            );
            if (tally.liveSources == 0) {
                return finish(context, COMMAND_RUN, RunStatus.FAILED, startedAt, tally, outputDirectory,
                    "no source produced a live capture");
            }
            return analyzeAndAggregate(documents, context, COMMAND_RUN, startedAt, tally, outputDirectory);
        } catch (RunCancelledException e) {
            log.warn("Run {} cancelled: {}", context.runId(), e.getMessage());
            return finish(context, COMMAND_RUN, RunStatus.CANCELLED, startedAt, tally, outputDirectory, e.getMessage());
        } catch (IOException e) {
            log.warn("Run {} failed writing outputs to {}", context.runId(), outputDirectory, e);
            return finish(context, COMMAND_RUN, RunStatus.FAILED, startedAt, tally, outputDirectory,
                "failed writing outputs: " + e.getMessage());
        } finally {
            activeRun.compareAndSet(context, null);
        }
    }

    /**
     * Re-runs analysis and aggregation over a previously written cleaned-documents file, without fetching.
     */
    public RunSummary analyze(Path cleanedDocumentsPath, Path outputDirectory) {
        Instant startedAt = Instant.now();
        RunContext context = startRun(startedAt, outputDirectory);
        RunTally tally = new RunTally();
        try {
            List<CleanedDocument> stored;
            try {
                stored = corpusReader.readCleanedDocuments(cleanedDocumentsPath);
            } catch (IOException e) {
                log.warn("Failed to read cleaned documents {}", cleanedDocumentsPath, e);
                return finish(context, COMMAND_ANALYZE, RunStatus.FAILED, startedAt, tally, outputDirectory,
                    "cannot read cleaned documents " + cleanedDocumentsPath + ": " + e.getMessage());
            }
            CorpusStore corpus = new CorpusStore();
            for (CleanedDocument document : stored) {
                context.throwIfCancelled();
                CleanedDocument renormalized = normalizer.renormalize(document);
                if (renormalized.text().isBlank()) {
                    tally.droppedEmpty++;
                    continue;
                }
                corpus.admit(renormalized);
            }
            List<CleanedDocument> documents = corpus.close();
            tally.sources = (int) documents.stream().map(CleanedDocument::sourceId).distinct().count();
            tally.liveSources = (int) documents.stream().filter(CleanedDocument::live)
                .map(CleanedDocument::sourceId).distinct().count();
            tally.documents = documents.size();
            tally.duplicates = corpus.duplicateCount();
            return analyzeAndAggregate(documents, context, COMMAND_ANALYZE, startedAt, tally, outputDirectory);
        } catch (RunCancelledException e) {
            log.warn("Run {} cancelled: {}", context.runId(), e.getMessage());
            return finish(context, COMMAND_ANALYZE, RunStatus.CANCELLED, startedAt, tally, outputDirectory, e.getMessage());
        } catch (IOException e) {
            log.warn("Run {} failed writing outputs to {}", context.runId(), outputDirectory, e);
            return finish(context, COMMAND_ANALYZE, RunStatus.FAILED, startedAt, tally, outputDirectory,
                "failed writing outputs: " + e.getMessage());
        } finally {
            activeRun.compareAndSet(context, null);
        }
    }

    /**
     * Flags the active run as cancelled. Workers stop at their next checkpoint.
     */
    public boolean cancelActiveRun() {
        RunContext context = activeRun.get();
        if (context == null) {
            return false;
        }
        context.cancel();
        return true;
    }

    private RunSummary analyzeAndAggregate(
        List<CleanedDocument> documents,
        RunContext context,
        String command,
        Instant startedAt,
        RunTally tally,
        Path outputDirectory
    ) throws IOException {
        try {
            requireDocuments(documents, context);
        } catch (CorpusEmptyException e) {
            return finish(context, command, RunStatus.FAILED, startedAt, tally, outputDirectory, e.getMessage());
        }

        AnalysisOutcome outcome = analysisEngine.analyze(documents, context);
        tally.analysisFailures = (int) outcome.failureCount();
        List<AnalysisResult> results = outcome.results().stream()
            .sorted(Comparator.comparing(AnalysisResult::documentId))
            .toList();
        write(outputDirectory, RecordWriter.ANALYSIS_RESULTS, results);
        write(outputDirectory, RecordWriter.CORPUS_SYNTHESIS, outcome.synthesis());
        context.throwIfCancelled();

        List<AggregatedProfile> profiles = aggregator.aggregate(documents, results);
        tally.profiles = profiles.size();
        write(outputDirectory, RecordWriter.PROFILES, profiles);

        RunStatus status = context.failureLog().size() > 0 ? RunStatus.COMPLETED_WITH_ERRORS : RunStatus.COMPLETED;
        return finish(context, command, status, startedAt, tally, outputDirectory, null);
    }

    private void requireDocuments(List<CleanedDocument> documents, RunContext context) {
        if (!documents.isEmpty()) {
            return;
        }
        String message = "no documents survived normalization";
        context.recordFailure(null, null, PipelineStage.NORMALIZE, ErrorKind.CORPUS_EMPTY,
            ReasonCodeClassifier.NO_DOCUMENTS, message);
        throw new CorpusEmptyException(message);
    }

    private List<PageCapture> crawl(List<Source> sources, CorpusStore corpus, RunContext context, RunTally tally) {
        List<CompletableFuture<List<PageCapture>>> futures = new ArrayList<>();
        for (Source source : sources) {
            futures.add(CompletableFuture.supplyAsync(() -> ingestSource(source, corpus, context, tally), crawlExecutor));
        }

        List<PageCapture> captures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Source source = sources.get(i);
            try {
                List<PageCapture> sourceCaptures = futures.get(i).join();
                captures.addAll(sourceCaptures);
                if (!sourceCaptures.isEmpty()) {
                    tally.liveSources++;
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (cause instanceof RunCancelledException cancelled) {
                    throw cancelled;
                }
                log.warn("Source ingestion failed for {} ({})", source.id(), source.url(), cause);
                context.recordFailure(
                    source.id(),
                    source.url(),
                    PipelineStage.FETCH,
                    ErrorKind.FETCH_FAILED,
                    ReasonCodeClassifier.UNKNOWN,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage()
                );
            }
        }
        context.throwIfCancelled();
        captures.sort(Comparator.comparing(PageCapture::captureId));
        tally.captures = captures.size();
        return captures;
    }

    private List<PageCapture> ingestSource(Source source, CorpusStore corpus, RunContext context, RunTally tally) {
        context.throwIfCancelled();
        List<PageCapture> captures = sourceFetcher.fetch(source, context);
        for (PageCapture capture : captures) {
            ExtractedRecord record = extractor.extract(capture);
            Optional<CleanedDocument> document = normalizer.normalize(record);
            if (document.isEmpty()) {
                log.info("Dropping capture {} of source {}: no text left after cleaning", capture.captureId(), source.id());
                tally.incrementDroppedEmpty();
                continue;
            }
            CorpusStore.Admission admission = corpus.admit(document.get());
            log.debug("Capture {} admission: {}", capture.captureId(), admission);
        }
        return captures;
    }

    private RunContext startRun(Instant startedAt, Path outputDirectory) {
        String runId = HashUtils.shortId("run", startedAt.toString(), outputDirectory.toAbsolutePath().toString());
        FailureLog failureLog = new FailureLog(objectMapper, outputDirectory.resolve(RecordWriter.FAILURES));
        RunContext context = new RunContext(
            runId,
            new PolitenessGate(properties.getFetch().getPerHostDelayMs()),
            failureLog
        );
        if (!activeRun.compareAndSet(null, context)) {
            throw new IllegalStateException("A pipeline run is already active");
        }
        return context;
    }

    private RunSummary finish(
        RunContext context,
        String command,
        RunStatus status,
        Instant startedAt,
        RunTally tally,
        Path outputDirectory,
        String notes
    ) {
        Instant finishedAt = Instant.now();
        RunSummary summary = new RunSummary(
            context.runId(),
            command,
            status,
            startedAt,
            finishedAt,
            tally.sources,
            tally.liveSources,
            tally.captures,
            tally.documents,
            tally.duplicates,
            tally.droppedEmpty,
            tally.analysisFailures,
            tally.profiles,
            context.failureLog().size(),
            outputDirectory.toAbsolutePath().toString(),
            notes
        );
        try {
            write(outputDirectory, RecordWriter.RUN_SUMMARY, summary);
        } catch (IOException e) {
            log.warn("Failed to write run summary for {}", context.runId(), e);
        }
        log.info(
            "Run {} finished with status {} in {}s: documents={}, profiles={}, failures={}",
            context.runId(),
            status,
            Duration.between(startedAt, finishedAt).toSeconds(),
            tally.documents,
            tally.profiles,
            summary.failureCount()
        );
        return summary;
    }

    private List<CleanedDocument> sortedDocuments(List<CleanedDocument> documents) {
        return documents.stream().sorted(Comparator.comparing(CleanedDocument::documentId)).toList();
    }

    private void write(Path outputDirectory, String fileName, Object value) throws IOException {
        recordWriter.write(outputDirectory, fileName, value);
    }

    private static final class RunTally {
        private int sources;
        private int liveSources;
        private int captures;
        private int documents;
        private int duplicates;
        private int droppedEmpty;
        private int analysisFailures;
        private int profiles;

        private synchronized void incrementDroppedEmpty() {
            droppedEmpty++;
        }
    }
}
