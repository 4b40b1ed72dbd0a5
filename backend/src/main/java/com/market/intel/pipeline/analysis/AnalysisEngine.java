package com.market.intel.pipeline.analysis;

import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.model.AnalysisResult;
import com.market.intel.pipeline.model.CleanedDocument;
import com.market.intel.pipeline.model.ErrorKind;
import com.market.intel.pipeline.model.PipelineStage;
import com.market.intel.pipeline.model.RankedKeyword;
import com.market.intel.pipeline.model.TermPair;
import com.market.intel.pipeline.run.RunCancelledException;
import com.market.intel.pipeline.run.RunContext;
import com.market.intel.pipeline.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Two-phase corpus analysis. Per-document preprocessing and summaries run in parallel, then the
 * corpus statistics are computed once and per-document ranking runs in parallel against them.
 * A failing document yields a failed result and never aborts the others.
 */
@Service
public class AnalysisEngine {
    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);

    private final PipelineProperties.Analysis properties;
    private final TextPreprocessor preprocessor;
    private final Summarizer summarizer;
    private final TfIdfCalculator tfIdfCalculator;
    private final ThemeClassifier themeClassifier;
    private final KeywordClusterer clusterer;
    private final CooccurrenceCounter cooccurrenceCounter;
    private final CorpusSynthesizer synthesizer;
    private final ExecutorService analysisExecutor;

    public AnalysisEngine(
        PipelineProperties properties,
        TextPreprocessor preprocessor,
        Summarizer summarizer,
        TfIdfCalculator tfIdfCalculator,
        ThemeClassifier themeClassifier,
        KeywordClusterer clusterer,
        CooccurrenceCounter cooccurrenceCounter,
        CorpusSynthesizer synthesizer,
        @Qualifier("analysisExecutor") ExecutorService analysisExecutor
    ) {
        this.properties = properties.getAnalysis();
        this.preprocessor = preprocessor;
        this.summarizer = summarizer;
        this.tfIdfCalculator = tfIdfCalculator;
        this.themeClassifier = themeClassifier;
        this.clusterer = clusterer;
        this.cooccurrenceCounter = cooccurrenceCounter;
        this.synthesizer = synthesizer;
        this.analysisExecutor = analysisExecutor;
    }

    public AnalysisOutcome analyze(List<CleanedDocument> documents, RunContext context) {
        context.throwIfCancelled();
        int corpusSize = documents.size();

        List<CompletableFuture<Prepared>> prepareFutures = new ArrayList<>();
        for (CleanedDocument document : documents) {
            prepareFutures.add(CompletableFuture.supplyAsync(() -> prepare(document, context), analysisExecutor));
        }
        List<Prepared> prepared = new ArrayList<>();
        for (int i = 0; i < prepareFutures.size(); i++) {
            prepared.add(join(prepareFutures.get(i), documents.get(i), context));
        }
        context.throwIfCancelled();

        List<PreprocessedDocument> preprocessed = prepared.stream()
            .filter(Prepared::ok)
            .map(Prepared::document)
            .toList();
        Map<String, Integer> documentFrequency = tfIdfCalculator.documentFrequency(preprocessed);
        Map<String, String> forms = tfIdfCalculator.representativeForms(preprocessed);
        log.info("Analysis corpus statistics: documents={}, analyzable={}, vocabulary={}",
            corpusSize, preprocessed.size(), documentFrequency.size());

        List<CompletableFuture<AnalysisResult>> rankFutures = new ArrayList<>();
        for (Prepared item : prepared) {
            if (!item.ok()) {
                rankFutures.add(CompletableFuture.completedFuture(item.failure()));
                continue;
            }
            rankFutures.add(CompletableFuture.supplyAsync(
                () -> score(item, documentFrequency, corpusSize, forms, context),
                analysisExecutor
            ));
        }
        List<AnalysisResult> scored = new ArrayList<>();
        for (int i = 0; i < rankFutures.size(); i++) {
            CompletableFuture<AnalysisResult> future = rankFutures.get(i);
            CleanedDocument document = documents.get(i);
            try {
                scored.add(future.join());
            } catch (CompletionException e) {
                rethrowIfCancelled(e);
                scored.add(fail(document, e.getCause() == null ? e : e.getCause(), context));
            }
        }
        context.throwIfCancelled();

        Map<String, List<String>> keywordsByDocument = new LinkedHashMap<>();
        for (AnalysisResult result : scored) {
            if (!result.hasError()) {
                keywordsByDocument.put(
                    result.documentId(),
                    result.keywords().stream().map(RankedKeyword::term).toList()
                );
            }
        }
        Map<String, String> clusters = clusterer.cluster(
            keywordsByDocument,
            properties.getClusterTopN(),
            properties.getClusterSimilarityThreshold()
        );
        List<AnalysisResult> results = new ArrayList<>();
        for (AnalysisResult result : scored) {
            String clusterId = clusters.get(result.documentId());
            results.add(clusterId == null ? result : result.withClusterId(clusterId));
        }

        List<TermPair> cooccurrences = cooccurrenceCounter.count(preprocessed, forms);
        AnalysisOutcome outcome = new AnalysisOutcome(
            List.copyOf(results),
            synthesizer.synthesize(corpusSize, results, cooccurrences)
        );
        log.info("Analysis complete: documents={}, failed={}, clusters={}",
            corpusSize, outcome.failureCount(), new HashSet<>(clusters.values()).size());
        return outcome;
    }

    private Prepared prepare(CleanedDocument document, RunContext context) {
        context.throwIfCancelled();
        try {
            PreprocessedDocument preprocessed = preprocessor.preprocess(
                document.documentId(),
                document.text(),
                document.language()
            );
            Summary summary = summarizer.summarize(
                document.text(),
                document.language(),
                properties.getSummarySentences()
            );
            return new Prepared(document, preprocessed, summary, null);
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            return new Prepared(document, null, null, fail(document, e, context));
        }
    }

    private AnalysisResult score(
        Prepared item,
        Map<String, Integer> documentFrequency,
        int corpusSize,
        Map<String, String> forms,
        RunContext context
    ) {
        context.throwIfCancelled();
        PreprocessedDocument document = item.document();
        List<ScoredTerm> ranked = tfIdfCalculator.rank(
            document,
            documentFrequency,
            corpusSize,
            forms,
            properties.getTopKeywords()
        );
        String theme = themeClassifier.classify(ranked, document.language());
        List<RankedKeyword> keywords = ranked.stream().map(ScoredTerm::toKeyword).toList();
        int tokenCount = document.lemmas().size();
        int distinctLemmas = new HashSet<>(document.lemmas()).size();
        return new AnalysisResult(
            document.documentId(),
            document.language(),
            keywords,
            theme,
            item.summary().text(),
            item.summary().method(),
            null,
            tokenCount,
            completenessScore(keywords.size(), distinctLemmas, item.summary().text(), document.language(), tokenCount),
            null
        );
    }

    static int completenessScore(int keywordCount, int distinctLemmas, String summary, String language, int tokenCount) {
        int score = 0;
        if (keywordCount > 3) {
            score += 3;
        }
        if (distinctLemmas > 5) {
            score += 2;
        }
        if (summary != null && !summary.isBlank()) {
            score += 2;
        }
        if ("en".equals(language) || "fr".equals(language)) {
            score += 1;
        }
        if (tokenCount > 20) {
            score += 2;
        }
        return score;
    }

    private Prepared join(CompletableFuture<Prepared> future, CleanedDocument document, RunContext context) {
        try {
            return future.join();
        } catch (CompletionException e) {
            rethrowIfCancelled(e);
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return new Prepared(document, null, null, fail(document, cause, context));
        }
    }

    private void rethrowIfCancelled(CompletionException e) {
        if (e.getCause() instanceof RunCancelledException cancelled) {
            throw cancelled;
        }
    }

    private AnalysisResult fail(CleanedDocument document, Throwable error, RunContext context) {
        String reason = error instanceof UnsupportedLanguageException
            ? ReasonCodeClassifier.UNSUPPORTED_LANGUAGE
            : ReasonCodeClassifier.UNKNOWN;
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        log.warn("Analysis failed for document {} ({})", document.documentId(), document.url(), error);
        context.recordFailure(
            document.sourceId(),
            document.url(),
            PipelineStage.ANALYZE,
            ErrorKind.ANALYSIS_FAILED,
            reason,
            message
        );
        return AnalysisResult.failed(document.documentId(), document.language(), message);
    }

    private record Prepared(
        CleanedDocument source,
        PreprocessedDocument document,
        Summary summary,
        AnalysisResult failure
    ) {
        boolean ok() {
            return failure == null;
        }
    }
}
