package com.market.intel.pipeline.fetch;

import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.model.ErrorKind;
import com.market.intel.pipeline.model.FetchStrategy;
import com.market.intel.pipeline.model.HttpFetchResult;
import com.market.intel.pipeline.model.PageCapture;
import com.market.intel.pipeline.model.PipelineStage;
import com.market.intel.pipeline.model.Source;
import com.market.intel.pipeline.model.SourceStrategy;
import com.market.intel.pipeline.run.RunContext;
import com.market.intel.pipeline.util.HashUtils;
import com.market.intel.pipeline.util.ReasonCodeClassifier;
import com.market.intel.pipeline.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches the entry page of a source plus a bounded number of its section pages.
 */
@Service
public class SourceFetcher {
    private static final Logger log = LoggerFactory.getLogger(SourceFetcher.class);

    private final PipelineProperties.Fetch properties;
    private final ContentFetcher staticFetcher;
    private final ContentFetcher browserFetcher;
    private final SectionLinkFinder sectionLinkFinder;

    @Autowired
    public SourceFetcher(
        PipelineProperties properties,
        StaticContentFetcher staticFetcher,
        BrowserContentFetcher browserFetcher,
        SectionLinkFinder sectionLinkFinder
    ) {
        this(properties.getFetch(), staticFetcher, browserFetcher, sectionLinkFinder);
    }

    SourceFetcher(
        PipelineProperties.Fetch properties,
        ContentFetcher staticFetcher,
        ContentFetcher browserFetcher,
        SectionLinkFinder sectionLinkFinder
    ) {
        this.properties = properties;
        this.staticFetcher = staticFetcher;
        this.browserFetcher = browserFetcher;
        this.sectionLinkFinder = sectionLinkFinder;
    }

    public List<PageCapture> fetch(Source source, RunContext context) {
        if (context.isCancelled()) {
            return List.of();
        }
        if (!context.markVisited(source.url())) {
            log.info("Skipping source {}: {} already fetched in this run", source.id(), source.url());
            return List.of();
        }

        FetchedPage entry = fetchPage(source.strategy(), source.url(), context);
        if (!entry.isSuccessful()) {
            recordFailure(source, source.url(), entry.result(), ErrorKind.FETCH_FAILED, context);
            return List.of();
        }

        List<PageCapture> captures = new ArrayList<>();
        captures.add(toCapture(source, 0, entry));

        SourceStrategy followUpHint = entry.strategy() == FetchStrategy.DYNAMIC
            ? SourceStrategy.DYNAMIC
            : source.strategy();
        List<String> sectionLinks = sectionLinkFinder.find(
            entry.result().body(),
            entry.result().finalUrlOrRequested(),
            properties.getMaxSectionLinks()
        );
        int pageIndex = 1;
        for (String link : sectionLinks) {
            if (context.isCancelled()) {
                break;
            }
            if (!context.markVisited(link)) {
                continue;
            }
            FetchedPage page = fetchPage(followUpHint, link, context);
            if (page.isSuccessful()) {
                captures.add(toCapture(source, pageIndex++, page));
            } else {
                String reason = ReasonCodeClassifier.fromFetchResult(page.result());
                ErrorKind kind = ReasonCodeClassifier.isRetryable(reason) ? ErrorKind.FETCH_TRANSIENT : ErrorKind.FETCH_FAILED;
                recordFailure(source, link, page.result(), kind, context);
            }
        }
        log.debug("Source {} produced {} captures", source.id(), captures.size());
        return captures;
    }

    FetchedPage fetchPage(SourceStrategy hint, String url, RunContext context) {
        if (StrategySelector.initial(hint) == FetchStrategy.DYNAMIC) {
            FetchedPage rendered = browserFetcher.fetch(url, context);
            if (StrategySelector.shouldFallBackToStatic(hint, rendered.result())) {
                log.info("Rendering failed for {} ({}), falling back to static fetch", url, rendered.result().errorCode());
                return staticFetcher.fetch(url, context);
            }
            return rendered;
        }

        FetchedPage staticPage = staticFetcher.fetch(url, context);
        HttpFetchResult result = staticPage.result();
        if (hint != SourceStrategy.AUTO) {
            return staticPage;
        }
        PageAssessment assessment = ShellDetector.assess(result.body(), result.finalUrlOrRequested());
        if (!StrategySelector.shouldEscalate(hint, result, assessment, properties.getStaticMinTextLength())) {
            return staticPage;
        }
        log.info("Static content for {} looks empty (text={} chars, scripts={}), rendering", url, assessment.textLength(), assessment.scriptCount());
        FetchedPage rendered = browserFetcher.fetch(url, context);
        if (rendered.isSuccessful()) {
            return rendered;
        }
        log.warn("Rendering {} failed ({}), keeping static content", url, rendered.result().errorCode());
        return staticPage;
    }

    private PageCapture toCapture(Source source, int pageIndex, FetchedPage page) {
        HttpFetchResult result = page.result();
        String finalUrl = result.finalUrlOrRequested();
        String normalized = UrlNormalizer.normalize(finalUrl);
        return new PageCapture(
            HashUtils.shortId("cap", source.id(), normalized == null ? finalUrl : normalized, result.fetchedAt().toString()),
            source.id(),
            source.url(),
            source.name(),
            source.category(),
            source.rowIndex(),
            pageIndex,
            result.requestedUrl(),
            finalUrl,
            page.strategy(),
            result.statusCode(),
            page.isSuccessful(),
            result.fetchedAt(),
            page.snapshotPath(),
            result.body()
        );
    }

    private void recordFailure(Source source, String url, HttpFetchResult result, ErrorKind kind, RunContext context) {
        String reason = ReasonCodeClassifier.fromFetchResult(result);
        String message = result.errorCode() != null
            ? result.errorCode() + ": " + result.errorMessage()
            : "HTTP " + result.statusCode();
        if (result.attempts() > 1) {
            message = message + " after " + result.attempts() + " attempts";
        }
        context.recordFailure(source.id(), url, PipelineStage.FETCH, kind, reason, message);
    }
}
