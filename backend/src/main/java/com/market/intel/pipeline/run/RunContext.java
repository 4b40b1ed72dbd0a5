package com.market.intel.pipeline.run;

import com.market.intel.pipeline.io.FailureLog;
import com.market.intel.pipeline.model.ErrorKind;
import com.market.intel.pipeline.model.FailureRecord;
import com.market.intel.pipeline.model.PipelineStage;
import com.market.intel.pipeline.util.UrlNormalizer;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State shared by all workers of a single pipeline run.
 */
public class RunContext {
    private final String runId;
    private final PolitenessGate politenessGate;
    private final FailureLog failureLog;
    private final Set<String> visitedUrls = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public RunContext(String runId, PolitenessGate politenessGate, FailureLog failureLog) {
        this.runId = runId;
        this.politenessGate = politenessGate;
        this.failureLog = failureLog;
    }

    public String runId() {
        return runId;
    }

    public PolitenessGate politenessGate() {
        return politenessGate;
    }

    public FailureLog failureLog() {
        return failureLog;
    }

    /**
     * Claims a URL for this run. Returns false when the normalized URL was already claimed.
     */
    public boolean markVisited(String url) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null) {
            return true;
        }
        return visitedUrls.add(normalized);
    }

    public boolean isVisited(String url) {
        String normalized = UrlNormalizer.normalize(url);
        return normalized != null && visitedUrls.contains(normalized);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new RunCancelledException("Run " + runId + " cancelled");
        }
    }

    public void recordFailure(
        String sourceId,
        String url,
        PipelineStage stage,
        ErrorKind errorKind,
        String reasonCode,
        String message
    ) {
        failureLog.record(new FailureRecord(
            Instant.now(),
            runId,
            sourceId,
            url,
            stage,
            errorKind,
            reasonCode,
            message
        ));
    }
}
