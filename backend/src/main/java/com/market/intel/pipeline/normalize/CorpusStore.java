package com.market.intel.pipeline.normalize;

import com.market.intel.pipeline.model.CleanedDocument;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Run-scoped, fingerprint-keyed document store. Admission is safe from many threads; on a fingerprint
 * collision the document that comes first in capture order is kept, whichever thread arrives first.
 * Closing the store is the barrier before corpus-wide analysis.
 */
public class CorpusStore {
    public static final Comparator<CleanedDocument> CAPTURE_ORDER = Comparator
        .comparingInt(CleanedDocument::sourceIndex)
        .thenComparingInt(CleanedDocument::pageIndex)
        .thenComparing(CleanedDocument::capturedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(CleanedDocument::documentId);

    public enum Admission {
        ADMITTED,
        REPLACED,
        DUPLICATE
    }

    private final Map<String, CleanedDocument> byFingerprint = new ConcurrentHashMap<>();
    private final AtomicInteger duplicates = new AtomicInteger();
    private final ReadWriteLock closeLock = new ReentrantReadWriteLock();
    private volatile boolean closed;

    public Admission admit(CleanedDocument document) {
        closeLock.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Corpus is closed, cannot admit " + document.documentId());
            }
            AtomicReference<Admission> outcome = new AtomicReference<>(Admission.ADMITTED);
            byFingerprint.compute(document.fingerprint(), (fingerprint, existing) -> {
                if (existing == null) {
                    return document;
                }
                if (CAPTURE_ORDER.compare(document, existing) < 0) {
                    outcome.set(Admission.REPLACED);
                    return document;
                }
                outcome.set(Admission.DUPLICATE);
                return existing;
            });
            if (outcome.get() != Admission.ADMITTED) {
                duplicates.incrementAndGet();
            }
            return outcome.get();
        } finally {
            closeLock.readLock().unlock();
        }
    }

    /**
     * Rejects further admissions and returns the surviving documents in capture order.
     */
    public List<CleanedDocument> close() {
        closeLock.writeLock().lock();
        try {
            closed = true;
            return snapshot();
        } finally {
            closeLock.writeLock().unlock();
        }
    }

    public List<CleanedDocument> documents() {
        return snapshot();
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return byFingerprint.size();
    }

    public int duplicateCount() {
        return duplicates.get();
    }

    private List<CleanedDocument> snapshot() {
        return byFingerprint.values().stream().sorted(CAPTURE_ORDER).toList();
    }
}
