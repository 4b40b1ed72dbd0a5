package com.market.intel.pipeline.normalize;

import com.market.intel.pipeline.model.CleanedDocument;
import com.market.intel.pipeline.model.SourceCategory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.market.intel.pipeline.PipelineFixtures.CAPTURED_AT;
import static com.market.intel.pipeline.PipelineFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusStoreTest {
    private static final String SHARED_TEXT = "Acme builds cloud platforms for retailers.";

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void identicalTextKeepsEarliestSourceRegardlessOfArrival() {
        CorpusStore store = new CorpusStore();
        CleanedDocument later = doc("doc-b", 1, 0, SHARED_TEXT);
        CleanedDocument earlier = doc("doc-a", 0, 0, SHARED_TEXT);

        assertThat(store.admit(later)).isEqualTo(CorpusStore.Admission.ADMITTED);
        assertThat(store.admit(earlier)).isEqualTo(CorpusStore.Admission.REPLACED);

        List<CleanedDocument> documents = store.close();
        assertThat(documents).extracting(CleanedDocument::documentId).containsExactly("doc-a");
        assertThat(store.duplicateCount()).isEqualTo(1);
    }

    @Test
    void fingerprintIgnoresCaseAndWhitespace() {
        CorpusStore store = new CorpusStore();
        store.admit(doc("doc-a", 0, 0, SHARED_TEXT));

        assertThat(store.admit(doc("doc-b", 0, 1, "ACME   builds cloud\nplatforms for retailers.")))
            .isEqualTo(CorpusStore.Admission.DUPLICATE);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void concurrentAdmissionsConvergeOnCaptureOrder() throws Exception {
        CorpusStore store = new CorpusStore();
        List<CleanedDocument> candidates = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            candidates.add(doc(String.format("doc-%02d", i), i, 0, SHARED_TEXT));
            candidates.add(doc(String.format("unique-%02d", i), i, 1, "Unique page number " + i));
        }
        Collections.shuffle(candidates);

        CountDownLatch start = new CountDownLatch(1);
        List<Future<CorpusStore.Admission>> futures = new ArrayList<>();
        for (CleanedDocument candidate : candidates) {
            futures.add(executor.submit(() -> {
                start.await();
                return store.admit(candidate);
            }));
        }
        start.countDown();
        for (Future<CorpusStore.Admission> future : futures) {
            future.get();
        }

        List<CleanedDocument> documents = store.close();
        assertThat(documents).hasSize(41);
        assertThat(documents.get(0).documentId()).isEqualTo("doc-00");
        assertThat(documents).filteredOn(d -> d.documentId().startsWith("doc-")).hasSize(1);
        assertThat(store.duplicateCount()).isEqualTo(39);
    }

    @Test
    void closedStoreRejectsAdmissions() {
        CorpusStore store = new CorpusStore();
        store.close();

        assertThat(store.isClosed()).isTrue();
        assertThatThrownBy(() -> store.admit(doc("doc-a", 0, 0, SHARED_TEXT)))
            .isInstanceOf(IllegalStateException.class);
    }

    private CleanedDocument doc(String id, int sourceIndex, int pageIndex, String text) {
        return document(id, "https://site" + sourceIndex + ".example/", SourceCategory.COMPANY, "Acme", CAPTURED_AT, text,
            sourceIndex, pageIndex);
    }
}
