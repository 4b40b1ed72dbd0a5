package com.market.intel.pipeline.run;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.intel.pipeline.io.FailureLog;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunContextTest {
    private final RunContext context = new RunContext(
        "run-test",
        new PolitenessGate(1),
        FailureLog.inMemory(new ObjectMapper())
    );

    @Test
    void interruptedWorkerThreadDoesNotCancelTheRun() {
        Thread.currentThread().interrupt();
        try {
            assertThat(context.isCancelled()).isFalse();
            context.throwIfCancelled();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void cancelIsSeenByEveryWorker() {
        context.cancel();

        assertThat(context.isCancelled()).isTrue();
        assertThatThrownBy(context::throwIfCancelled)
            .isInstanceOf(RunCancelledException.class)
            .hasMessageContaining("run-test");
    }

    @Test
    void visitedUrlsAreClaimedOnceAfterNormalization() {
        assertThat(context.markVisited("https://Acme.example/about/")).isTrue();
        assertThat(context.markVisited("https://acme.example/about")).isFalse();
        assertThat(context.isVisited("https://acme.example/about")).isTrue();
    }
}
