package com.market.intel.pipeline.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.io.FailureLog;
import com.market.intel.pipeline.model.HttpFetchResult;
import com.market.intel.pipeline.run.PolitenessGate;
import com.market.intel.pipeline.run.RunContext;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private RunContext context;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        context = new RunContext("run-test", new PolitenessGate(1), FailureLog.inMemory(new ObjectMapper()));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void retriesServerErrorsUntilSuccess() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));

        PoliteHttpClient client = new PoliteHttpClient(properties(2), executor);
        HttpFetchResult result = client.get(server.url("/page").toString(), "text/html", context);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).contains("ok");
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void doesNotRetryNotFound() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));

        PoliteHttpClient client = new PoliteHttpClient(properties(2), executor);
        HttpFetchResult result = client.get(server.url("/missing").toString(), "text/html", context);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void givesUpAfterConfiguredAttempts() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }

        PoliteHttpClient client = new PoliteHttpClient(properties(2), executor);
        HttpFetchResult result = client.get(server.url("/broken").toString(), "text/html", context);

        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void cancelledRunSendsNoRequest() {
        context.cancel();

        PoliteHttpClient client = new PoliteHttpClient(properties(2), executor);
        HttpFetchResult result = client.get(server.url("/page").toString(), "text/html", context);

        assertThat(result.errorCode()).isEqualTo("cancelled");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void invalidUrlIsReportedWithoutRetry() {
        PoliteHttpClient client = new PoliteHttpClient(properties(2), executor);
        HttpFetchResult result = client.get("http://", "text/html", context);

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.attempts()).isEqualTo(1);
    }

    private PipelineProperties properties(int retries) {
        PipelineProperties properties = new PipelineProperties();
        properties.getFetch().setGlobalConcurrency(1);
        properties.getFetch().setPerHostDelayMs(1);
        properties.getFetch().setRequestTimeoutSeconds(5);
        properties.getFetch().setRequestMaxRetries(retries);
        properties.getFetch().setRequestRetryBaseDelayMs(1);
        properties.getFetch().setRequestRetryMaxDelayMs(5);
        return properties;
    }
}
