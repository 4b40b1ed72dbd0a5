package com.market.intel.pipeline.fetch;

import com.market.intel.config.PipelineProperties;
import com.market.intel.pipeline.model.FetchStrategy;
import com.market.intel.pipeline.model.HttpFetchResult;
import com.market.intel.pipeline.run.RunContext;
import com.market.intel.pipeline.util.HashUtils;
import com.market.intel.pipeline.util.UrlNormalizer;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

@Component
public class BrowserContentFetcher implements ContentFetcher {
    private static final Logger log = LoggerFactory.getLogger(BrowserContentFetcher.class);

    private final PipelineProperties.Browser properties;
    private final WebDriverFactory webDriverFactory;

    public BrowserContentFetcher(PipelineProperties properties, WebDriverFactory webDriverFactory) {
        this.properties = properties.getBrowser();
        this.webDriverFactory = webDriverFactory;
    }

    @Override
    public FetchStrategy strategy() {
        return FetchStrategy.DYNAMIC;
    }

    @Override
    public FetchedPage fetch(String url, RunContext context) {
        Instant startedAt = Instant.now();
        if (!properties.isEnabled()) {
            return failure(url, startedAt, "renderer_unavailable", "browser rendering disabled");
        }
        URI uri = UrlNormalizer.toUri(url);
        if (uri == null) {
            return failure(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        if (context.isCancelled()) {
            return failure(url, startedAt, "cancelled", "run cancelled");
        }
        try {
            context.politenessGate().await(uri.getHost());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(url, startedAt, "interrupted", e.getMessage());
        }

        WebDriver driver;
        try {
            driver = webDriverFactory.create();
        } catch (RuntimeException e) {
            log.warn("Browser renderer unavailable for {}", url, e);
            return failure(url, startedAt, "renderer_unavailable", e.getMessage());
        }
        try {
            driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(properties.getPageLoadTimeoutSeconds()));
            driver.get(uri.toString());
            waitForDocumentReady(driver, url);
            scrollToBottom(driver, context);
            String html = driver.getPageSource();
            URI finalUri = UrlNormalizer.toUri(driver.getCurrentUrl());
            String snapshotPath = saveSnapshot(driver, url);
            HttpFetchResult result = new HttpFetchResult(
                url,
                finalUri,
                200,
                html,
                "text/html",
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                1,
                null,
                null
            );
            return new FetchedPage(result, FetchStrategy.DYNAMIC, snapshotPath);
        } catch (TimeoutException e) {
            return failure(url, startedAt, "timeout", e.getMessage());
        } catch (WebDriverException e) {
            log.warn("Rendering failed for {}", url, e);
            return failure(url, startedAt, "render_failed", e.getMessage());
        } finally {
            quit(driver);
        }
    }

    private void waitForDocumentReady(WebDriver driver, String url) {
        try {
            new WebDriverWait(driver, Duration.ofSeconds(properties.getSettleTimeoutSeconds()))
                .until(d -> Objects.equals(
                    "complete",
                    ((JavascriptExecutor) d).executeScript("return document.readyState")
                ));
        } catch (TimeoutException e) {
            log.debug("Document at {} not ready after {}s, capturing current DOM", url, properties.getSettleTimeoutSeconds());
        }
    }

    private void scrollToBottom(WebDriver driver, RunContext context) {
        JavascriptExecutor js = (JavascriptExecutor) driver;
        Object lastHeight = js.executeScript("return document.body ? document.body.scrollHeight : 0");
        for (int i = 0; i < properties.getMaxScrolls(); i++) {
            if (context.isCancelled()) {
                return;
            }
            js.executeScript("window.scrollTo(0, document.body ? document.body.scrollHeight : 0);");
            try {
                Thread.sleep(properties.getScrollPauseMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            Object height = js.executeScript("return document.body ? document.body.scrollHeight : 0");
            if (Objects.equals(height, lastHeight)) {
                return;
            }
            lastHeight = height;
        }
    }

    private String saveSnapshot(WebDriver driver, String url) {
        String dir = properties.getSnapshotDir();
        if (dir == null || dir.isBlank() || !(driver instanceof TakesScreenshot screenshotTaker)) {
            return null;
        }
        try {
            byte[] png = screenshotTaker.getScreenshotAs(OutputType.BYTES);
            Path directory = Paths.get(dir);
            Files.createDirectories(directory);
            Path target = directory.resolve(HashUtils.shortId("snap", url, Instant.now().toString()) + ".png");
            Files.write(target, png);
            return target.toString();
        } catch (IOException | WebDriverException e) {
            log.warn("Snapshot failed for {}", url, e);
            return null;
        }
    }

    private void quit(WebDriver driver) {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.debug("WebDriver quit failed", e);
        }
    }

    private FetchedPage failure(String url, Instant startedAt, String code, String message) {
        HttpFetchResult result = new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            1,
            code,
            message
        );
        return new FetchedPage(result, FetchStrategy.DYNAMIC, null);
    }
}
