package com.market.intel.pipeline.fetch;

import com.market.intel.config.PipelineProperties;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URI;

@Component
public class WebDriverFactory {
    private static final Logger log = LoggerFactory.getLogger(WebDriverFactory.class);

    private final PipelineProperties properties;

    public WebDriverFactory(PipelineProperties properties) {
        this.properties = properties;
    }

    public WebDriver create() {
        ChromeOptions options = chromeOptions();
        String remoteUrl = properties.getBrowser().getRemoteUrl();
        if (remoteUrl != null && !remoteUrl.isBlank()) {
            log.debug("Using remote WebDriver at {}", remoteUrl);
            try {
                return new RemoteWebDriver(URI.create(remoteUrl.trim()).toURL(), options);
            } catch (MalformedURLException | IllegalArgumentException e) {
                throw new IllegalStateException("Invalid remote WebDriver URL " + remoteUrl, e);
            }
        }
        return new ChromeDriver(options);
    }

    ChromeOptions chromeOptions() {
        ChromeOptions options = new ChromeOptions();
        if (properties.getBrowser().isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
            "--disable-gpu",
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--window-size=1366,900",
            "--user-agent=" + properties.getFetch().getUserAgent()
        );
        return options;
    }
}
