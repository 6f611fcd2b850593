package dev.jobtracker.fetch;

import dev.jobtracker.config.TrackerProperties;
import dev.jobtracker.model.FetchStrategy;
import dev.jobtracker.model.RawContent;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Fetch through a headless browser for pages that render their listings with JavaScript.
 * Each call opens and closes its own browser session.
 */
@Slf4j
@Component
public class BrowserPageFetcher implements PageFetcher {

    private final WebDriverFactory driverFactory;
    private final TrackerProperties.Fetch settings;

    public BrowserPageFetcher(WebDriverFactory driverFactory, TrackerProperties properties) {
        this.driverFactory = driverFactory;
        this.settings = properties.getFetch();
    }

    @Override
    public FetchStrategy getStrategy() {
        return FetchStrategy.BROWSER;
    }

    @Override
    public Mono<RawContent> fetch(String url) {
        return Mono.fromCallable(() -> load(url))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(settings.getBrowserTimeout())
                .onErrorMap(TimeoutException.class, e -> new FetchException(FetchException.Kind.TIMEOUT,
                        "Browser load of " + url + " exceeded " + settings.getBrowserTimeout().toSeconds() + "s", e));
    }

    RawContent load(String url) {
        long start = System.nanoTime();
        WebDriver driver = null;
        try {
            log.info("Loading {} in headless browser", url);
            driver = driverFactory.create();
            driver.manage().timeouts().pageLoadTimeout(settings.getBrowserPageLoadTimeout());
            driver.get(url);

            pause(settings.getBrowserContentWait());
            // Scroll to trigger lazy-loaded listings
            ((JavascriptExecutor) driver).executeScript("window.scrollTo(0, document.body.scrollHeight)");
            pause(settings.getBrowserScrollWait());

            String html = driver.getPageSource();
            String finalUrl = driver.getCurrentUrl();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("Browser fetched {} chars from {} in {} ms", html == null ? 0 : html.length(), url,
                    elapsed.toMillis());
            return new RawContent(html, finalUrl != null ? finalUrl : url, elapsed, FetchStrategy.BROWSER);
        } catch (FetchException e) {
            throw e;
        } catch (org.openqa.selenium.TimeoutException e) {
            throw new FetchException(FetchException.Kind.TIMEOUT, "Browser page load timed out for " + url, e);
        } catch (RuntimeException e) {
            // includes WebDriverManagerException from driver resolution
            throw new FetchException(FetchException.Kind.BROWSER_CRASH,
                    "Browser automation failed for " + url + ": " + firstLine(e.getMessage()), e);
        } finally {
            quit(driver, url);
        }
    }

    private void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchException.Kind.BROWSER_CRASH, "Browser fetch interrupted", e);
        }
    }

    private void quit(WebDriver driver, String url) {
        if (driver == null) {
            return;
        }
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Failed to close browser session for {}: {}", url, firstLine(e.getMessage()));
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
