package dev.jobtracker.fetch;

import dev.jobtracker.config.TrackerProperties;
import dev.jobtracker.model.FetchStrategy;
import io.github.bonigarcia.wdm.config.WebDriverManagerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.SessionNotCreatedException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BrowserPageFetcherTest {

    @Mock
    private WebDriverFactory driverFactory;

    private WebDriver driver;
    private BrowserPageFetcher fetcher;

    @BeforeEach
    void setUp() {
        TrackerProperties properties = new TrackerProperties();
        properties.getFetch().setBrowserContentWait(Duration.ZERO);
        properties.getFetch().setBrowserScrollWait(Duration.ZERO);
        properties.getFetch().setBrowserTimeout(Duration.ofSeconds(5));

        driver = mock(WebDriver.class, withSettings()
                .extraInterfaces(JavascriptExecutor.class)
                .defaultAnswer(RETURNS_DEEP_STUBS));
        fetcher = new BrowserPageFetcher(driverFactory, properties);
    }

    @Test
    @DisplayName("Should return rendered page source and current URL")
    void shouldReturnRenderedPage() {
        when(driverFactory.create()).thenReturn(driver);
        when(driver.getPageSource()).thenReturn("<html><li>Backend Engineer</li></html>");
        when(driver.getCurrentUrl()).thenReturn("https://acme.example/careers?page=1");

        StepVerifier.create(fetcher.fetch("https://acme.example/careers"))
                .assertNext(content -> {
                    assertThat(content.html()).contains("Backend Engineer");
                    assertThat(content.finalUrl()).isEqualTo("https://acme.example/careers?page=1");
                    assertThat(content.strategy()).isEqualTo(FetchStrategy.BROWSER);
                })
                .verifyComplete();

        verify(driver).get("https://acme.example/careers");
        verify((JavascriptExecutor) driver).executeScript(anyString());
        verify(driver).quit();
    }

    @Test
    @DisplayName("Should map driver failures to BROWSER_CRASH and still close the session")
    void shouldMapDriverFailure() {
        when(driverFactory.create()).thenReturn(driver);
        doThrow(new WebDriverException("chrome not reachable")).when(driver).get(anyString());

        StepVerifier.create(fetcher.fetch("https://acme.example/careers"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(FetchException.class);
                    assertThat(((FetchException) e).getKind()).isEqualTo(FetchException.Kind.BROWSER_CRASH);
                })
                .verify();

        verify(driver).quit();
    }

    @Test
    @DisplayName("Should map page load timeout to TIMEOUT")
    void shouldMapPageLoadTimeout() {
        when(driverFactory.create()).thenReturn(driver);
        doThrow(new TimeoutException("page load")).when(driver).get(anyString());

        StepVerifier.create(fetcher.fetch("https://acme.example/careers"))
                .expectErrorSatisfies(e -> assertThat(((FetchException) e).getKind())
                        .isEqualTo(FetchException.Kind.TIMEOUT))
                .verify();

        verify(driver).quit();
    }

    @Test
    @DisplayName("Should report BROWSER_CRASH when no session can be started")
    void shouldReportSessionFailure() {
        when(driverFactory.create()).thenThrow(new SessionNotCreatedException("no chrome"));

        StepVerifier.create(fetcher.fetch("https://acme.example/careers"))
                .expectErrorSatisfies(e -> assertThat(((FetchException) e).getKind())
                        .isEqualTo(FetchException.Kind.BROWSER_CRASH))
                .verify();

        verifyNoInteractions(driver);
    }

    @Test
    @DisplayName("Should report BROWSER_CRASH when the driver binary cannot be resolved")
    void shouldReportDriverResolutionFailure() {
        when(driverFactory.create()).thenThrow(new WebDriverManagerException("chromedriver not found"));

        StepVerifier.create(fetcher.fetch("https://acme.example/careers"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(FetchException.class);
                    assertThat(((FetchException) e).getKind()).isEqualTo(FetchException.Kind.BROWSER_CRASH);
                    assertThat(e.getMessage()).contains("chromedriver not found");
                })
                .verify();
    }
}
