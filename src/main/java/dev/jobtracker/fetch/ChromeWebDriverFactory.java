package dev.jobtracker.fetch;

import dev.jobtracker.config.TrackerProperties;
import io.github.bonigarcia.wdm.WebDriverManager;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Headless Chrome sessions. The driver binary is resolved on first use; a failed resolution is
 * attempted again on the next session.
 */
@Slf4j
@Component
public class ChromeWebDriverFactory implements WebDriverFactory {

    private final TrackerProperties.Fetch settings;
    private final Runnable driverSetup;
    private volatile boolean driverResolved;

    @Autowired
    public ChromeWebDriverFactory(TrackerProperties properties) {
        this(properties, () -> WebDriverManager.chromedriver().setup());
    }

    ChromeWebDriverFactory(TrackerProperties properties, Runnable driverSetup) {
        this.settings = properties.getFetch();
        this.driverSetup = driverSetup;
    }

    @Override
    public WebDriver create() {
        resolveDriver();

        ChromeOptions options = new ChromeOptions();
        if (settings.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
                "--no-sandbox",
                "--disable-dev-shm-usage",
                "--disable-blink-features=AutomationControlled",
                "--window-size=1920,1080",
                "--disable-extensions",
                "--disable-gpu"
        );
        options.setExperimentalOption("excludeSwitches", List.of("enable-automation"));
        options.addArguments("user-agent=" + settings.getUserAgent());

        return new ChromeDriver(options);
    }

    void resolveDriver() {
        if (driverResolved) {
            return;
        }
        synchronized (this) {
            if (!driverResolved) {
                log.info("Resolving chromedriver binary (headless={})", settings.isHeadless());
                driverSetup.run();
                driverResolved = true;
            }
        }
    }

    boolean isDriverResolved() {
        return driverResolved;
    }
}
