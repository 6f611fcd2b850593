package dev.jobtracker.fetch;

import org.openqa.selenium.WebDriver;

/**
 * Creates a fresh browser session for one page load.
 */
@FunctionalInterface
public interface WebDriverFactory {

    WebDriver create();
}
