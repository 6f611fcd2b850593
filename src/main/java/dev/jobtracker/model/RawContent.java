package dev.jobtracker.model;

import java.time.Duration;

/**
 * Markup returned by a page fetch.
 *
 * @param html     raw page markup, never null
 * @param finalUrl URL the content was served from after redirects
 * @param elapsed  wall-clock time spent fetching
 * @param strategy transport that produced the content
 */
public record RawContent(String html, String finalUrl, Duration elapsed, FetchStrategy strategy) {

    public RawContent {
        html = html == null ? "" : html;
    }

    public boolean isBlank() {
        return html.isBlank();
    }
}
