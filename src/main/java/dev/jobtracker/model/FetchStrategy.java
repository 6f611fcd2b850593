package dev.jobtracker.model;

/**
 * Transport used to retrieve a career page.
 */
public enum FetchStrategy {
    HTTP,
    BROWSER;

    public static FetchStrategy forSource(boolean requiresBrowser) {
        return requiresBrowser ? BROWSER : HTTP;
    }
}
