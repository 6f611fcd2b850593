package dev.jobtracker.fetch;

import dev.jobtracker.model.FetchStrategy;
import dev.jobtracker.model.RawContent;
import reactor.core.publisher.Mono;

/**
 * Retrieves the markup of a career page.
 * Implementations signal failures as {@link FetchException} and never retry.
 */
public interface PageFetcher {

    FetchStrategy getStrategy();

    /**
     * Fetch the page at an absolute http(s) URL.
     */
    Mono<RawContent> fetch(String url);
}
