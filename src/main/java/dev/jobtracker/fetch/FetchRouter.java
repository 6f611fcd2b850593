package dev.jobtracker.fetch;

import dev.jobtracker.entity.TrackedSource;
import dev.jobtracker.metrics.TrackerMetrics;
import dev.jobtracker.model.FetchStrategy;
import dev.jobtracker.model.RawContent;
import dev.jobtracker.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the fetch strategy of a source from its requires-browser flag and delegates.
 * Does not retry and does not touch source state.
 */
@Slf4j
@Component
public class FetchRouter {

    private final Map<FetchStrategy, PageFetcher> fetchers = new EnumMap<>(FetchStrategy.class);
    private final TrackerMetrics metrics;

    public FetchRouter(List<PageFetcher> pageFetchers, TrackerMetrics metrics) {
        for (PageFetcher fetcher : pageFetchers) {
            fetchers.put(fetcher.getStrategy(), fetcher);
        }
        this.metrics = metrics;
    }

    public Mono<RawContent> fetch(TrackedSource source) {
        String url = source.getUrl();
        if (!UrlUtils.isAbsoluteHttpUrl(url)) {
            return Mono.error(new FetchException(FetchException.Kind.INVALID_URL,
                    "Not an absolute http(s) URL: " + url));
        }
        FetchStrategy strategy = FetchStrategy.forSource(source.isRequiresBrowser());
        PageFetcher fetcher = fetchers.get(strategy);
        if (fetcher == null) {
            return Mono.error(new IllegalStateException("No page fetcher registered for " + strategy));
        }

        log.info("Fetching '{}' via {}: {}", source.getName(), strategy, url);
        return fetcher.fetch(url)
                .doOnNext(content -> metrics.recordFetchLatency(strategy, content.elapsed()));
    }
}
