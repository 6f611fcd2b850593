package dev.jobtracker.fetch;

import dev.jobtracker.config.TrackerProperties;
import dev.jobtracker.model.FetchStrategy;
import dev.jobtracker.model.RawContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Plain HTTP fetch for static career pages.
 * Redirects are followed here rather than by the client so the final URL can be reported.
 */
@Slf4j
@Component
public class HttpPageFetcher implements PageFetcher {

    private final WebClient webClient;
    private final Duration timeout;
    private final int maxRedirects;

    public HttpPageFetcher(WebClient.Builder webClientBuilder, TrackerProperties properties) {
        TrackerProperties.Fetch fetch = properties.getFetch();
        HttpClient httpClient = HttpClient.create()
                .followRedirect(false)
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(fetch.getMaxInMemoryBytes()))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", fetch.getUserAgent())
                .defaultHeader("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .defaultHeader("Accept-Language", "en-US,en;q=0.5")
                .build();
        this.timeout = fetch.getTimeout();
        this.maxRedirects = fetch.getMaxRedirects();
    }

    @Override
    public FetchStrategy getStrategy() {
        return FetchStrategy.HTTP;
    }

    @Override
    public Mono<RawContent> fetch(String url) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return get(URI.create(url), 0)
                    .map(page -> new RawContent(page.body(), page.uri().toString(),
                            Duration.ofNanos(System.nanoTime() - start), FetchStrategy.HTTP));
        })
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof FetchException), e -> translate(e, url))
                .doOnNext(content -> log.debug("HTTP fetch of {} returned {} chars in {} ms",
                        url, content.html().length(), content.elapsed().toMillis()));
    }

    private Mono<Page> get(URI uri, int hop) {
        return webClient.get()
                .uri(uri)
                .exchangeToMono(response -> handle(uri, hop, response));
    }

    private Mono<Page> handle(URI uri, int hop, ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.is3xxRedirection()) {
            URI location = response.headers().asHttpHeaders().getLocation();
            if (location == null) {
                return response.releaseBody()
                        .then(Mono.error(FetchException.httpStatus(status.value(), uri.toString())));
            }
            if (hop >= maxRedirects) {
                return response.releaseBody()
                        .then(Mono.error(new FetchException(FetchException.Kind.HTTP_STATUS,
                                "Too many redirects (" + maxRedirects + ") from " + uri)));
            }
            URI next = uri.resolve(location);
            log.debug("Following redirect {} -> {}", uri, next);
            return response.releaseBody().then(Mono.defer(() -> get(next, hop + 1)));
        }
        if (!status.is2xxSuccessful()) {
            return response.releaseBody()
                    .then(Mono.error(FetchException.httpStatus(status.value(), uri.toString())));
        }
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new Page(uri, body));
    }

    private FetchException translate(Throwable e, String url) {
        if (e instanceof TimeoutException) {
            return new FetchException(FetchException.Kind.TIMEOUT,
                    "Timed out after " + timeout.toSeconds() + "s fetching " + url, e);
        }
        if (e instanceof WebClientRequestException) {
            return new FetchException(FetchException.Kind.NETWORK,
                    "Connection failed for " + url + ": " + e.getMessage(), e);
        }
        if (e instanceof DataBufferLimitException) {
            return new FetchException(FetchException.Kind.NETWORK, "Response from " + url + " exceeds buffer limit", e);
        }
        return new FetchException(FetchException.Kind.NETWORK, "Fetch of " + url + " failed: " + e.getMessage(), e);
    }

    private record Page(URI uri, String body) {
    }
}
