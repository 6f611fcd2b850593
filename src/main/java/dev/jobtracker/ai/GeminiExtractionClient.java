package dev.jobtracker.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extraction through the Google AI Studio (Gemini) REST API.
 * <p>
 * Several API keys may be configured, comma separated. A key that answers 429 is set aside for
 * the rest of the call and the next one is tried; the call is reported as rate-limited only when
 * every key is throttled. The last key that worked is tried first on the next call.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "tracker.extraction.provider", havingValue = "gemini", matchIfMissing = true)
public class GeminiExtractionClient implements ExtractionClient {

    private static final Duration RETRY_BACKOFF = Duration.ofSeconds(2);

    private final WebClient webClient;
    private final List<String> apiKeys;
    private final String model;
    private final String geminiPath;
    private final int maxRetries;
    private final AtomicInteger currentKey = new AtomicInteger(0);

    public GeminiExtractionClient(
            @Value("${app.ai.gemini.api-keys:}") String apiKeys,
            @Value("${app.ai.gemini.model:gemini-2.5-flash-lite}") String model,
            @Value("${app.ai.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.ai.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath,
            @Value("${app.ai.gemini.max-retries:2}") int maxRetries) {
        this.apiKeys = parseKeys(apiKeys);
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);
        this.maxRetries = maxRetries;

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .codecs(config -> config.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();

        if (this.apiKeys.isEmpty()) {
            log.warn("No Gemini API keys configured! Extraction will fail.");
        } else {
            log.info("Gemini extraction enabled with model: {} ({} key(s))", this.model, this.apiKeys.size());
        }
    }

    @Override
    public Mono<String> complete(String prompt) {
        if (apiKeys.isEmpty()) {
            return Mono.error(new ExtractionException(ExtractionException.Kind.UPSTREAM_FAILURE,
                    "Gemini API key is not configured"));
        }
        GeminiRequest request = buildRequest(prompt);
        int first = Math.floorMod(currentKey.get(), apiKeys.size());
        return attempt(request, first, 0);
    }

    private Mono<String> attempt(GeminiRequest request, int keyIndex, int tried) {
        String uri = String.format(geminiPath, model) + "?key=" + apiKeys.get(keyIndex);

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .retryWhen(Retry.backoff(maxRetries, RETRY_BACKOFF)
                        .filter(this::isRetryableError)
                        .doBeforeRetry(signal -> log.info("Retrying Gemini request (attempt {})",
                                signal.totalRetries() + 1))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnNext(response -> currentKey.set(keyIndex))
                .map(this::extractContent)
                .onErrorMap(e -> !(e instanceof ExtractionException), this::translate)
                .onErrorResume(ExtractionException.class, e -> {
                    if (e.isRateLimited() && tried + 1 < apiKeys.size()) {
                        int next = (keyIndex + 1) % apiKeys.size();
                        log.warn("Gemini key #{} is rate limited, switching to key #{}", keyIndex + 1, next + 1);
                        currentKey.set(next);
                        return attempt(request, next, tried + 1);
                    }
                    return Mono.error(e);
                });
    }

    @Override
    public String getName() {
        return "gemini";
    }

    @Override
    public boolean isConfigured() {
        return !apiKeys.isEmpty();
    }

    int keyCount() {
        return apiKeys.size();
    }

    private GeminiRequest buildRequest(String prompt) {
        return new GeminiRequest(List.of(
                new GeminiRequest.Content(List.of(
                        new GeminiRequest.Part(prompt)))),
                new GeminiRequest.GenerationConfig(0.1, 65536));
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED_RESPONSE,
                    "Gemini returned no candidates");
        }

        var candidate = response.candidates().get(0);
        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }

        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED_RESPONSE,
                    "Gemini candidate has no content parts (finish reason " + candidate.finishReason() + ")");
        }

        StringBuilder text = new StringBuilder();
        for (var part : candidate.content().parts()) {
            if (part.text() != null) {
                text.append(part.text());
            }
        }
        return text.toString();
    }

    private ExtractionException translate(Throwable e) {
        if (e instanceof WebClientResponseException wcre) {
            if (wcre.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                    || wcre.getResponseBodyAsString().contains("RESOURCE_EXHAUSTED")) {
                return new ExtractionException(ExtractionException.Kind.RATE_LIMITED,
                        "Gemini quota exhausted (HTTP " + wcre.getStatusCode().value() + ")", e);
            }
            return new ExtractionException(ExtractionException.Kind.UPSTREAM_FAILURE,
                    "Gemini returned HTTP " + wcre.getStatusCode().value(), e);
        }
        return new ExtractionException(ExtractionException.Kind.UPSTREAM_FAILURE,
                "Gemini request failed: " + e.getMessage(), e);
    }

    private boolean isRetryableError(Throwable e) {
        return e instanceof WebClientResponseException wcre && wcre.getStatusCode().is5xxServerError();
    }

    private static List<String> parseKeys(String apiKeys) {
        if (apiKeys == null || apiKeys.isBlank()) {
            return List.of();
        }
        return Arrays.stream(apiKeys.split(","))
                .map(String::trim)
                .filter(key -> !key.isEmpty())
                .toList();
    }

    // Request DTOs
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(
                Content content,
                String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
