package dev.jobtracker.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Extraction through Groq Cloud (OpenAI-compatible chat completions).
 * Groq answers 429 when the per-minute token budget is spent; that surfaces as rate-limited.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "tracker.extraction.provider", havingValue = "groq")
public class GroqExtractionClient implements ExtractionClient {

  private static final String CHAT_PATH = "/chat/completions";

  private final WebClient webClient;
  private final String apiKey;
  private final String model;
  private final int maxRetries;

  public GroqExtractionClient(
      @Value("${app.ai.groq.api-key:}") String apiKey,
      @Value("${app.ai.groq.model:llama-3.3-70b-versatile}") String model,
      @Value("${app.ai.groq.base-url:https://api.groq.com/openai/v1}") String baseUrl,
      @Value("${app.ai.groq.max-retries:2}") int maxRetries) {

    this.apiKey = apiKey;
    this.model = model;
    this.maxRetries = maxRetries;
    this.webClient = WebClient.builder()
        .baseUrl(Objects.requireNonNull(baseUrl))
        .defaultHeader("Authorization", "Bearer " + apiKey)
        .defaultHeader("Content-Type", "application/json")
        .codecs(config -> config.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
        .build();

    if (apiKey == null || apiKey.isBlank()) {
      log.warn("Groq API Key is missing! Extraction will fail.");
    } else {
      log.info("Groq extraction enabled with model: {}", this.model);
    }
  }

  @Override
  public Mono<String> complete(String prompt) {
    if (!isConfigured()) {
      return Mono.error(new ExtractionException(ExtractionException.Kind.UPSTREAM_FAILURE,
          "Groq API key is not configured"));
    }

    GroqRequest request = new GroqRequest(model, List.of(new GroqRequest.Message("user", prompt)), 0.1, 8192);

    return webClient.post()
        .uri(CHAT_PATH)
        .bodyValue(request)
        .retrieve()
        .bodyToMono(GroqResponse.class)
        .retryWhen(Retry.backoff(maxRetries, Duration.ofSeconds(2))
            .filter(this::isRetryableError)
            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
        .map(this::extractContent)
        .onErrorMap(e -> !(e instanceof ExtractionException), this::translate);
  }

  @Override
  public String getName() {
    return "groq";
  }

  @Override
  public boolean isConfigured() {
    return apiKey != null && !apiKey.isBlank();
  }

  private String extractContent(GroqResponse response) {
    if (response != null && response.choices() != null && !response.choices().isEmpty()
        && response.choices().get(0).message() != null
        && response.choices().get(0).message().content() != null) {
      return response.choices().get(0).message().content();
    }
    throw new ExtractionException(ExtractionException.Kind.MALFORMED_RESPONSE, "Groq returned no message content");
  }

  private ExtractionException translate(Throwable e) {
    if (e instanceof WebClientResponseException wcre) {
      if (wcre.getStatusCode().value() == 429) {
        return new ExtractionException(ExtractionException.Kind.RATE_LIMITED, "Groq rate limit reached", e);
      }
      log.error("Groq API Error Body: {}", wcre.getResponseBodyAsString());
      return new ExtractionException(ExtractionException.Kind.UPSTREAM_FAILURE,
          "Groq returned HTTP " + wcre.getStatusCode().value(), e);
    }
    return new ExtractionException(ExtractionException.Kind.UPSTREAM_FAILURE, "Groq request failed: " + e.getMessage(), e);
  }

  private boolean isRetryableError(Throwable e) {
    return e instanceof WebClientResponseException wcre && wcre.getStatusCode().is5xxServerError();
  }

  record GroqRequest(String model, List<Message> messages, double temperature,
      @JsonProperty("max_tokens") int maxTokens) {
    record Message(String role, String content) {
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record GroqResponse(List<Choice> choices) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
      @JsonIgnoreProperties(ignoreUnknown = true)
      record Message(String content) {
      }
    }
  }
}
