package dev.jobtracker.ai;

import reactor.core.publisher.Mono;

/**
 * Text-to-structure capability backed by a hosted language model.
 * Implementations return the model's raw text and map provider errors to {@link ExtractionException}.
 */
public interface ExtractionClient {

    /**
     * Submit a prompt and return the model's text reply.
     */
    Mono<String> complete(String prompt);

    String getName();

    /**
     * @return true when credentials are present
     */
    boolean isConfigured();
}
