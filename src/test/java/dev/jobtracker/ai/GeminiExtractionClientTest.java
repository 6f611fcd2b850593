package dev.jobtracker.ai;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiExtractionClientTest {

    private static final String PATH = "/v1beta/models/%s:generateContent";

    private MockWebServer mockWebServer;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        baseUrl = mockWebServer.url("/").toString();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private GeminiExtractionClient client(String keys) {
        return new GeminiExtractionClient(keys, "gemini-2.5-flash-lite", baseUrl, PATH, 0);
    }

    private static MockResponse textResponse(String text) {
        return new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("""
                        {"candidates": [{"content": {"parts": [{"text": "%s"}]}, "finishReason": "STOP"}]}
                        """.formatted(text));
    }

    private static MockResponse status(int code, String body) {
        return new MockResponse()
                .setResponseCode(code)
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("Should parse comma separated keys and ignore blanks")
        void shouldParseKeys() {
            GeminiExtractionClient client = client(" key-1, ,key-2 ,");

            assertThat(client.isConfigured()).isTrue();
            assertThat(client.keyCount()).isEqualTo(2);
            assertThat(client.getName()).isEqualTo("gemini");
        }

        @Test
        @DisplayName("Should fail with UPSTREAM_FAILURE when no key is configured")
        void shouldFailWithoutKey() {
            GeminiExtractionClient client = client("");

            assertThat(client.isConfigured()).isFalse();
            StepVerifier.create(client.complete("prompt"))
                    .expectErrorSatisfies(e -> assertThat(((ExtractionException) e).getKind())
                            .isEqualTo(ExtractionException.Kind.UPSTREAM_FAILURE))
                    .verify();
            assertThat(mockWebServer.getRequestCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Completion")
    class CompletionTests {

        @Test
        @DisplayName("Should return the candidate text and send the model and key")
        void shouldReturnText() throws InterruptedException {
            mockWebServer.enqueue(textResponse("[{\\\"title\\\": \\\"Backend Engineer\\\"}]"));

            StepVerifier.create(client("key-1").complete("Extract jobs"))
                    .assertNext(text -> assertThat(text).isEqualTo("[{\"title\": \"Backend Engineer\"}]"))
                    .verifyComplete();

            RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
            assertThat(request).isNotNull();
            assertThat(request.getPath()).contains("gemini-2.5-flash-lite:generateContent").endsWith("key=key-1");
            assertThat(request.getBody().readUtf8()).contains("Extract jobs");
        }

        @Test
        @DisplayName("Should report MALFORMED_RESPONSE when there are no candidates")
        void shouldRejectEmptyCandidates() {
            mockWebServer.enqueue(status(200, "{\"candidates\": []}"));

            StepVerifier.create(client("key-1").complete("prompt"))
                    .expectErrorSatisfies(e -> assertThat(((ExtractionException) e).getKind())
                            .isEqualTo(ExtractionException.Kind.MALFORMED_RESPONSE))
                    .verify();
        }

        @Test
        @DisplayName("Should report UPSTREAM_FAILURE on server errors")
        void shouldMapServerError() {
            mockWebServer.enqueue(status(500, "{\"error\": \"internal\"}"));

            StepVerifier.create(client("key-1").complete("prompt"))
                    .expectErrorSatisfies(e -> assertThat(((ExtractionException) e).getKind())
                            .isEqualTo(ExtractionException.Kind.UPSTREAM_FAILURE))
                    .verify();
        }
    }

    @Nested
    @DisplayName("Rate limiting")
    class RateLimitTests {

        @Test
        @DisplayName("Should switch to the next key when one is throttled")
        void shouldRotateKeys() throws InterruptedException {
            mockWebServer.enqueue(status(429, "{\"error\": {\"status\": \"RESOURCE_EXHAUSTED\"}}"));
            mockWebServer.enqueue(textResponse("[]"));
            mockWebServer.enqueue(textResponse("[]"));
            GeminiExtractionClient client = client("key-1,key-2");

            StepVerifier.create(client.complete("prompt"))
                    .expectNext("[]")
                    .verifyComplete();
            StepVerifier.create(client.complete("prompt"))
                    .expectNext("[]")
                    .verifyComplete();

            assertThat(mockWebServer.takeRequest(1, TimeUnit.SECONDS).getPath()).endsWith("key=key-1");
            assertThat(mockWebServer.takeRequest(1, TimeUnit.SECONDS).getPath()).endsWith("key=key-2");
            // The key that worked is tried first next time
            assertThat(mockWebServer.takeRequest(1, TimeUnit.SECONDS).getPath()).endsWith("key=key-2");
        }

        @Test
        @DisplayName("Should report RATE_LIMITED when every key is throttled")
        void shouldReportRateLimitedWhenAllKeysThrottled() {
            mockWebServer.enqueue(status(429, "{}"));
            mockWebServer.enqueue(status(429, "{}"));

            StepVerifier.create(client("key-1,key-2").complete("prompt"))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(ExtractionException.class);
                        assertThat(((ExtractionException) e).isRateLimited()).isTrue();
                    })
                    .verify();

            assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should treat RESOURCE_EXHAUSTED bodies as rate limiting")
        void shouldDetectResourceExhaustedBody() {
            mockWebServer.enqueue(status(403, "{\"error\": {\"status\": \"RESOURCE_EXHAUSTED\"}}"));

            StepVerifier.create(client("key-1").complete("prompt"))
                    .expectErrorSatisfies(e -> assertThat(((ExtractionException) e).getKind())
                            .isEqualTo(ExtractionException.Kind.RATE_LIMITED))
                    .verify();
        }
    }
}
