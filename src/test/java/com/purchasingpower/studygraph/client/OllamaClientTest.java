package com.purchasingpower.studygraph.client;

import com.purchasingpower.studygraph.config.GlobalRetryConfig;
import com.purchasingpower.studygraph.configuration.OllamaProperties;
import com.purchasingpower.studygraph.exception.LlmCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OllamaClient")
class OllamaClientTest {

    private static final String CHAT_RESPONSE =
        "{\"model\":\"llama3.1:8b\",\"message\":{\"role\":\"assistant\",\"content\":\"Marketing Mix\"},\"done\":true}";

    private GlobalRetryConfig retryConfig;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        retryConfig = new GlobalRetryConfig();
        retryConfig.setMaxAttempts(2);
        retryConfig.setBackoffMs(1);
        retryConfig.setMaxBackoffMs(5);
        calls = new AtomicInteger();
    }

    private OllamaClient client(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder().baseUrl("http://ollama.test").exchangeFunction(exchange).build();
        return new OllamaClient(new OllamaProperties(), retryConfig, webClient);
    }

    private static Mono<ClientResponse> respond(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }

    @Test
    @DisplayName("Returns the assistant message content")
    void complete_shouldReturnMessageContent() {
        OllamaClient client = client(request -> {
            calls.incrementAndGet();
            assertThat(request.url().getPath()).isEqualTo("/api/chat");
            return respond(HttpStatus.OK, CHAT_RESPONSE);
        });

        assertThat(client.complete("Extract the concept", "concept-extractor")).isEqualTo("Marketing Mix");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Server errors are retried before succeeding")
    void complete_shouldRetryServerErrors() {
        OllamaClient client = client(request -> calls.incrementAndGet() == 1
            ? respond(HttpStatus.SERVICE_UNAVAILABLE, "{}")
            : respond(HttpStatus.OK, CHAT_RESPONSE));

        assertThat(client.complete("prompt", "answer-synthesizer")).isEqualTo("Marketing Mix");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Client errors fail immediately")
    void complete_shouldNotRetryClientErrors() {
        OllamaClient client = client(request -> {
            calls.incrementAndGet();
            return respond(HttpStatus.NOT_FOUND, "{\"error\":\"model not found\"}");
        });

        assertThatThrownBy(() -> client.complete("prompt", "kg-extractor"))
            .isInstanceOf(LlmCallException.class)
            .satisfies(e -> assertThat(((LlmCallException) e).getAgentName()).isEqualTo("kg-extractor"));
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Exhausted retries surface as a completion failure")
    void complete_shouldFailAfterRetriesExhausted() {
        OllamaClient client = client(request -> {
            calls.incrementAndGet();
            return respond(HttpStatus.INTERNAL_SERVER_ERROR, "{}");
        });

        assertThatThrownBy(() -> client.complete("prompt", "kg-extractor"))
            .isInstanceOf(LlmCallException.class);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Missing message content is a failure")
    void complete_withoutContent_shouldThrow() {
        OllamaClient client = client(request -> respond(HttpStatus.OK, "{\"done\":true}"));

        assertThatThrownBy(() -> client.complete("prompt", "kg-extractor"))
            .isInstanceOf(LlmCallException.class)
            .hasMessageContaining("no message content");
    }
}
