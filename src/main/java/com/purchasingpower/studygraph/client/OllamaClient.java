package com.purchasingpower.studygraph.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.studygraph.config.GlobalRetryConfig;
import com.purchasingpower.studygraph.configuration.AppProperties;
import com.purchasingpower.studygraph.configuration.OllamaProperties;
import com.purchasingpower.studygraph.exception.LlmCallException;
import com.purchasingpower.studygraph.model.CallContext;
import com.purchasingpower.studygraph.model.ServiceType;
import com.purchasingpower.studygraph.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Completion backend talking to Ollama's {@code /api/chat} endpoint (non-streaming).
 */
@Slf4j
@Component
public class OllamaClient implements CompletionService {

    private final OllamaProperties ollama;
    private final GlobalRetryConfig retryConfig;
    private WebClient ollamaWebClient;

    @Autowired
    public OllamaClient(AppProperties appProperties, GlobalRetryConfig retryConfig) {
        this.ollama = appProperties.getOllama();
        this.retryConfig = retryConfig;
    }

    OllamaClient(OllamaProperties ollama, GlobalRetryConfig retryConfig, WebClient webClient) {
        this.ollama = ollama;
        this.retryConfig = retryConfig;
        this.ollamaWebClient = webClient;
    }

    @PostConstruct
    public void init() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(Duration.ofSeconds(ollama.getTimeoutSeconds()));

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(ollama.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
        log.info("🦙 Ollama completion client ready: {} at {}", ollama.getChatModel(), ollama.getBaseUrl());
    }

    @Override
    public String complete(String prompt, String agentName) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.OLLAMA_CHAT, "chat", agentName, log);
        call.logRequest(ExternalCallLogger.truncate(prompt, 500),
                "model", ollama.getChatModel(), "promptLength", prompt.length());

        Map<String, Object> body = Map.of(
                "model", ollama.getChatModel(),
                "messages", List.of(Map.of("role", "user", "content", prompt)),
                "stream", false,
                "options", Map.of(
                        "temperature", ollama.getTemperature(),
                        "num_ctx", ollama.getNumCtx(),
                        "num_predict", ollama.getMaxTokens()));

        JsonNode response;
        try {
            response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                    .retryWhen(buildRetrySpec(agentName))
                    .block();
        } catch (Exception e) {
            call.logError(e.getMessage(), e);
            throw new LlmCallException("Ollama call failed for model " + ollama.getChatModel()
                    + ": " + e.getMessage(), agentName, e);
        }

        if (response == null || !response.path("message").has("content")) {
            call.logError("Response carried no message content", null);
            throw new LlmCallException("Ollama returned no message content", agentName);
        }
        String content = response.path("message").path("content").asText();
        call.logResponse(ExternalCallLogger.truncate(content, 500), "responseLength", content.length());
        return content;
    }

    /**
     * Exponential backoff from {@code app.retry}; only transport failures, 429 and 5xx are retried.
     */
    private Retry buildRetrySpec(String agentName) {
        return Retry.backoff(retryConfig.getMaxAttempts(), retryConfig.initialBackoff())
                .maxBackoff(retryConfig.maxBackoff())
                .filter(this::isRetryable)
                .doBeforeRetry(signal -> log.warn("⚠️  Retrying Ollama call for {} (attempt {}): {}",
                        agentName, signal.totalRetries() + 1, signal.failure().getMessage()));
    }

    private boolean isRetryable(Throwable ex) {
        if (ex instanceof WebClientRequestException) {
            return true;
        }
        if (ex instanceof WebClientResponseException webEx) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return false;
    }
}
