package com.purchasingpower.studygraph.knowledge.impl;

import com.purchasingpower.studygraph.configuration.AppProperties;
import com.purchasingpower.studygraph.configuration.OllamaProperties;
import com.purchasingpower.studygraph.exception.LlmCallException;
import com.purchasingpower.studygraph.knowledge.EmbeddingService;
import com.purchasingpower.studygraph.model.CallContext;
import com.purchasingpower.studygraph.model.ServiceType;
import com.purchasingpower.studygraph.util.ExternalCallLogger;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ollama embeddings through langchain4j. Timeout and retries are handled by the model client.
 */
@Slf4j
@Service
public class LangChain4jEmbeddingService implements EmbeddingService {

    private static final String AGENT_NAME = "embeddings";

    private final EmbeddingModel embeddingModel;
    private final String modelName;

    @Autowired
    public LangChain4jEmbeddingService(AppProperties appProperties) {
        OllamaProperties ollama = appProperties.getOllama();
        this.modelName = ollama.getEmbeddingModel();

        log.info("🔷 Initializing Ollama embedding model {} at {} (timeout {}s, retries {})",
                modelName, ollama.getBaseUrl(), ollama.getTimeoutSeconds(), ollama.getMaxRetries());

        this.embeddingModel = OllamaEmbeddingModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(modelName)
                .timeout(Duration.ofSeconds(ollama.getTimeoutSeconds()))
                .maxRetries(ollama.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    LangChain4jEmbeddingService(EmbeddingModel embeddingModel, String modelName) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
    }

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }

        CallContext call = ExternalCallLogger.startCall(ServiceType.OLLAMA_EMBEDDINGS, "embed", modelName, log);
        call.logRequest(ExternalCallLogger.truncate(text, 200), "chars", text.length());
        try {
            Response<Embedding> response = embeddingModel.embed(text);
            List<Double> vector = toDoubleList(response.content());
            call.logResponse(null, "dimensions", vector.size());
            return vector;
        } catch (Exception e) {
            call.logError(e.getMessage(), e);
            throw new LlmCallException("Embedding failed: " + e.getMessage(), AGENT_NAME, e);
        }
    }

    @Override
    public List<List<Double>> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        List<TextSegment> segments = texts.stream()
                .map(TextSegment::from)
                .collect(Collectors.toList());

        CallContext call = ExternalCallLogger.startCall(ServiceType.OLLAMA_EMBEDDINGS, "embedAll", modelName, log);
        call.logRequest(texts.size() + " texts");
        try {
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<List<Double>> vectors = response.content().stream()
                    .map(this::toDoubleList)
                    .collect(Collectors.toList());
            if (vectors.size() != texts.size()) {
                throw new IllegalStateException(
                        "Expected " + texts.size() + " embeddings but got " + vectors.size());
            }
            call.logResponse(vectors.size() + " embeddings");
            return vectors;
        } catch (Exception e) {
            call.logError(e.getMessage(), e);
            throw new LlmCallException("Batch embedding failed: " + e.getMessage(), AGENT_NAME, e);
        }
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    private List<Double> toDoubleList(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Double> result = new ArrayList<>(vector.length);
        for (float value : vector) {
            result.add((double) value);
        }
        return result;
    }
}
