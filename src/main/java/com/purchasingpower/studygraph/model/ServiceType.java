package com.purchasingpower.studygraph.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Backends reached over the network. A call that takes longer than {@code slowAfter} is reported
 * at WARN instead of INFO.
 */
@Getter
@RequiredArgsConstructor
public enum ServiceType {
    NEO4J("🟢", "Neo4j", Duration.ofSeconds(2)),
    OLLAMA_CHAT("🦙", "Ollama chat", Duration.ofSeconds(60)),
    OLLAMA_EMBEDDINGS("🧮", "Ollama embeddings", Duration.ofSeconds(10));

    private final String emoji;
    private final String displayName;
    private final Duration slowAfter;
}
