package com.purchasingpower.studygraph.core;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Chunk as persisted in a user's partition together with its embedding.
 */
@Value
@Builder
public class StoredChunk {
    String id;
    String text;
    List<Double> embedding;
    String embeddingModel;
    String sourceHeading;
    int sequenceIndex;

    /**
     * Name-based id so re-ingesting the same text for the same user overwrites the stored chunk.
     */
    public static String idFor(String tenantId, String text) {
        return UUID.nameUUIDFromBytes((tenantId + ":" + text).getBytes(StandardCharsets.UTF_8)).toString();
    }

    public boolean hasEmbeddingFrom(String modelName, int dimension) {
        return embedding != null
                && !embedding.isEmpty()
                && embedding.size() == dimension
                && modelName != null
                && modelName.equals(embeddingModel);
    }
}
