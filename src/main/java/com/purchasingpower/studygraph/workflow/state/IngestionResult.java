package com.purchasingpower.studygraph.workflow.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of ingesting one document into a user's graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {

    private boolean success;

    /**
     * Chunks that yielded at least one entity or relationship.
     */
    private int processedChunks;

    /**
     * Sanitized entities and relationships handed to the store.
     */
    private int totalEntities;
    private int totalRelationships;

    private int storedChunks;

    private long durationMs;

    public static IngestionResult nothingToIngest() {
        return IngestionResult.builder().success(false).build();
    }
}
