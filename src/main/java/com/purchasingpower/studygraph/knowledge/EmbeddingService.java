package com.purchasingpower.studygraph.knowledge;

import java.util.List;

/**
 * Text embeddings for chunk storage and query-time similarity search.
 */
public interface EmbeddingService {

    /**
     * @param text non-empty text
     * @return embedding vector
     */
    List<Double> embed(String text);

    /**
     * Batch variant of {@link #embed(String)}.
     *
     * @return one vector per input, same order
     */
    List<List<Double>> embedAll(List<String> texts);

    /**
     * Name of the model producing the vectors. Stored alongside each chunk embedding.
     */
    String getModelName();
}
