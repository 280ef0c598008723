package com.purchasingpower.studygraph.query;

import com.purchasingpower.studygraph.configuration.AppProperties;
import com.purchasingpower.studygraph.core.StoredChunk;
import com.purchasingpower.studygraph.knowledge.EmbeddingService;
import com.purchasingpower.studygraph.knowledge.GraphStore;
import com.purchasingpower.studygraph.util.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Brute-force cosine ranking over one user's stored chunks.
 *
 * <p>Stored vectors are reused when they come from the active embedding model and have the query's
 * dimension. Any other chunk is re-embedded, all of them in a single batch call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VectorRetriever {

    private final GraphStore graphStore;
    private final EmbeddingService embeddingService;
    private final AppProperties appProperties;

    public List<VectorResult> search(String query, String userId) {
        return search(query, userId, appProperties.getRetrieval().getTopK());
    }

    /**
     * @return at most {@code topK} results above the similarity threshold, best first;
     *         equal scores keep stored chunk order
     */
    public List<VectorResult> search(String query, String userId, int topK) {
        List<StoredChunk> chunks = graphStore.listChunks(userId);
        if (chunks.isEmpty()) {
            log.debug("No stored chunks for user {}", userId);
            return List.of();
        }

        List<Double> queryVector = embeddingService.embed(query);
        List<List<Double>> vectors = resolveChunkVectors(chunks, queryVector.size());

        double threshold = appProperties.getRetrieval().getSimilarityThreshold();
        List<VectorResult> scored = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            double similarity = VectorMath.cosineSimilarity(queryVector, vectors.get(i));
            if (similarity > threshold) {
                scored.add(new VectorResult(chunks.get(i), similarity));
            }
        }

        // List.sort is stable
        scored.sort(Comparator.comparingDouble(VectorResult::getSimilarity).reversed());
        List<VectorResult> top = scored.stream().limit(Math.max(topK, 0)).collect(Collectors.toList());
        log.info("🔎 Vector search for user {}: {} chunks, {} above {}, returning {}",
                userId, chunks.size(), scored.size(), threshold, top.size());
        return top;
    }

    private List<List<Double>> resolveChunkVectors(List<StoredChunk> chunks, int dimension) {
        String activeModel = embeddingService.getModelName();
        List<List<Double>> vectors = new ArrayList<>(chunks.size());
        List<Integer> stale = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            StoredChunk chunk = chunks.get(i);
            if (chunk.hasEmbeddingFrom(activeModel, dimension)) {
                vectors.add(chunk.getEmbedding());
            } else {
                vectors.add(null);
                stale.add(i);
            }
        }
        if (!stale.isEmpty()) {
            log.info("Re-embedding {} chunks not produced by {}", stale.size(), activeModel);
            List<List<Double>> fresh = embeddingService.embedAll(
                    stale.stream().map(i -> chunks.get(i).getText()).collect(Collectors.toList()));
            for (int j = 0; j < stale.size(); j++) {
                vectors.set(stale.get(j), fresh.get(j));
            }
        }
        return vectors;
    }
}
