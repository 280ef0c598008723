package com.purchasingpower.studygraph.ingest;

import com.purchasingpower.studygraph.configuration.AppProperties;
import com.purchasingpower.studygraph.core.Chunk;
import com.purchasingpower.studygraph.core.StoredChunk;
import com.purchasingpower.studygraph.knowledge.EmbeddingService;
import com.purchasingpower.studygraph.knowledge.GraphStore;
import com.purchasingpower.studygraph.workflow.state.IngestionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Chunks a document, extracts knowledge per chunk and writes it to the user's partition.
 *
 * <p>Chunks are processed in order and each chunk's writes land immediately, so a failure
 * part-way through keeps everything written before it. Upserts are idempotent, which makes
 * re-running the same document safe.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private final SemanticChunker chunker;
    private final KnowledgeExtractor extractor;
    private final GraphStore graphStore;
    private final EmbeddingService embeddingService;
    private final AppProperties appProperties;

    public IngestionResult ingest(String text, String userId) {
        List<Chunk> chunks = chunker.split(text, appProperties.getChunking().getMaxChars());
        if (chunks.isEmpty()) {
            log.info("No chunks produced for user {}; nothing to ingest", userId);
            return IngestionResult.nothingToIngest();
        }
        log.info("📚 Chunked document for user {} into {} chunks", userId, chunks.size());
        return processChunks(chunks, userId);
    }

    /**
     * @throws CancellationException when the calling thread is interrupted between chunks
     */
    public IngestionResult processChunks(List<Chunk> chunks, String userId) {
        long start = System.currentTimeMillis();
        graphStore.ensurePartition(userId);

        List<Chunk> nonBlank = chunks.stream()
                .filter(c -> c.getText() != null && !c.getText().isBlank())
                .collect(Collectors.toList());
        List<List<Double>> embeddings = embeddingService.embedAll(
                nonBlank.stream().map(Chunk::getText).collect(Collectors.toList()));
        String embeddingModel = embeddingService.getModelName();

        int processed = 0;
        int totalEntities = 0;
        int totalRelationships = 0;
        int stored = 0;

        for (int i = 0; i < nonBlank.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Ingestion for user {} cancelled after {} of {} chunks", userId, i, nonBlank.size());
                throw new CancellationException("Ingestion cancelled after " + i + " chunks");
            }
            Chunk chunk = nonBlank.get(i);
            log.info("Processing chunk {}/{} ({} chars)", i + 1, nonBlank.size(), chunk.getText().length());

            ExtractionResult extraction = extractor.extract(chunk.getText(), userId);
            if (!extraction.isEmpty()) {
                graphStore.upsertEntities(extraction.getEntities(), userId);
                graphStore.upsertRelationships(extraction.getRelationships(), userId);
                totalEntities += extraction.getEntities().size();
                totalRelationships += extraction.getRelationships().size();
                processed++;
            }

            graphStore.upsertChunk(StoredChunk.builder()
                    .id(StoredChunk.idFor(userId, chunk.getText()))
                    .text(chunk.getText())
                    .embedding(embeddings.get(i))
                    .embeddingModel(embeddingModel)
                    .sourceHeading(chunk.getSourceHeading())
                    .sequenceIndex(chunk.getSequenceIndex())
                    .build(), userId);
            stored++;
        }

        long duration = System.currentTimeMillis() - start;
        log.info("✅ Ingested {} chunks for user {}: {} processed, {} entities, {} relationships ({}ms)",
                stored, userId, processed, totalEntities, totalRelationships, duration);

        return IngestionResult.builder()
                .success(true)
                .processedChunks(processed)
                .totalEntities(totalEntities)
                .totalRelationships(totalRelationships)
                .storedChunks(stored)
                .durationMs(duration)
                .build();
    }
}
