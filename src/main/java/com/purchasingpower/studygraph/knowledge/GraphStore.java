package com.purchasingpower.studygraph.knowledge;

import com.purchasingpower.studygraph.core.Entity;
import com.purchasingpower.studygraph.core.GraphContext;
import com.purchasingpower.studygraph.core.GraphData;
import com.purchasingpower.studygraph.core.Relationship;
import com.purchasingpower.studygraph.core.StoredChunk;

import java.util.List;

/**
 * Per-user knowledge graph storage.
 *
 * <p>Every operation is scoped by a tenant id (the user id). Implementations keep tenants apart
 * by a {@code tenantId} property bound as a query parameter, never by building identifiers from it.
 * Failures surface as {@link com.purchasingpower.studygraph.exception.GraphStoreException}.
 */
public interface GraphStore {

    // =========================================================================
    // Partition Operations
    // =========================================================================

    /**
     * Create the user's partition if it does not exist yet. Idempotent.
     */
    void ensurePartition(String tenantId);

    /**
     * Remove every entity, relationship and chunk of the user.
     */
    void deletePartition(String tenantId);

    // =========================================================================
    // Entity / Relationship Operations
    // =========================================================================

    /**
     * Upsert entities by name. An existing entity gets its type overwritten.
     *
     * @return number of entities written
     */
    int upsertEntities(List<Entity> entities, String tenantId);

    /**
     * Upsert relationships keyed by (from, type, to). A relationship whose endpoints are not
     * both present in the partition is skipped.
     *
     * @return number of relationships that were actually persisted
     */
    int upsertRelationships(List<Relationship> relationships, String tenantId);

    /**
     * The named entity plus its outgoing one-hop neighbors. Empty when the entity does not exist.
     */
    GraphContext getNeighborhood(String conceptName, String tenantId);

    long countEntities(String tenantId);

    long countRelationships(String tenantId);

    // =========================================================================
    // Chunk Operations
    // =========================================================================

    void upsertChunk(StoredChunk chunk, String tenantId);

    /**
     * All chunks of the user, ordered by sequence index then id.
     */
    List<StoredChunk> listChunks(String tenantId);

    // =========================================================================
    // Export
    // =========================================================================

    GraphData exportGraph(String tenantId);
}
