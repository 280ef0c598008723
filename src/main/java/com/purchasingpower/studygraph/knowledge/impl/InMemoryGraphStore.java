package com.purchasingpower.studygraph.knowledge.impl;

import com.purchasingpower.studygraph.core.Entity;
import com.purchasingpower.studygraph.core.EntityType;
import com.purchasingpower.studygraph.core.GraphContext;
import com.purchasingpower.studygraph.core.GraphData;
import com.purchasingpower.studygraph.core.Relationship;
import com.purchasingpower.studygraph.core.StoredChunk;
import com.purchasingpower.studygraph.knowledge.GraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Heap-backed {@link GraphStore} for local runs and tests. Contents are lost on restart.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.graph.store", havingValue = "memory")
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, Partition> partitions = new ConcurrentHashMap<>();

    private static class Partition {
        final Map<String, EntityType> entities = new LinkedHashMap<>();
        final Set<Relationship> relationships = new LinkedHashSet<>();
        final Map<String, StoredChunk> chunks = new LinkedHashMap<>();
    }

    @Override
    public void ensurePartition(String tenantId) {
        partitions.computeIfAbsent(tenantId, id -> {
            log.info("Created in-memory partition for tenant {}", id);
            return new Partition();
        });
    }

    @Override
    public void deletePartition(String tenantId) {
        if (partitions.remove(tenantId) != null) {
            log.info("Deleted in-memory partition for tenant {}", tenantId);
        }
    }

    @Override
    public int upsertEntities(List<Entity> entities, String tenantId) {
        Partition partition = partition(tenantId);
        synchronized (partition) {
            entities.forEach(e -> partition.entities.put(e.getName(), e.getType()));
        }
        return entities.size();
    }

    @Override
    public int upsertRelationships(List<Relationship> relationships, String tenantId) {
        Partition partition = partition(tenantId);
        int persisted = 0;
        synchronized (partition) {
            for (Relationship relationship : relationships) {
                if (!partition.entities.containsKey(relationship.getFrom())
                        || !partition.entities.containsKey(relationship.getTo())) {
                    continue;
                }
                partition.relationships.add(relationship);
                persisted++;
            }
        }
        return persisted;
    }

    @Override
    public GraphContext getNeighborhood(String conceptName, String tenantId) {
        GraphContext context = GraphContext.empty();
        Partition partition = partitions.get(tenantId);
        if (partition == null || conceptName == null) {
            return context;
        }
        synchronized (partition) {
            EntityType centerType = partition.entities.get(conceptName);
            if (centerType == null) {
                return context;
            }
            context.addEntity(new Entity(conceptName, centerType));
            for (Relationship relationship : partition.relationships) {
                if (relationship.getFrom().equals(conceptName)) {
                    context.addEntity(new Entity(relationship.getTo(), partition.entities.get(relationship.getTo())));
                    context.addRelationship(relationship);
                }
            }
        }
        return context;
    }

    @Override
    public long countEntities(String tenantId) {
        Partition partition = partitions.get(tenantId);
        return partition == null ? 0 : partition.entities.size();
    }

    @Override
    public long countRelationships(String tenantId) {
        Partition partition = partitions.get(tenantId);
        return partition == null ? 0 : partition.relationships.size();
    }

    @Override
    public void upsertChunk(StoredChunk chunk, String tenantId) {
        Partition partition = partition(tenantId);
        synchronized (partition) {
            partition.chunks.put(chunk.getId(), chunk);
        }
    }

    @Override
    public List<StoredChunk> listChunks(String tenantId) {
        Partition partition = partitions.get(tenantId);
        if (partition == null) {
            return List.of();
        }
        synchronized (partition) {
            return partition.chunks.values().stream()
                    .sorted(Comparator.comparingInt(StoredChunk::getSequenceIndex).thenComparing(StoredChunk::getId))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public GraphData exportGraph(String tenantId) {
        GraphData data = GraphData.builder().build();
        Partition partition = partitions.get(tenantId);
        if (partition == null) {
            return data;
        }
        synchronized (partition) {
            partition.entities.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> data.getNodes().add(new GraphData.Node(e.getKey(), e.getKey(), e.getValue().value())));
            List<Relationship> edges = new ArrayList<>(partition.relationships);
            edges.sort(Comparator.comparing(Relationship::getFrom)
                    .thenComparing(r -> r.getType().value())
                    .thenComparing(Relationship::getTo));
            edges.forEach(r -> data.getEdges().add(new GraphData.Edge(r.getFrom(), r.getTo(), r.getType().value())));
        }
        return data;
    }

    private Partition partition(String tenantId) {
        return partitions.computeIfAbsent(tenantId, id -> new Partition());
    }
}
