package com.purchasingpower.studygraph.knowledge.impl;

import com.purchasingpower.studygraph.config.GlobalRetryConfig;
import com.purchasingpower.studygraph.core.Entity;
import com.purchasingpower.studygraph.core.EntityType;
import com.purchasingpower.studygraph.core.GraphContext;
import com.purchasingpower.studygraph.core.GraphData;
import com.purchasingpower.studygraph.core.Relationship;
import com.purchasingpower.studygraph.core.RelationshipType;
import com.purchasingpower.studygraph.core.StoredChunk;
import com.purchasingpower.studygraph.exception.GraphStoreException;
import com.purchasingpower.studygraph.knowledge.GraphStore;
import com.purchasingpower.studygraph.model.CallContext;
import com.purchasingpower.studygraph.model.ServiceType;
import com.purchasingpower.studygraph.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionCallback;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Neo4j implementation of {@link GraphStore}.
 *
 * <p>Schema: {@code (:User {id})}, {@code (:Entity {tenantId, name, type})},
 * {@code (:Chunk {tenantId, id, text, embedding, embeddingModel, sourceHeading, sequenceIndex})} and
 * {@code [:RELATES {tenantId, type}]} between entities. The tenant id only ever travels as a parameter.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.graph.store", havingValue = "neo4j", matchIfMissing = true)
public class Neo4jGraphStoreImpl implements GraphStore {

    private final GlobalRetryConfig retryConfig;

    @Value("${neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @Value("${neo4j.username:neo4j}")
    private String neo4jUsername;

    @Value("${neo4j.password:password}")
    private String neo4jPassword;

    @Value("${neo4j.connection-timeout-seconds:15}")
    private int connectionTimeoutSeconds;

    private Driver driver;

    @Autowired
    public Neo4jGraphStoreImpl(GlobalRetryConfig retryConfig) {
        this.retryConfig = retryConfig;
    }

    Neo4jGraphStoreImpl(GlobalRetryConfig retryConfig, Driver driver) {
        this.retryConfig = retryConfig;
        this.driver = driver;
    }

    @PostConstruct
    public void init() {
        long retryBudgetMs = retryConfig.transactionRetryBudget().toMillis();
        log.info("Initializing Neo4j GraphStore at: {} (tx retry budget {}ms)", neo4jUri, retryBudgetMs);

        Config config = Config.builder()
                .withConnectionTimeout(connectionTimeoutSeconds, TimeUnit.SECONDS)
                .withMaxTransactionRetryTime(retryBudgetMs, TimeUnit.MILLISECONDS)
                .build();
        driver = GraphDatabase.driver(neo4jUri, AuthTokens.basic(neo4jUsername, neo4jPassword), config);
        createIndexes();
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j GraphStore connection closed");
        }
    }

    private void createIndexes() {
        try (Session session = driver.session()) {
            session.run("CREATE INDEX user_id IF NOT EXISTS FOR (u:User) ON (u.id)");
            session.run("CREATE INDEX entity_tenant_name IF NOT EXISTS FOR (e:Entity) ON (e.tenantId, e.name)");
            session.run("CREATE INDEX chunk_tenant_id IF NOT EXISTS FOR (c:Chunk) ON (c.tenantId, c.id)");
            log.info("✅ Neo4j property indexes created");
        } catch (Exception e) {
            // Neo4j may still be starting; queries work without the indexes, only slower.
            log.warn("⚠️  Failed to create indexes: {}", e.getMessage());
        }
    }

    // =========================================================================
    // Partition Operations
    // =========================================================================

    @Override
    public void ensurePartition(String tenantId) {
        write("ensurePartition", tenantId, tx -> {
            tx.run("MERGE (u:User {id: $tenantId})", Map.of("tenantId", tenantId));
            return null;
        });
    }

    @Override
    public void deletePartition(String tenantId) {
        String cypher = """
            MATCH (n)
            WHERE (n:Entity OR n:Chunk) AND n.tenantId = $tenantId
            DETACH DELETE n
            """;
        write("deletePartition", tenantId, tx -> {
            tx.run(cypher, Map.of("tenantId", tenantId));
            tx.run("MATCH (u:User {id: $tenantId}) DETACH DELETE u", Map.of("tenantId", tenantId));
            return null;
        });
    }

    // =========================================================================
    // Entity / Relationship Operations
    // =========================================================================

    @Override
    public int upsertEntities(List<Entity> entities, String tenantId) {
        if (entities.isEmpty()) {
            return 0;
        }
        String cypher = """
            UNWIND $entities AS entity
            MERGE (e:Entity {tenantId: $tenantId, name: entity.name})
            SET e.type = entity.type
            RETURN count(e) AS written
            """;
        List<Map<String, Object>> rows = entities.stream()
                .map(e -> createParams("name", e.getName(), "type", e.getType().value()))
                .collect(Collectors.toList());

        return write("upsertEntities", tenantId, tx -> {
            Result result = tx.run(cypher, createParams("tenantId", tenantId, "entities", rows));
            return result.single().get("written").asInt();
        });
    }

    @Override
    public int upsertRelationships(List<Relationship> relationships, String tenantId) {
        if (relationships.isEmpty()) {
            return 0;
        }
        // MATCH drops rows whose endpoints are missing, so only complete edges are merged.
        String cypher = """
            UNWIND $relationships AS rel
            MATCH (a:Entity {tenantId: $tenantId, name: rel.from})
            MATCH (b:Entity {tenantId: $tenantId, name: rel.to})
            MERGE (a)-[r:RELATES {tenantId: $tenantId, type: rel.type}]->(b)
            RETURN count(r) AS persisted
            """;
        List<Map<String, Object>> rows = relationships.stream()
                .map(r -> createParams("from", r.getFrom(), "to", r.getTo(), "type", r.getType().value()))
                .collect(Collectors.toList());

        int persisted = write("upsertRelationships", tenantId, tx -> {
            Result result = tx.run(cypher, createParams("tenantId", tenantId, "relationships", rows));
            return result.single().get("persisted").asInt();
        });
        if (persisted < relationships.size()) {
            log.debug("Skipped {} relationships with missing endpoints for tenant {}",
                    relationships.size() - persisted, tenantId);
        }
        return persisted;
    }

    @Override
    public GraphContext getNeighborhood(String conceptName, String tenantId) {
        String cypher = """
            MATCH (c:Entity {tenantId: $tenantId, name: $name})
            OPTIONAL MATCH (c)-[r:RELATES {tenantId: $tenantId}]->(n:Entity {tenantId: $tenantId})
            RETURN c.name AS centerName, c.type AS centerType,
                   r.type AS relType, n.name AS neighborName, n.type AS neighborType
            """;

        return read("getNeighborhood", tenantId, tx -> {
            Result result = tx.run(cypher, createParams("tenantId", tenantId, "name", conceptName));
            GraphContext context = GraphContext.empty();
            while (result.hasNext()) {
                Record row = result.next();
                context.addEntity(new Entity(row.get("centerName").asString(),
                        parseEntityType(stringOrNull(row, "centerType"))));
                String neighborName = stringOrNull(row, "neighborName");
                if (neighborName == null) {
                    continue;
                }
                context.addEntity(new Entity(neighborName, parseEntityType(stringOrNull(row, "neighborType"))));
                RelationshipType.fromValue(stringOrNull(row, "relType"))
                        .ifPresent(type -> context.addRelationship(
                                new Relationship(row.get("centerName").asString(), neighborName, type)));
            }
            return context;
        });
    }

    @Override
    public long countEntities(String tenantId) {
        return read("countEntities", tenantId, tx -> tx
                .run("MATCH (e:Entity {tenantId: $tenantId}) RETURN count(e) AS total", Map.of("tenantId", tenantId))
                .single().get("total").asLong());
    }

    @Override
    public long countRelationships(String tenantId) {
        String cypher = "MATCH (:Entity {tenantId: $tenantId})-[r:RELATES {tenantId: $tenantId}]->() "
                + "RETURN count(r) AS total";
        return read("countRelationships", tenantId, tx -> tx
                .run(cypher, Map.of("tenantId", tenantId))
                .single().get("total").asLong());
    }

    // =========================================================================
    // Chunk Operations
    // =========================================================================

    @Override
    public void upsertChunk(StoredChunk chunk, String tenantId) {
        String cypher = """
            MERGE (c:Chunk {tenantId: $tenantId, id: $id})
            SET c.text = $text,
                c.embedding = $embedding,
                c.embeddingModel = $embeddingModel,
                c.sourceHeading = $sourceHeading,
                c.sequenceIndex = $sequenceIndex
            """;
        write("upsertChunk", tenantId, tx -> {
            tx.run(cypher, createParams(
                    "tenantId", tenantId,
                    "id", chunk.getId(),
                    "text", chunk.getText(),
                    "embedding", chunk.getEmbedding(),
                    "embeddingModel", chunk.getEmbeddingModel(),
                    "sourceHeading", chunk.getSourceHeading(),
                    "sequenceIndex", chunk.getSequenceIndex()));
            return null;
        });
    }

    @Override
    public List<StoredChunk> listChunks(String tenantId) {
        String cypher = """
            MATCH (c:Chunk {tenantId: $tenantId})
            RETURN c
            ORDER BY c.sequenceIndex, c.id
            """;
        return read("listChunks", tenantId, tx -> {
            Result result = tx.run(cypher, Map.of("tenantId", tenantId));
            List<StoredChunk> chunks = new ArrayList<>();
            while (result.hasNext()) {
                chunks.add(recordToChunk(result.next()));
            }
            return chunks;
        });
    }

    // =========================================================================
    // Export
    // =========================================================================

    @Override
    public GraphData exportGraph(String tenantId) {
        String nodesCypher = """
            MATCH (e:Entity {tenantId: $tenantId})
            RETURN e.name AS name, e.type AS type
            ORDER BY e.name
            """;
        String edgesCypher = """
            MATCH (a:Entity {tenantId: $tenantId})-[r:RELATES {tenantId: $tenantId}]->(b:Entity {tenantId: $tenantId})
            RETURN a.name AS source, r.type AS type, b.name AS target
            ORDER BY source, type, target
            """;

        return read("exportGraph", tenantId, tx -> {
            GraphData data = GraphData.builder().build();
            Result nodes = tx.run(nodesCypher, Map.of("tenantId", tenantId));
            while (nodes.hasNext()) {
                Record row = nodes.next();
                String name = row.get("name").asString();
                data.getNodes().add(new GraphData.Node(name, name, stringOrNull(row, "type")));
            }
            Result edges = tx.run(edgesCypher, Map.of("tenantId", tenantId));
            while (edges.hasNext()) {
                Record row = edges.next();
                data.getEdges().add(new GraphData.Edge(
                        row.get("source").asString(), row.get("target").asString(), stringOrNull(row, "type")));
            }
            return data;
        });
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private <T> T read(String operation, String tenantId, TransactionCallback<T> work) {
        return execute(operation, tenantId, false, work);
    }

    private <T> T write(String operation, String tenantId, TransactionCallback<T> work) {
        return execute(operation, tenantId, true, work);
    }

    private <T> T execute(String operation, String tenantId, boolean write, TransactionCallback<T> work) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.NEO4J, operation, tenantId, log);
        call.logRequest(null);
        try (Session session = driver.session()) {
            T result = write ? session.executeWrite(work) : session.executeRead(work);
            call.logResponse(null);
            return result;
        } catch (Exception e) {
            call.logError(e.getMessage(), e);
            throw new GraphStoreException("Neo4j " + operation + " failed: " + e.getMessage(), tenantId, e);
        }
    }

    private Map<String, Object> createParams(Object... keyValues) {
        // HashMap rather than Map.of: values such as sourceHeading may be null.
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    private StoredChunk recordToChunk(Record record) {
        org.neo4j.driver.types.Node node = record.get("c").asNode();
        List<Double> embedding = node.get("embedding").isNull()
                ? List.of()
                : node.get("embedding").asList(v -> v.asDouble());
        return StoredChunk.builder()
                .id(node.get("id").asString())
                .text(node.get("text").asString())
                .embedding(embedding)
                .embeddingModel(node.get("embeddingModel").isNull() ? null : node.get("embeddingModel").asString())
                .sourceHeading(node.get("sourceHeading").isNull() ? null : node.get("sourceHeading").asString())
                .sequenceIndex(node.get("sequenceIndex").isNull() ? 0 : node.get("sequenceIndex").asInt())
                .build();
    }

    private String stringOrNull(Record record, String key) {
        return record.get(key).isNull() ? null : record.get(key).asString();
    }

    private EntityType parseEntityType(String value) {
        return EntityType.fromValue(value).orElse(EntityType.CONCEPT);
    }
}
