package com.purchasingpower.studygraph.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One-hop neighborhood snapshot around a concept. Entities keep insertion order without duplicates.
 */
public class GraphContext {

    private final Set<Entity> entities = new LinkedHashSet<>();
    private final List<Relationship> relationships = new ArrayList<>();

    public static GraphContext empty() {
        return new GraphContext();
    }

    public void addEntity(Entity entity) {
        entities.add(entity);
    }

    public void addRelationship(Relationship relationship) {
        relationships.add(relationship);
    }

    public Set<Entity> getEntities() {
        return Collections.unmodifiableSet(entities);
    }

    public List<Relationship> getRelationships() {
        return Collections.unmodifiableList(relationships);
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }
}
