package com.purchasingpower.studygraph.ingest;

import com.purchasingpower.studygraph.core.Entity;
import com.purchasingpower.studygraph.core.Relationship;
import lombok.Value;

import java.util.List;

/**
 * Sanitized entities and relationships extracted from one chunk.
 */
@Value
public class ExtractionResult {
    List<Entity> entities;
    List<Relationship> relationships;

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relationships.isEmpty();
    }
}
