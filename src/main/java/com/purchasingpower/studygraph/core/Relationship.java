package com.purchasingpower.studygraph.core;

import lombok.NonNull;
import lombok.Value;

/**
 * Directed, typed edge between two entity names. Identity is the (from, type, to) triple.
 */
@Value
public class Relationship {
    @NonNull String from;
    @NonNull String to;
    @NonNull RelationshipType type;

    /**
     * "from type to", as shown to the answer model.
     */
    public String render() {
        return from + " " + type.value() + " " + to;
    }
}
