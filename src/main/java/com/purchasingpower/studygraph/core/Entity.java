package com.purchasingpower.studygraph.core;

import lombok.NonNull;
import lombok.Value;

/**
 * A named, typed node in one user's knowledge graph. Names are unique per user.
 */
@Value
public class Entity {
    @NonNull String name;
    @NonNull EntityType type;
}
