package com.purchasingpower.studygraph.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Node types an extracted entity may carry. Stored and prompted in their lower-case form.
 */
public enum EntityType {
    CONCEPT("concept"),
    FRAMEWORK("framework"),
    DEFINITION("definition"),
    LEARNING_OBJECTIVE("learning_objective"),
    ORGANIZATION("organization"),
    EXAMPLE("example"),
    PROCESS("process"),
    STEP("step");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<EntityType> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst();
    }
}
