package com.purchasingpower.studygraph.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum RelationshipType {
    DEFINES("defines"),
    HAS_COMPONENT("has_component"),
    HAS_STEP("has_step"),
    PART_OF("part_of"),
    EXAMPLE_OF("example_of"),
    USED_IN("used_in"),
    SUPPORTS("supports"),
    OBJECTIVE_OF("objective_of"),
    CAUSE_OF("cause_of");

    private final String value;

    RelationshipType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Case-insensitive lookup; empty for unknown or missing values.
     */
    public static Optional<RelationshipType> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst();
    }
}
