package com.purchasingpower.studygraph.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.studygraph.configuration.AppProperties;
import com.purchasingpower.studygraph.core.Entity;
import com.purchasingpower.studygraph.core.EntityType;
import com.purchasingpower.studygraph.core.Relationship;
import com.purchasingpower.studygraph.core.RelationshipType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Validates the JSON the extraction model returns.
 *
 * <p>Entities: non-object items, blank names, names over the word limit and repeated names are
 * dropped; the first occurrence of a name wins and unknown types become {@code concept}.
 * Relationships: non-object items, blank endpoints, self-loops and missing or unknown types are
 * dropped; duplicates of the same (from, type, to) collapse to one.
 */
@Slf4j
@Component
public class ExtractionSanitizer {

    private final int maxEntityWords;

    @Autowired
    public ExtractionSanitizer(AppProperties appProperties) {
        this(appProperties.getExtraction().getMaxEntityWords());
    }

    public ExtractionSanitizer(int maxEntityWords) {
        this.maxEntityWords = maxEntityWords;
    }

    public int getMaxEntityWords() {
        return maxEntityWords;
    }

    public ExtractionResult sanitize(JsonNode root) {
        if (root == null || !root.isObject()) {
            return ExtractionResult.empty();
        }
        return new ExtractionResult(
                sanitizeEntities(root.path("entities")),
                sanitizeRelationships(root.path("relationships")));
    }

    public List<Entity> sanitizeEntities(JsonNode items) {
        List<Entity> cleaned = new ArrayList<>();
        if (!items.isArray()) {
            return cleaned;
        }
        Set<String> seen = new HashSet<>();
        for (JsonNode item : items) {
            if (!item.isObject()) {
                continue;
            }
            String name = text(item, "name");
            if (name.isEmpty() || wordCount(name) > maxEntityWords || !seen.add(name)) {
                continue;
            }
            EntityType type = EntityType.fromValue(text(item, "type")).orElse(EntityType.CONCEPT);
            cleaned.add(new Entity(name, type));
        }
        if (cleaned.size() < items.size()) {
            log.debug("Dropped {} of {} extracted entities", items.size() - cleaned.size(), items.size());
        }
        return cleaned;
    }

    public List<Relationship> sanitizeRelationships(JsonNode items) {
        if (!items.isArray()) {
            return new ArrayList<>();
        }
        Set<Relationship> cleaned = new LinkedHashSet<>();
        for (JsonNode item : items) {
            if (!item.isObject()) {
                continue;
            }
            String from = text(item, "from");
            String to = text(item, "to");
            if (from.isEmpty() || to.isEmpty() || from.equals(to)) {
                continue;
            }
            Optional<RelationshipType> type = RelationshipType.fromValue(text(item, "type"));
            if (type.isEmpty()) {
                continue;
            }
            cleaned.add(new Relationship(from, to, type.get()));
        }
        if (cleaned.size() < items.size()) {
            log.debug("Dropped {} of {} extracted relationships", items.size() - cleaned.size(), items.size());
        }
        return new ArrayList<>(cleaned);
    }

    private static String text(JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return "";
        }
        return value.asText().trim();
    }

    private static int wordCount(String name) {
        return name.split("\\s+").length;
    }
}
