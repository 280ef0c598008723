package com.purchasingpower.studygraph.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.studygraph.core.Entity;
import com.purchasingpower.studygraph.core.EntityType;
import com.purchasingpower.studygraph.core.Relationship;
import com.purchasingpower.studygraph.core.RelationshipType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExtractionSanitizer")
class ExtractionSanitizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExtractionSanitizer sanitizer = new ExtractionSanitizer(6);

    @Test
    @DisplayName("Duplicate names keep the first occurrence and empty names are dropped")
    void entities_shouldKeepFirstOccurrence() throws Exception {
        // Given
        JsonNode items = objectMapper.readTree("""
            [
              {"name": "Promotion Mix", "type": "concept"},
              {"name": "Promotion Mix", "type": "framework"},
              {"name": "", "type": "concept"}
            ]
            """);

        // When
        List<Entity> entities = sanitizer.sanitizeEntities(items);

        // Then
        assertThat(entities).containsExactly(new Entity("Promotion Mix", EntityType.CONCEPT));
    }

    @Test
    @DisplayName("Unknown or missing entity types fall back to concept; matching ignores case")
    void entities_shouldCoerceTypes() throws Exception {
        JsonNode items = objectMapper.readTree("""
            [
              {"name": "Marketing Funnel", "type": "FRAMEWORK"},
              {"name": "Brand Equity", "type": "buzzword"},
              {"name": "Target Market"},
              "not an object",
              {"name": "  Market Research  ", "type": " step "}
            ]
            """);

        List<Entity> entities = sanitizer.sanitizeEntities(items);

        assertThat(entities).containsExactly(
            new Entity("Marketing Funnel", EntityType.FRAMEWORK),
            new Entity("Brand Equity", EntityType.CONCEPT),
            new Entity("Target Market", EntityType.CONCEPT),
            new Entity("Market Research", EntityType.STEP));
    }

    @Test
    @DisplayName("Names longer than the word limit are dropped; name matching is case-sensitive")
    void entities_shouldEnforceWordLimit() throws Exception {
        JsonNode items = objectMapper.readTree("""
            [
              {"name": "one two three four five six", "type": "concept"},
              {"name": "one two three four five six seven", "type": "concept"},
              {"name": "pricing", "type": "concept"},
              {"name": "Pricing", "type": "concept"}
            ]
            """);

        List<Entity> entities = sanitizer.sanitizeEntities(items);

        assertThat(entities).extracting(Entity::getName)
            .containsExactly("one two three four five six", "pricing", "Pricing");
    }

    @Test
    @DisplayName("Self-loops, unknown types and duplicate triples are removed from relationships")
    void relationships_shouldDropInvalidAndDuplicates() throws Exception {
        // Given
        JsonNode items = objectMapper.readTree("""
            [
              {"from": "A", "to": "A", "type": "part_of"},
              {"from": "A", "to": "B", "type": "bogus"},
              {"from": "A", "to": "B"},
              {"from": "", "to": "B", "type": "supports"},
              {"from": "A", "to": "B", "type": "supports"},
              {"from": "A", "to": "B", "type": "SUPPORTS"},
              {"from": "A", "to": "B", "type": "part_of"},
              42
            ]
            """);

        // When
        List<Relationship> relationships = sanitizer.sanitizeRelationships(items);

        // Then
        assertThat(relationships).containsExactly(
            new Relationship("A", "B", RelationshipType.SUPPORTS),
            new Relationship("A", "B", RelationshipType.PART_OF));
    }

    @Test
    @DisplayName("Missing arrays or a non-object root yield an empty result")
    void malformedRoot_shouldYieldEmpty() throws Exception {
        assertThat(sanitizer.sanitize(objectMapper.readTree("[]")).isEmpty()).isTrue();
        assertThat(sanitizer.sanitize(objectMapper.readTree("{\"entities\": \"none\"}")).isEmpty()).isTrue();
        assertThat(sanitizer.sanitize(null).isEmpty()).isTrue();
    }
}
