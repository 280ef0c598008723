package com.purchasingpower.studygraph.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.studygraph.client.CompletionService;
import com.purchasingpower.studygraph.core.EntityType;
import com.purchasingpower.studygraph.core.RelationshipType;
import com.purchasingpower.studygraph.service.PromptLibraryService;
import com.purchasingpower.studygraph.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Asks the completion model for the entities and relationships in one chunk.
 *
 * <p>Failures are soft: a failed call or an unparsable reply is logged at WARN and the chunk
 * contributes nothing, so ingestion of the remaining chunks carries on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KnowledgeExtractor {

    static final String PROMPT_NAME = "kg-extraction";
    static final String AGENT_NAME = "kg-extractor";

    private static final List<String> ENTITY_TYPES = Arrays.stream(EntityType.values())
            .map(EntityType::value)
            .collect(Collectors.toList());
    private static final List<String> RELATIONSHIP_TYPES = Arrays.stream(RelationshipType.values())
            .map(RelationshipType::value)
            .collect(Collectors.toList());

    private final CompletionService completionService;
    private final PromptLibraryService promptLibrary;
    private final ExtractionSanitizer sanitizer;
    private final ObjectMapper objectMapper;

    public ExtractionResult extract(String chunkText, String userId) {
        String response = null;
        try {
            Map<String, Object> variables = new HashMap<>();
            variables.put("chunk", chunkText);
            variables.put("entityTypes", ENTITY_TYPES);
            variables.put("relationshipTypes", RELATIONSHIP_TYPES);
            variables.put("maxEntityWords", sanitizer.getMaxEntityWords());

            String prompt = promptLibrary.render(PROMPT_NAME, variables);
            response = completionService.complete(prompt, AGENT_NAME);

            JsonNode root = objectMapper.readTree(extractJson(response));
            ExtractionResult result = sanitizer.sanitize(root);
            log.debug("Extracted {} entities, {} relationships for user {}",
                    result.getEntities().size(), result.getRelationships().size(), userId);
            return result;
        } catch (Exception e) {
            log.warn("⚠️  KG extraction failed for user {}: {} | raw response: {}",
                    userId, e.getMessage(), ExternalCallLogger.truncate(response, 300));
            return ExtractionResult.empty();
        }
    }

    /**
     * Strips markdown fences and keeps the outermost {...} span.
     */
    static String extractJson(String response) {
        if (response == null) {
            throw new IllegalArgumentException("Empty completion response");
        }
        String content = response.replaceAll("```json\\s*", "").replaceAll("\\s*```", "").trim();
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start != -1 && end > start) {
            return content.substring(start, end + 1);
        }
        return content;
    }
}
