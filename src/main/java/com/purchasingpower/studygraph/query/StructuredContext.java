package com.purchasingpower.studygraph.query;

import lombok.Value;

import java.util.List;

/**
 * Prompt-ready context: concept names, rendered relationships and document excerpts.
 */
@Value
public class StructuredContext {
    List<String> concepts;
    List<String> relationships;
    List<String> documents;

    public boolean isEmpty() {
        return concepts.isEmpty() && relationships.isEmpty() && documents.isEmpty();
    }
}
