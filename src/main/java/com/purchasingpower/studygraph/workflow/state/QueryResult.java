package com.purchasingpower.studygraph.workflow.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to one question. {@code success} is false when the concept is not in the user's graph;
 * that is a normal answer, not an error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {

    private String answer;
    private boolean success;
    private String concept;
    private ContextMetrics context;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContextMetrics {
        private int documentsFound;
        private int graphEntities;
        private int graphRelationships;
    }
}
