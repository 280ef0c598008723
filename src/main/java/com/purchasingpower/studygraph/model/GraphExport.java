package com.purchasingpower.studygraph.model;

import com.purchasingpower.studygraph.core.GraphData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Downloadable snapshot of a user's graph with summary statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphExport {

    private String userId;
    private String exportedAt;
    private Statistics statistics;
    private GraphData data;
    private boolean success;
    private String error;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Statistics {
        private int nodes;
        private int edges;
        /**
         * Node count per entity type, sorted by type.
         */
        private Map<String, Integer> nodeTypes;
    }
}
