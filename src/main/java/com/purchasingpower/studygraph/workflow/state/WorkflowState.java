package com.purchasingpower.studygraph.workflow.state;

import com.purchasingpower.studygraph.core.GraphData;
import com.purchasingpower.studygraph.workflow.WorkflowNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * State of a single workflow run. A fresh instance is created per request and never reused.
 *
 * Input fields depend on the action:
 * <ul>
 *   <li>UPLOAD: fileData, filename</li>
 *   <li>QUERY: question</li>
 *   <li>VISUALIZE: none</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowState {

    private WorkflowAction action;
    private String userId;

    // ================================================================
    // UPLOAD
    // ================================================================

    @ToString.Exclude
    private byte[] fileData;
    private String filename;
    @ToString.Exclude
    private String extractedText;
    private String fileType;
    private IngestionResult processingResult;

    // ================================================================
    // QUERY
    // ================================================================

    private String question;
    private QueryResult queryResult;

    // ================================================================
    // VISUALIZE
    // ================================================================

    private GraphData graphData;

    // ================================================================
    // OUTCOME
    // ================================================================

    private String error;
    private boolean success;

    /**
     * Nodes visited, in order.
     */
    @Builder.Default
    private List<WorkflowNode> trail = new ArrayList<>();

    public boolean hasError() {
        return error != null && !error.isBlank();
    }
}
