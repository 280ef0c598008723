package com.purchasingpower.studygraph.workflow;

/**
 * Outcome reported by a node handler; drives {@link WorkflowNode#next(WorkflowEvent)}.
 */
public enum WorkflowEvent {
    UPLOAD_REQUESTED,
    QUERY_REQUESTED,
    VISUALIZE_REQUESTED,
    REJECTED,
    COMPLETED,
    FAILED
}
