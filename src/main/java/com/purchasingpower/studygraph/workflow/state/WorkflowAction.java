package com.purchasingpower.studygraph.workflow.state;

public enum WorkflowAction {
    UPLOAD,
    QUERY,
    VISUALIZE
}
