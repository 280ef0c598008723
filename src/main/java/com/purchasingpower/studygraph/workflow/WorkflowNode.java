package com.purchasingpower.studygraph.workflow;

/**
 * Nodes of the request workflow.
 *
 * <pre>
 * ROUTE ──upload──▶ UPLOAD ──▶ EXTRACT ──▶ END
 *   │  ──query───▶ QUERY ──────────────▶ END
 *   │  ──visualize▶ VISUALIZE ─────────▶ END
 *   └──rejected──▶ ERROR ──────────────▶ END
 * </pre>
 * Any node except END moves to ERROR on {@link WorkflowEvent#FAILED}.
 */
public enum WorkflowNode {
    ROUTE,
    UPLOAD,
    EXTRACT,
    QUERY,
    VISUALIZE,
    ERROR,
    END;

    /**
     * Pure transition function.
     *
     * @throws IllegalStateException for an event the node does not accept
     */
    public WorkflowNode next(WorkflowEvent event) {
        if (this == END) {
            throw new IllegalStateException("END is terminal");
        }
        if (event == WorkflowEvent.FAILED) {
            return this == ERROR ? END : ERROR;
        }
        switch (this) {
            case ROUTE:
                switch (event) {
                    case UPLOAD_REQUESTED:
                        return UPLOAD;
                    case QUERY_REQUESTED:
                        return QUERY;
                    case VISUALIZE_REQUESTED:
                        return VISUALIZE;
                    case REJECTED:
                        return ERROR;
                    default:
                        break;
                }
                break;
            case UPLOAD:
                if (event == WorkflowEvent.COMPLETED) {
                    return EXTRACT;
                }
                break;
            case EXTRACT:
            case QUERY:
            case VISUALIZE:
            case ERROR:
                if (event == WorkflowEvent.COMPLETED) {
                    return END;
                }
                break;
            default:
                break;
        }
        throw new IllegalStateException("No transition from " + this + " on " + event);
    }
}
