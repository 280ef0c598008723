package com.purchasingpower.studygraph.workflow;

import com.purchasingpower.studygraph.workflow.state.WorkflowState;

/**
 * Work done in one workflow node. Mutates the run's state and reports the outcome.
 */
@FunctionalInterface
public interface NodeHandler {

    WorkflowEvent handle(WorkflowState state);
}
