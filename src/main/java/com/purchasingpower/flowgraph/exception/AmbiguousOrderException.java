package com.purchasingpower.flowgraph.exception;

import lombok.Getter;

/**
 * The store returned two tasks with the same CONTAINS order for one workflow.
 */
@Getter
public class AmbiguousOrderException extends FlowGraphException {

    private final String workflowName;
    private final int order;

    public AmbiguousOrderException(String workflowName, int order, String firstTask, String secondTask) {
        super(ErrorCode.AMBIGUOUS_ORDER, String.format(
            "Workflow '%s' has tasks '%s' and '%s' at the same order %d",
            workflowName, firstTask, secondTask, order));
        this.workflowName = workflowName;
        this.order = order;
    }
}
