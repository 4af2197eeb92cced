package com.purchasingpower.flowgraph.exception;

import lombok.Getter;

@Getter
public class EmptyWorkflowException extends FlowGraphException {

    private final String workflowName;

    public EmptyWorkflowException(String workflowName) {
        super(ErrorCode.EMPTY_WORKFLOW, "Workflow has no tasks: " + workflowName);
        this.workflowName = workflowName;
    }
}
