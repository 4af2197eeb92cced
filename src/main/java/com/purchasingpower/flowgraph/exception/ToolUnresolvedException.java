package com.purchasingpower.flowgraph.exception;

import lombok.Getter;

@Getter
public class ToolUnresolvedException extends FlowGraphException {

    private final String taskName;

    public ToolUnresolvedException(String taskName, String message) {
        super(ErrorCode.TOOL_UNRESOLVED, message);
        this.taskName = taskName;
    }

    public ToolUnresolvedException(String taskName, String message, Throwable cause) {
        super(ErrorCode.TOOL_UNRESOLVED, message, cause);
        this.taskName = taskName;
    }
}
