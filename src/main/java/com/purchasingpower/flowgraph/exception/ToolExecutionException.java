package com.purchasingpower.flowgraph.exception;

import lombok.Getter;

/**
 * Wraps the failure of a tool invocation.
 */
@Getter
public class ToolExecutionException extends FlowGraphException {

    private final String toolName;

    public ToolExecutionException(String toolName, String message) {
        super(ErrorCode.TOOL_EXECUTION_ERROR, message);
        this.toolName = toolName;
    }

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(ErrorCode.TOOL_EXECUTION_ERROR, message, cause);
        this.toolName = toolName;
    }
}
