package com.purchasingpower.flowgraph.exception;

import lombok.Getter;

/**
 * Base class of every failure raised by FlowGraph.
 */
@Getter
public class FlowGraphException extends RuntimeException {

    private final ErrorCode errorCode;

    public FlowGraphException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public FlowGraphException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
