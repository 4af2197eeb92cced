package com.purchasingpower.flowgraph.exception;

/**
 * A write would break a uniqueness invariant (name, or order within a workflow).
 */
public class ConstraintViolationException extends FlowGraphException {

    public ConstraintViolationException(String message) {
        super(ErrorCode.CONSTRAINT_VIOLATION, message);
    }

    public ConstraintViolationException(String message, Throwable cause) {
        super(ErrorCode.CONSTRAINT_VIOLATION, message, cause);
    }
}
