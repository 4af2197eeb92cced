package com.purchasingpower.flowgraph.model.execution;

/**
 * States of one workflow execution: RESOLVING, then RUNNING, then COMPLETED or FAILED.
 */
public enum ExecutionStatus {
    RESOLVING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
