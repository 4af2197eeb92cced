package com.purchasingpower.flowgraph.exception;

/**
 * Error taxonomy shared by the catalog, the execution engine and search.
 */
public enum ErrorCode {
    NOT_FOUND,
    CONSTRAINT_VIOLATION,
    TOOL_UNRESOLVED,
    AMBIGUOUS_ORDER,
    TOOL_EXECUTION_ERROR,
    EMBEDDING_SERVICE_ERROR,
    EMPTY_WORKFLOW,
    STORE_ERROR
}
