package com.purchasingpower.flowgraph.exception;

/**
 * Backend failure of the graph store that is neither a missing key nor a constraint violation.
 */
public class GraphStoreException extends FlowGraphException {

    public GraphStoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_ERROR, message, cause);
    }
}
