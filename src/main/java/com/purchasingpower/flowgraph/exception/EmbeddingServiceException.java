package com.purchasingpower.flowgraph.exception;

public class EmbeddingServiceException extends FlowGraphException {

    public EmbeddingServiceException(String message) {
        super(ErrorCode.EMBEDDING_SERVICE_ERROR, message);
    }

    public EmbeddingServiceException(String message, Throwable cause) {
        super(ErrorCode.EMBEDDING_SERVICE_ERROR, message, cause);
    }
}
