package com.purchasingpower.flowgraph.api;

import com.purchasingpower.flowgraph.exception.ConstraintViolationException;
import com.purchasingpower.flowgraph.exception.EmbeddingServiceException;
import com.purchasingpower.flowgraph.exception.FlowGraphException;
import com.purchasingpower.flowgraph.exception.GraphStoreException;
import com.purchasingpower.flowgraph.exception.NotFoundException;
import org.springframework.http.HttpStatus;

/**
 * Maps service exceptions to HTTP status codes.
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static HttpStatus statusOf(Throwable e) {
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof ConstraintViolationException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof EmbeddingServiceException || e instanceof GraphStoreException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (e instanceof FlowGraphException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (e instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
