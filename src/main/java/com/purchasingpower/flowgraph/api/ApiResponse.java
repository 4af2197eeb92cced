package com.purchasingpower.flowgraph.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.flowgraph.exception.FlowGraphException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for catalog responses.
 *
 * @param <T> payload type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private String error;
    private String errorCode;
    private T data;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
            .success(true)
            .data(data)
            .build();
    }

    public static <T> ApiResponse<T> error(Exception e) {
        return ApiResponse.<T>builder()
            .success(false)
            .error(e.getMessage())
            .errorCode(e instanceof FlowGraphException ? ((FlowGraphException) e).getErrorCode().name() : null)
            .build();
    }

    public static <T> ApiResponse<T> error(String error) {
        return ApiResponse.<T>builder()
            .success(false)
            .error(error)
            .build();
    }
}
