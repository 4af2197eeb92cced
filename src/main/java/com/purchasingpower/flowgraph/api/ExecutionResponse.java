package com.purchasingpower.flowgraph.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.flowgraph.model.execution.ExecutionResult;
import com.purchasingpower.flowgraph.model.execution.TaskExecutionRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Execution outcome as returned over HTTP.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionResponse {

    private boolean success;
    private String workflowName;
    private String status;
    private Map<String, Object> context;

    private String failedPhase;
    private Integer failedTaskIndex;
    private String failedTaskName;
    private String errorCode;
    private String error;

    @Builder.Default
    private List<TaskExecutionRecord> completedTasks = new ArrayList<>();

    private long durationMs;

    public static ExecutionResponse from(ExecutionResult result) {
        return ExecutionResponse.builder()
            .success(result.isSuccess())
            .workflowName(result.getWorkflowName())
            .status(result.getStatus().name())
            .context(result.getContext())
            .failedPhase(result.getFailedPhase() != null ? result.getFailedPhase().name() : null)
            .failedTaskIndex(result.getFailedTaskIndex())
            .failedTaskName(result.getFailedTaskName())
            .errorCode(result.getErrorCode() != null ? result.getErrorCode().name() : null)
            .error(result.getErrorMessage())
            .completedTasks(result.getCompletedTasks())
            .durationMs(result.getDuration().toMillis())
            .build();
    }

    public static ExecutionResponse error(String workflowName, String error) {
        return ExecutionResponse.builder()
            .success(false)
            .workflowName(workflowName)
            .status("FAILED")
            .error(error)
            .build();
    }
}
