package com.purchasingpower.flowgraph.model.execution;

import com.purchasingpower.flowgraph.exception.ErrorCode;
import com.purchasingpower.flowgraph.exception.FlowGraphException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one workflow execution.
 *
 * <p>On failure {@code context} is the partial context accumulated before the
 * failing task, and {@code failedTaskIndex}/{@code failedTaskName} identify it.
 * Failures while resolving the workflow carry no task identity.
 */
@Value
@Builder
public class ExecutionResult {

    String workflowName;
    ExecutionStatus status;

    /**
     * Phase the execution was in when it failed; null on success.
     */
    ExecutionStatus failedPhase;

    Map<String, Object> context;

    Integer failedTaskIndex;
    String failedTaskName;
    FlowGraphException error;

    @Singular
    List<TaskExecutionRecord> completedTasks;

    Instant startedAt;
    Instant finishedAt;

    public boolean isSuccess() {
        return status == ExecutionStatus.COMPLETED;
    }

    public ErrorCode getErrorCode() {
        return error != null ? error.getErrorCode() : null;
    }

    public String getErrorMessage() {
        return error != null ? error.getMessage() : null;
    }

    public Duration getDuration() {
        return startedAt != null && finishedAt != null ? Duration.between(startedAt, finishedAt) : Duration.ZERO;
    }
}
