package com.purchasingpower.flowgraph.configuration;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Workflow execution settings, bound from {@code app.execution}.
 */
@Data
public class ExecutionProperties {

    @NotNull
    private EmptyWorkflowPolicy emptyWorkflowPolicy = EmptyWorkflowPolicy.REJECT;

    /**
     * Upper bound for one tool call. Null or zero means tools run inline without a timeout.
     */
    private Duration toolTimeout;

    public boolean hasToolTimeout() {
        return toolTimeout != null && !toolTimeout.isZero() && !toolTimeout.isNegative();
    }

    public enum EmptyWorkflowPolicy {
        /**
         * Executing a workflow without tasks fails with EMPTY_WORKFLOW.
         */
        REJECT,

        /**
         * Executing a workflow without tasks completes and returns the initial context.
         */
        SUCCEED
    }
}
