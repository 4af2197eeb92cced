package com.purchasingpower.flowgraph.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A task as seen through one workflow's CONTAINS edge.
 *
 * <p>{@code toolName} is null when the task has lost its USES edge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderedTask {

    private int order;
    private TaskDefinition task;
    private String toolName;

    public String getTaskName() {
        return task != null ? task.getName() : null;
    }
}
