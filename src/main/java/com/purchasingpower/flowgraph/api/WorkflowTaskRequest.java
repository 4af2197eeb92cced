package com.purchasingpower.flowgraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Insert an existing task into a workflow at a position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowTaskRequest {

    private String task;
    private Integer order;
}
