package com.purchasingpower.flowgraph.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A workflow containing a given task, and the order it gives that task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowMembership {

    private String workflowName;
    private int order;
}
