package com.purchasingpower.flowgraph.model.catalog;

import com.purchasingpower.flowgraph.core.OrderedTask;
import com.purchasingpower.flowgraph.core.WorkflowDefinition;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A workflow together with its tasks in execution order.
 */
@Value
@Builder
public class WorkflowDetails {

    WorkflowDefinition workflow;
    List<OrderedTask> tasks;
}
