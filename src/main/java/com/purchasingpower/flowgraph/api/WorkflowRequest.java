package com.purchasingpower.flowgraph.api;

import com.purchasingpower.flowgraph.core.TaskRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Create a workflow or replace its task list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRequest {

    private String name;
    private String description;

    @Builder.Default
    private List<TaskRef> tasks = new ArrayList<>();
}
