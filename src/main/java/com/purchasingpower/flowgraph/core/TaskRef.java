package com.purchasingpower.flowgraph.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to an existing task by name, placed at {@code order} inside a workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRef {

    private String name;
    private Integer order;

    public static TaskRef of(String name, int order) {
        return new TaskRef(name, order);
    }
}
