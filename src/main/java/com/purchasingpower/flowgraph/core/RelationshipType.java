package com.purchasingpower.flowgraph.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Relationship types of the workflow graph.
 *
 * <ul>
 *   <li>{@code CONTAINS} Workflow to Task, carries {@code order}</li>
 *   <li>{@code USES} Task to Tool, at most one per task</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum RelationshipType {

    CONTAINS(EntityKind.WORKFLOW, EntityKind.TASK),
    USES(EntityKind.TASK, EntityKind.TOOL);

    private final EntityKind from;
    private final EntityKind to;
}
