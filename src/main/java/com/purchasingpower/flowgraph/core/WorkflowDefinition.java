package com.purchasingpower.flowgraph.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Workflow node. Its tasks live on CONTAINS relationships, not on this object.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowDefinition implements CatalogEntity {

    private String id;
    private String name;
    private String description;

    @JsonIgnore
    private List<Double> embedding;

    @Override
    public EntityKind getKind() {
        return EntityKind.WORKFLOW;
    }
}
