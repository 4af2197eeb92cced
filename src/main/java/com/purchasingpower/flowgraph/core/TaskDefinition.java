package com.purchasingpower.flowgraph.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Task node, bound to exactly one tool through a USES relationship.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TaskDefinition implements CatalogEntity {

    private String id;
    private String name;
    private String description;
    private String toolName;

    @JsonIgnore
    private List<Double> embedding;

    @Override
    public EntityKind getKind() {
        return EntityKind.TASK;
    }
}
