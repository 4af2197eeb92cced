package com.purchasingpower.flowgraph.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Tool node. {@code callable} is the opaque key under which the host
 * application registered the {@link com.purchasingpower.flowgraph.agent.Invocable}.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolDefinition implements CatalogEntity {

    private String id;
    private String name;
    private String description;
    private String callable;

    @JsonIgnore
    private List<Double> embedding;

    /**
     * Registry key, falling back to the tool name when no callable was given.
     */
    public String resolveCallable() {
        return callable == null || callable.isBlank() ? name : callable;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.TOOL;
    }
}
