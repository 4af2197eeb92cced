package com.purchasingpower.flowgraph.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Node labels of the workflow graph together with the indexes maintained for each.
 *
 * @since 1.0.0
 */
@Getter
@RequiredArgsConstructor
public enum EntityKind {

    WORKFLOW("Workflow", "workflowEmbedding", "workflowFulltext"),
    TASK("Task", "taskEmbedding", "taskFulltext"),
    TOOL("Tool", "toolEmbedding", "toolFulltext");

    private final String label;
    private final String vectorIndex;
    private final String fulltextIndex;

    /**
     * Parse a kind from its enum name or its label, ignoring case.
     *
     * @throws IllegalArgumentException if the value matches no kind
     */
    public static EntityKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity kind is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (EntityKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity kind: " + value);
    }
}
