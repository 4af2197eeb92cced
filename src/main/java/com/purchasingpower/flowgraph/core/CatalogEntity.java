package com.purchasingpower.flowgraph.core;

import java.util.List;

/**
 * Common view of the three node kinds stored in the graph.
 *
 * @since 1.0.0
 */
public interface CatalogEntity {

    String getId();

    /**
     * Unique key of the entity within its kind.
     */
    String getName();

    String getDescription();

    /**
     * Derived search vector; null when the entity was stored unindexed.
     */
    List<Double> getEmbedding();

    EntityKind getKind();

    /**
     * Text handed to the indexer for this entity.
     */
    default String indexText() {
        String description = getDescription();
        return description == null || description.isBlank()
            ? getName()
            : getName() + " " + description;
    }
}
