package com.purchasingpower.flowgraph.configuration;

import lombok.Data;

@Data
public class IndexingProperties {

    /**
     * When true an entity whose embedding fails is still stored, without a vector.
     * When false (default) the create operation fails and nothing is written.
     */
    private boolean skipOnEmbeddingFailure = false;
}
