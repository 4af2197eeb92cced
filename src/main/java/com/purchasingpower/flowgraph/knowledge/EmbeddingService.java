package com.purchasingpower.flowgraph.knowledge;

import java.util.List;

/**
 * Black-box text to vector function shared by indexing and search.
 *
 * @since 1.0.0
 */
public interface EmbeddingService {

    /**
     * Generate an embedding for arbitrary text.
     *
     * @param text the text to embed
     * @return embedding vector
     * @throws com.purchasingpower.flowgraph.exception.EmbeddingServiceException if the provider fails
     */
    List<Double> embed(String text);
}
