package com.purchasingpower.flowgraph.knowledge;

import com.purchasingpower.flowgraph.core.EntityKind;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the search indexes of Workflow, Task and Tool nodes in step with their text.
 *
 * <p>Embeddings are derived data: they are recomputed whenever the owning
 * entity's name or description changes and never set by hand.
 *
 * @since 1.0.0
 */
public interface IndexingService {

    /**
     * Compute the embedding for an entity that is about to be written.
     *
     * <p>Called before the node write so that a failing embedding leaves nothing behind.
     *
     * @return the embedding, or empty when the provider failed and unindexed entities are accepted
     * @throws com.purchasingpower.flowgraph.exception.EmbeddingServiceException when the provider failed
     *         and unindexed entities are not accepted
     */
    Optional<List<Double>> embed(EntityKind kind, String key, String text);

    /**
     * Compute the embedding of an existing node and write it, together with the
     * full-text search text, onto that node.
     *
     * @return the stored embedding
     */
    List<Double> index(EntityKind kind, String key, String text);

    /**
     * Re-run {@link #index} for an existing entity from its stored name and description.
     *
     * @throws com.purchasingpower.flowgraph.exception.NotFoundException if the entity does not exist
     */
    List<Double> reindex(EntityKind kind, String name);
}
