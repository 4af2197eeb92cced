package com.purchasingpower.flowgraph.search;

import com.purchasingpower.flowgraph.core.EntityKind;

import java.util.List;

/**
 * Hybrid search over the workflow catalog.
 *
 * <p>Combines two signals per entity kind:
 * <ul>
 *   <li>Vector similarity between the query embedding and stored embeddings</li>
 *   <li>Full-text relevance over name, description and search text</li>
 * </ul>
 * Each signal is normalized to [0, 1] by its best score in the result set and the
 * two are blended with the configured weights. An entity matched by one signal
 * only scores 0 on the other.
 *
 * @since 1.0.0
 */
public interface SearchService {

    /**
     * Search one kind of entity.
     *
     * @param kind Entity kind to search
     * @param query Natural language query
     * @param topK Maximum number of hits; the configured default when not positive
     * @return Hits ordered by combined score descending, ties broken by name ascending
     */
    List<SearchHit> search(EntityKind kind, String query, int topK);
}
