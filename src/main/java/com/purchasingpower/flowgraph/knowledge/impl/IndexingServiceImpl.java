package com.purchasingpower.flowgraph.knowledge.impl;

import com.purchasingpower.flowgraph.configuration.FlowGraphProperties;
import com.purchasingpower.flowgraph.core.CatalogEntity;
import com.purchasingpower.flowgraph.core.EntityKind;
import com.purchasingpower.flowgraph.exception.EmbeddingServiceException;
import com.purchasingpower.flowgraph.exception.NotFoundException;
import com.purchasingpower.flowgraph.knowledge.EmbeddingService;
import com.purchasingpower.flowgraph.knowledge.GraphStore;
import com.purchasingpower.flowgraph.knowledge.IndexingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class IndexingServiceImpl implements IndexingService {

    private final EmbeddingService embeddingService;
    private final GraphStore graphStore;
    private final FlowGraphProperties properties;

    @Override
    public Optional<List<Double>> embed(EntityKind kind, String key, String text) {
        try {
            return Optional.of(embeddingService.embed(text));
        } catch (EmbeddingServiceException e) {
            if (!properties.getIndexing().isSkipOnEmbeddingFailure()) {
                log.error("Embedding failed for {} '{}': {}", kind.getLabel(), key, e.getMessage());
                throw e;
            }
            log.warn("Embedding failed for {} '{}', storing it without a vector: {}",
                kind.getLabel(), key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public List<Double> index(EntityKind kind, String key, String text) {
        List<Double> embedding = embeddingService.embed(text);

        Map<String, Object> props = new HashMap<>();
        props.put("embedding", embedding);
        props.put("searchText", text);
        graphStore.upsertNode(kind, key, props);

        log.debug("Indexed {} '{}' ({} dimensions)", kind.getLabel(), key, embedding.size());
        return embedding;
    }

    @Override
    public List<Double> reindex(EntityKind kind, String name) {
        CatalogEntity entity = switch (kind) {
            case TOOL -> graphStore.findTool(name).orElseThrow(() -> new NotFoundException(kind, name));
            case TASK -> graphStore.findTask(name).orElseThrow(() -> new NotFoundException(kind, name));
            case WORKFLOW -> graphStore.findWorkflow(name).orElseThrow(() -> new NotFoundException(kind, name));
        };
        log.info("Re-indexing {} '{}'", kind.getLabel(), name);
        return index(kind, name, entity.indexText());
    }
}
