package com.purchasingpower.flowgraph.search.impl;

import com.purchasingpower.flowgraph.configuration.FlowGraphProperties;
import com.purchasingpower.flowgraph.configuration.RetrievalProperties;
import com.purchasingpower.flowgraph.core.CatalogEntity;
import com.purchasingpower.flowgraph.core.EntityKind;
import com.purchasingpower.flowgraph.core.OrderedTask;
import com.purchasingpower.flowgraph.core.ScoredKey;
import com.purchasingpower.flowgraph.core.TaskDefinition;
import com.purchasingpower.flowgraph.core.ToolDefinition;
import com.purchasingpower.flowgraph.core.WorkflowMembership;
import com.purchasingpower.flowgraph.exception.FlowGraphException;
import com.purchasingpower.flowgraph.knowledge.EmbeddingService;
import com.purchasingpower.flowgraph.knowledge.GraphStore;
import com.purchasingpower.flowgraph.search.SearchHit;
import com.purchasingpower.flowgraph.search.SearchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Hybrid search combining vector similarity and full-text relevance.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class HybridSearchServiceImpl implements SearchService {

    private static final Comparator<SearchHit> RANKING = Comparator
        .comparingDouble(SearchHit::getScore).reversed()
        .thenComparing(SearchHit::getName);

    private final EmbeddingService embeddingService;
    private final GraphStore graphStore;
    private final RetrievalProperties properties;

    public HybridSearchServiceImpl(EmbeddingService embeddingService,
                                   GraphStore graphStore,
                                   FlowGraphProperties properties) {
        this.embeddingService = embeddingService;
        this.graphStore = graphStore;
        this.properties = properties.getRetrieval();
    }

    @Override
    public List<SearchHit> search(EntityKind kind, String query, int topK) {
        if (kind == null) {
            throw new IllegalArgumentException("Entity kind is required");
        }
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        int limit = topK > 0 ? topK : properties.getDefaultTopK();

        log.info("Searching {} for '{}' (topK={})", kind.getLabel(), query, limit);

        List<ScoredKey> vectorCandidates = signal(kind, "vector", () ->
            graphStore.queryByEmbeddingSimilarity(kind, embeddingService.embed(query), limit));
        List<ScoredKey> fulltextCandidates = signal(kind, "fulltext", () ->
            graphStore.queryByFulltext(kind, query, limit));

        Map<String, Double> vectorScores = normalize(vectorCandidates, true);
        Map<String, Double> fulltextScores = normalize(fulltextCandidates, false);

        Set<String> keys = new LinkedHashSet<>(vectorScores.keySet());
        keys.addAll(fulltextScores.keySet());

        List<SearchHit> hits = new ArrayList<>();
        for (String key : keys) {
            double vector = vectorScores.getOrDefault(key, 0.0);
            double fulltext = fulltextScores.getOrDefault(key, 0.0);
            hits.add(SearchHit.builder()
                .kind(kind)
                .name(key)
                .vectorScore(vector)
                .fulltextScore(fulltext)
                .score(properties.getVectorWeight() * vector + properties.getFulltextWeight() * fulltext)
                .build());
        }

        hits.sort(RANKING);
        List<SearchHit> ranked = new ArrayList<>();
        for (SearchHit hit : hits) {
            if (ranked.size() >= limit) {
                break;
            }
            // Entities deleted between the index query and now are dropped
            if (enrich(hit)) {
                ranked.add(hit);
            }
        }

        log.info("Search returned {} {} hit(s) from {} vector / {} fulltext candidates",
            ranked.size(), kind.getLabel(), vectorCandidates.size(), fulltextCandidates.size());
        return ranked;
    }

    private List<ScoredKey> signal(EntityKind kind, String name, Supplier<List<ScoredKey>> query) {
        try {
            List<ScoredKey> candidates = query.get();
            log.debug("{} {} candidates: {}", kind.getLabel(), name, candidates);
            return candidates;
        } catch (FlowGraphException e) {
            if (!properties.isDegradeOnFailure()) {
                throw e;
            }
            log.warn("Skipping {} signal for {} search: {}", name, kind.getLabel(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Scale scores into [0, 1] by the best score of the set. Keeps the first
     * occurrence of a key.
     */
    static Map<String, Double> normalize(List<ScoredKey> candidates, boolean clamp) {
        Map<String, Double> scores = new LinkedHashMap<>();
        double max = 0.0;
        for (ScoredKey candidate : candidates) {
            double score = clamp ? clamp(candidate.score()) : Math.max(0.0, candidate.score());
            if (scores.putIfAbsent(candidate.key(), score) == null) {
                max = Math.max(max, score);
            }
        }
        if (max <= 0.0) {
            scores.replaceAll((key, score) -> 0.0);
            return scores;
        }
        double best = max;
        scores.replaceAll((key, score) -> score / best);
        return scores;
    }

    private static double clamp(double score) {
        return Math.min(1.0, Math.max(0.0, score));
    }

    private boolean enrich(SearchHit hit) {
        Map<String, Object> details = new LinkedHashMap<>();
        Optional<? extends CatalogEntity> entity = switch (hit.getKind()) {
            case WORKFLOW -> graphStore.findWorkflow(hit.getName());
            case TASK -> graphStore.findTask(hit.getName());
            case TOOL -> graphStore.findTool(hit.getName());
        };
        if (entity.isEmpty()) {
            log.debug("Dropping stale {} hit '{}'", hit.getKind().getLabel(), hit.getName());
            return false;
        }
        hit.setDescription(entity.get().getDescription());

        switch (hit.getKind()) {
            case WORKFLOW -> {
                List<Map<String, Object>> tasks = new ArrayList<>();
                for (OrderedTask task : graphStore.getOrderedTasks(hit.getName())) {
                    Map<String, Object> step = new HashMap<>();
                    step.put("order", task.getOrder());
                    step.put("task", task.getTaskName());
                    step.put("tool", task.getToolName());
                    tasks.add(step);
                }
                details.put("tasks", tasks);
            }
            case TASK -> {
                details.put("tool", ((TaskDefinition) entity.get()).getToolName());
                List<Map<String, Object>> workflows = new ArrayList<>();
                for (WorkflowMembership membership : graphStore.findWorkflowsContaining(hit.getName())) {
                    workflows.add(Map.of("workflow", membership.getWorkflowName(), "order", membership.getOrder()));
                }
                details.put("workflows", workflows);
            }
            case TOOL -> {
                details.put("callable", ((ToolDefinition) entity.get()).resolveCallable());
                details.put("usedBy", graphStore.findTasksUsingTool(hit.getName()));
            }
        }
        hit.setDetails(details);
        return true;
    }
}
