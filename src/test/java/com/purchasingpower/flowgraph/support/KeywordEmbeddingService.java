package com.purchasingpower.flowgraph.support;

import com.purchasingpower.flowgraph.exception.EmbeddingServiceException;
import com.purchasingpower.flowgraph.knowledge.EmbeddingService;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Deterministic embedding for tests: one dimension per concept, set to 1 when the
 * text contains any word of that concept. Words outside every concept add nothing,
 * so two texts can be close in vector space without sharing a single word.
 */
public class KeywordEmbeddingService implements EmbeddingService {

    private final Map<String, Set<String>> concepts = new LinkedHashMap<>();
    private final AtomicBoolean failing = new AtomicBoolean(false);

    public KeywordEmbeddingService concept(String name, String... words) {
        concepts.put(name, Arrays.stream(words).map(w -> w.toLowerCase(Locale.ROOT)).collect(Collectors.toSet()));
        return this;
    }

    public static KeywordEmbeddingService defaults() {
        return new KeywordEmbeddingService()
            .concept("analysis", "analysis", "analytics", "insights")
            .concept("math", "add", "sum", "numbers", "multiply", "arithmetic")
            .concept("format", "format", "formatting", "text", "report");
    }

    public void setFailing(boolean failing) {
        this.failing.set(failing);
    }

    @Override
    public List<Double> embed(String text) {
        if (failing.get()) {
            throw new EmbeddingServiceException("Embedding provider unavailable");
        }
        Set<String> words = Arrays.stream(String.valueOf(text).toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
            .collect(Collectors.toSet());
        List<Double> vector = new ArrayList<>();
        for (Set<String> concept : concepts.values()) {
            vector.add(concept.stream().anyMatch(words::contains) ? 1.0 : 0.0);
        }
        return vector;
    }
}
