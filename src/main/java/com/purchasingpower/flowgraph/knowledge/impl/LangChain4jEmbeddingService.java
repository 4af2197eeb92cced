package com.purchasingpower.flowgraph.knowledge.impl;

import com.purchasingpower.flowgraph.exception.EmbeddingServiceException;
import com.purchasingpower.flowgraph.knowledge.EmbeddingService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * LangChain4j-based embedding service.
 *
 * <p>Retries and timeouts are handled by the underlying {@link EmbeddingModel};
 * whatever still fails surfaces as {@link EmbeddingServiceException}.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LangChain4jEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;

    @Override
    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }

        log.debug("Generating embedding for text (length: {})", text.length());

        Response<Embedding> response;
        try {
            response = embeddingModel.embed(text);
        } catch (Exception e) {
            log.error("Failed to generate embedding after retries: {}", e.getMessage());
            throw new EmbeddingServiceException("Embedding generation failed: " + e.getMessage(), e);
        }

        if (response == null || response.content() == null || response.content().vector().length == 0) {
            throw new EmbeddingServiceException("Embedding provider returned an empty vector");
        }

        List<Double> embedding = convertToDoubleList(response.content());
        log.debug("Generated embedding ({} dimensions)", embedding.size());
        return embedding;
    }

    /**
     * Convert LangChain4j Embedding (float[]) to List<Double> for Neo4j compatibility.
     */
    private List<Double> convertToDoubleList(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Double> result = new ArrayList<>(vector.length);
        for (float value : vector) {
            result.add((double) value);
        }
        return result;
    }
}
