package com.purchasingpower.flowgraph.configuration;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the LangChain4j embedding model for the configured provider.
 *
 * <p>Both providers retry transient failures themselves ({@code max-retries}).
 */
@Slf4j
@Configuration
public class EmbeddingModelConfig {

    @Bean
    @ConditionalOnMissingBean(EmbeddingModel.class)
    public EmbeddingModel embeddingModel(FlowGraphProperties properties) {
        EmbeddingProperties embedding = properties.getEmbedding();

        log.info("Initializing embedding model");
        log.info("   - Provider: {}", embedding.getProvider());
        log.info("   - URL: {}", embedding.getBaseUrl());
        log.info("   - Model: {}", embedding.getModelName());
        log.info("   - Timeout: {}", embedding.getTimeout());
        log.info("   - Max Retries: {}", embedding.getMaxRetries());

        return switch (embedding.getProvider()) {
            case OLLAMA -> OllamaEmbeddingModel.builder()
                .baseUrl(embedding.getBaseUrl())
                .modelName(embedding.getModelName())
                .timeout(embedding.getTimeout())
                .maxRetries(embedding.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
            case OPENAI -> OpenAiEmbeddingModel.builder()
                .baseUrl(embedding.getBaseUrl())
                .apiKey(embedding.getApiKey())
                .modelName(embedding.getModelName())
                .timeout(embedding.getTimeout())
                .maxRetries(embedding.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();
        };
    }
}
