package com.purchasingpower.flowgraph.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Replaces the network embedding provider in Spring tests.
 */
@TestConfiguration
public class TestEmbeddingConfig {

    @Bean
    @Primary
    public KeywordEmbeddingService keywordEmbeddingService() {
        return KeywordEmbeddingService.defaults();
    }
}
