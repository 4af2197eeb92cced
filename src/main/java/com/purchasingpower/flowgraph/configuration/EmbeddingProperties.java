package com.purchasingpower.flowgraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Text embedding collaborator, bound from {@code app.embedding}.
 */
@Data
public class EmbeddingProperties {

    @NotNull
    private Provider provider = Provider.OLLAMA;

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    /**
     * Only sent to OpenAI-compatible endpoints.
     */
    private String apiKey = "ollama";

    @NotBlank
    private String modelName = "mxbai-embed-large";

    @NotNull
    private Duration timeout = Duration.ofSeconds(120);

    @Min(0)
    private int maxRetries = 3;

    public enum Provider {
        OLLAMA,
        OPENAI
    }
}
