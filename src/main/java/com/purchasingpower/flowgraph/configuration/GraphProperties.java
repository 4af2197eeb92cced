package com.purchasingpower.flowgraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Graph backend settings, bound from {@code app.graph}.
 */
@Data
public class GraphProperties {

    /**
     * NEO4J talks Bolt to a server; IN_MEMORY keeps the graph in the JVM (local runs, tests).
     */
    @NotNull
    private Backend backend = Backend.NEO4J;

    @NotBlank
    private String uri = "bolt://localhost:7687";

    @NotBlank
    private String username = "neo4j";

    private String password = "password";

    @NotBlank
    private String database = "neo4j";

    /**
     * Dimensions of the vector indexes; must match the embedding model.
     */
    @Min(1)
    private int embeddingDimensions = 1024;

    public enum Backend {
        NEO4J,
        IN_MEMORY
    }
}
