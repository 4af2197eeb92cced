package com.purchasingpower.flowgraph.configuration;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Hybrid search settings, bound from {@code app.retrieval}.
 */
@Data
public class RetrievalProperties {

    @DecimalMin("0.0")
    private double vectorWeight = 0.5;

    @DecimalMin("0.0")
    private double fulltextWeight = 0.5;

    @Min(1)
    private int defaultTopK = 5;

    /**
     * Skip a failing signal (embedding service or index) instead of failing the search.
     */
    private boolean degradeOnFailure = false;
}
