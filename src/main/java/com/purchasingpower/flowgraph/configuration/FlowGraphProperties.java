package com.purchasingpower.flowgraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class FlowGraphProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GraphProperties graph = new GraphProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EmbeddingProperties embedding = new EmbeddingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private IndexingProperties indexing = new IndexingProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RetrievalProperties retrieval = new RetrievalProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExecutionProperties execution = new ExecutionProperties();
}
