package com.purchasingpower.flowgraph.configuration;

import com.purchasingpower.flowgraph.knowledge.GraphStore;
import com.purchasingpower.flowgraph.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.flowgraph.knowledge.impl.Neo4jGraphStoreImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the graph backend from {@code app.graph.backend}.
 */
@Slf4j
@Configuration
public class GraphStoreConfig {

    @Bean(destroyMethod = "close")
    public GraphStore graphStore(FlowGraphProperties properties) {
        GraphProperties graph = properties.getGraph();
        log.info("Graph backend: {}", graph.getBackend());

        return switch (graph.getBackend()) {
            case NEO4J -> {
                Neo4jGraphStoreImpl store = new Neo4jGraphStoreImpl(graph);
                store.init();
                yield store;
            }
            case IN_MEMORY -> new InMemoryGraphStore();
        };
    }
}
