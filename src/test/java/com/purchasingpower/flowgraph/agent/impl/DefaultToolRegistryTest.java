package com.purchasingpower.flowgraph.agent.impl;

import com.purchasingpower.flowgraph.agent.ContextBoundTool;
import com.purchasingpower.flowgraph.agent.Invocable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultToolRegistryTest {

    @Test
    void constructor_registersGivenTools() {
        DefaultToolRegistry registry = new DefaultToolRegistry(List.of(tool("b"), tool("a")));

        assertThat(registry.getRegisteredNames()).containsExactly("a", "b");
        assertThat(registry.find("a")).isPresent();
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void register_duplicateName_isRejected() {
        DefaultToolRegistry registry = new DefaultToolRegistry(List.of(tool("a")));

        assertThatThrownBy(() -> registry.register(tool("a"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unregister_removesTool() {
        DefaultToolRegistry registry = new DefaultToolRegistry(List.of(tool("a")));

        assertThat(registry.unregister("a")).isTrue();
        assertThat(registry.unregister("a")).isFalse();
        assertThat(registry.find("a")).isEmpty();
    }

    private static Invocable tool(String name) {
        return ContextBoundTool.of(name, "", List.of(), args -> name);
    }
}
