package com.purchasingpower.flowgraph.agent;

import java.util.Optional;
import java.util.Set;

/**
 * Runtime lookup of tool implementations by name.
 *
 * @since 1.0.0
 */
public interface ToolRegistry {

    Optional<Invocable> find(String name);

    /**
     * @throws IllegalStateException if another tool already uses the name
     */
    void register(Invocable tool);

    /**
     * @return true if a tool was registered under the name
     */
    boolean unregister(String name);

    Set<String> getRegisteredNames();
}
