package com.purchasingpower.flowgraph.agent.impl;

import com.purchasingpower.flowgraph.agent.Invocable;
import com.purchasingpower.flowgraph.agent.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry seeded with every {@link Invocable} bean in the application context.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class DefaultToolRegistry implements ToolRegistry {

    private final ConcurrentMap<String, Invocable> tools = new ConcurrentHashMap<>();

    public DefaultToolRegistry(List<Invocable> tools) {
        tools.forEach(this::register);
        log.info("Tool registry initialized with {} tool(s): {}", this.tools.size(), getRegisteredNames());
    }

    @Override
    public Optional<Invocable> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    @Override
    public void register(Invocable tool) {
        if (tool.getName() == null || tool.getName().isBlank()) {
            throw new IllegalArgumentException("Tool name is required");
        }
        Invocable previous = tools.putIfAbsent(tool.getName(), tool);
        if (previous != null && previous != tool) {
            throw new IllegalStateException("A tool named '" + tool.getName() + "' is already registered");
        }
        log.debug("Registered tool: {}", tool.getName());
    }

    @Override
    public boolean unregister(String name) {
        boolean removed = tools.remove(name) != null;
        if (removed) {
            log.debug("Unregistered tool: {}", name);
        }
        return removed;
    }

    @Override
    public Set<String> getRegisteredNames() {
        return new TreeSet<>(tools.keySet());
    }
}
