package com.purchasingpower.flowgraph.agent;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Adapts a plain function of named arguments to an {@link Invocable}.
 *
 * <p>Each argument is read from the context under its parameter name. A
 * {@code Map} result is merged into the context; any other result is stored
 * under the tool's own name, so a later tool can take it as an argument.
 *
 * @since 1.0.0
 */
public final class ContextBoundTool implements Invocable {

    private final String name;
    private final String description;
    private final List<String> parameters;
    private final Function<Object[], Object> function;

    private ContextBoundTool(String name, String description, List<String> parameters,
                             Function<Object[], Object> function) {
        this.name = name;
        this.description = description;
        this.parameters = List.copyOf(parameters);
        this.function = function;
    }

    public static ContextBoundTool of(String name, String description, List<String> parameters,
                                      Function<Object[], Object> function) {
        return new ContextBoundTool(name, description, parameters, function);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    public List<String> getParameters() {
        return parameters;
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> context) {
        Object[] arguments = new Object[parameters.size()];
        for (int i = 0; i < parameters.size(); i++) {
            String parameter = parameters.get(i);
            if (!context.containsKey(parameter)) {
                throw new IllegalArgumentException(
                    "Tool '" + name + "' needs context variable '" + parameter + "'");
            }
            arguments[i] = context.get(parameter);
        }

        Object result = function.apply(arguments);

        Map<String, Object> output = new HashMap<>();
        if (result instanceof Map<?, ?> map) {
            map.forEach((key, value) -> output.put(String.valueOf(key), value));
        } else {
            output.put(name, result);
        }
        return output;
    }
}
