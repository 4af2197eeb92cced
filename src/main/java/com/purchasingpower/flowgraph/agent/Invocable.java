package com.purchasingpower.flowgraph.agent;

import java.util.Map;

/**
 * Capability behind a Tool node.
 *
 * <p>Host applications provide implementations and register them with the
 * {@link ToolRegistry}; a Tool node refers to one by name through its
 * {@code callable} property. The engine never assumes a fixed tool set.
 *
 * <p>Example implementation:
 * <pre>
 * public class WordCountTool implements Invocable {
 *     public String getName() { return "word_count"; }
 *
 *     public Map&lt;String, Object&gt; invoke(Map&lt;String, Object&gt; context) {
 *         String text = (String) context.get("text");
 *         return Map.of("wordCount", text.split("\\s+").length);
 *     }
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public interface Invocable {

    /**
     * Registry key of this tool.
     */
    String getName();

    /**
     * Human-readable description, used when the tool is listed.
     */
    default String getDescription() {
        return "";
    }

    /**
     * Run the tool.
     *
     * <p>The context is the read-only accumulation of the initial variables and
     * every earlier task's output. The returned mapping is laid over it: returned
     * keys are added or overwrite existing ones, absent keys are kept.
     *
     * @param context Accumulated workflow context, unmodifiable
     * @return keys to add or overwrite; never null
     * @throws Exception any failure, reported as the task's error
     */
    Map<String, Object> invoke(Map<String, Object> context) throws Exception;
}
