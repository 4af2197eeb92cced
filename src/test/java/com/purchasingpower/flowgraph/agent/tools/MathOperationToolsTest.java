package com.purchasingpower.flowgraph.agent.tools;

import com.purchasingpower.flowgraph.agent.ContextBoundTool;
import com.purchasingpower.flowgraph.agent.Invocable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the sample math tools and the context binding they rely on.
 */
class MathOperationToolsTest {

    private final MathOperationTools tools = new MathOperationTools();

    @Test
    void addNumbers_storesSumUnderToolName() throws Exception {
        Map<String, Object> output = tools.addNumbersTool().invoke(Map.of("a", 2, "b", 3));

        assertThat(output).containsOnly(Map.entry(MathOperationTools.ADD_NUMBERS, 5L));
    }

    @Test
    void addNumbers_mixedTypes_fallsBackToDouble() throws Exception {
        Map<String, Object> output = tools.addNumbersTool().invoke(Map.of("a", 1.5, "b", "2"));

        assertThat(output).containsEntry(MathOperationTools.ADD_NUMBERS, 3.5);
    }

    @Test
    @DisplayName("Each tool reads the previous tool's output by name")
    void chain_threadsOutputs() throws Exception {
        Map<String, Object> context = new HashMap<>(Map.of("a", 4, "b", 1));
        for (Invocable tool : List.of(tools.addNumbersTool(), tools.multiplyByTwoTool(), tools.formatResultTool())) {
            context.putAll(tool.invoke(Map.copyOf(context)));
        }

        assertThat(context).containsEntry("formatted", "The final result is: 10");
    }

    @Test
    void missingContextVariable_isRejected() {
        assertThatThrownBy(() -> tools.addNumbersTool().invoke(Map.of("a", 1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'b'");
    }

    @Test
    void nonNumericInput_isRejected() {
        assertThatThrownBy(() -> tools.addNumbersTool().invoke(Map.of("a", "one", "b", 2)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a number");
    }

    @Test
    void contextBoundTool_mapResult_isMergedAsIs() throws Exception {
        ContextBoundTool tool = ContextBoundTool.of("split", "split a name", List.of("name"),
            args -> Map.of("first", "Ada", "last", "Lovelace"));

        assertThat(tool.invoke(Map.of("name", "Ada Lovelace")))
            .containsOnly(Map.entry("first", "Ada"), Map.entry("last", "Lovelace"));
        assertThat(tool.getParameters()).containsExactly("name");
    }
}
