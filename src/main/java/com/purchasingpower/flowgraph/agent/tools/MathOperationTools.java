package com.purchasingpower.flowgraph.agent.tools;

import com.purchasingpower.flowgraph.agent.ContextBoundTool;
import com.purchasingpower.flowgraph.agent.Invocable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

/**
 * Sample toolset: add two numbers, double the sum, format the result.
 *
 * <p>Chained in that order they show context threading, since each tool reads
 * the previous tool's output by name.
 */
@Configuration
public class MathOperationTools {

    public static final String ADD_NUMBERS = "add_numbers";
    public static final String MULTIPLY_BY_TWO = "multiply_by_two";
    public static final String FORMAT_RESULT = "format_result";

    @Bean
    public Invocable addNumbersTool() {
        return ContextBoundTool.of(ADD_NUMBERS, "Add the context variables a and b",
            List.of("a", "b"),
            args -> add(toNumber(args[0], "a"), toNumber(args[1], "b")));
    }

    @Bean
    public Invocable multiplyByTwoTool() {
        return ContextBoundTool.of(MULTIPLY_BY_TWO, "Multiply the output of add_numbers by 2",
            List.of(ADD_NUMBERS),
            args -> multiply(toNumber(args[0], ADD_NUMBERS), 2));
    }

    @Bean
    public Invocable formatResultTool() {
        return ContextBoundTool.of(FORMAT_RESULT, "Format the output of multiply_by_two as text",
            List.of(MULTIPLY_BY_TWO),
            args -> Map.of("formatted", "The final result is: " + args[0]));
    }

    static Number add(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return a.longValue() + b.longValue();
        }
        return a.doubleValue() + b.doubleValue();
    }

    static Number multiply(Number a, long factor) {
        if (isIntegral(a)) {
            return a.longValue() * factor;
        }
        return a.doubleValue() * factor;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static Number toNumber(Object value, String variable) {
        if (value instanceof Number number) {
            return number;
        }
        if (value instanceof String text) {
            try {
                return text.contains(".") ? Double.parseDouble(text) : Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Context variable '" + variable + "' is not a number: " + text, e);
            }
        }
        throw new IllegalArgumentException("Context variable '" + variable + "' is not a number: " + value);
    }
}
