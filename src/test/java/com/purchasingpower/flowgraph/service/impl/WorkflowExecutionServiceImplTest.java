package com.purchasingpower.flowgraph.service.impl;

import com.purchasingpower.flowgraph.agent.Invocable;
import com.purchasingpower.flowgraph.agent.impl.DefaultToolRegistry;
import com.purchasingpower.flowgraph.agent.tools.MathOperationTools;
import com.purchasingpower.flowgraph.configuration.ExecutionProperties;
import com.purchasingpower.flowgraph.configuration.FlowGraphProperties;
import com.purchasingpower.flowgraph.core.OrderedTask;
import com.purchasingpower.flowgraph.core.TaskDefinition;
import com.purchasingpower.flowgraph.core.TaskRef;
import com.purchasingpower.flowgraph.core.ToolDefinition;
import com.purchasingpower.flowgraph.core.WorkflowDefinition;
import com.purchasingpower.flowgraph.exception.ErrorCode;
import com.purchasingpower.flowgraph.knowledge.GraphStore;
import com.purchasingpower.flowgraph.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.flowgraph.model.execution.ExecutionResult;
import com.purchasingpower.flowgraph.model.execution.ExecutionStatus;
import com.purchasingpower.flowgraph.model.execution.TaskExecutionRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for WorkflowExecutionServiceImpl against the in-memory store.
 */
class WorkflowExecutionServiceImplTest {

    private InMemoryGraphStore store;
    private DefaultToolRegistry registry;
    private FlowGraphProperties properties;
    private ThreadPoolTaskExecutor workflowExecutor;
    private ThreadPoolTaskExecutor toolExecutor;
    private WorkflowExecutionServiceImpl service;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        registry = new DefaultToolRegistry(List.of());
        properties = new FlowGraphProperties();
        workflowExecutor = executor("wf-test-");
        toolExecutor = executor("tool-test-");
        service = newService(store);
    }

    @AfterEach
    void tearDown() {
        workflowExecutor.shutdown();
        toolExecutor.shutdown();
        store.close();
    }

    @Test
    @DisplayName("add_numbers -> multiply_by_two -> format_result threads the context")
    void execute_mathChain_producesFormattedResult() {
        MathOperationTools math = new MathOperationTools();
        tool(math.addNumbersTool());
        tool(math.multiplyByTwoTool());
        tool(math.formatResultTool());
        task("add", MathOperationTools.ADD_NUMBERS);
        task("double", MathOperationTools.MULTIPLY_BY_TWO);
        task("format", MathOperationTools.FORMAT_RESULT);
        workflow("calc", TaskRef.of("add", 1), TaskRef.of("double", 2), TaskRef.of("format", 3));

        ExecutionResult result = service.execute("calc", Map.of("a", 2, "b", 3));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getContext())
            .containsEntry("a", 2)
            .containsEntry(MathOperationTools.ADD_NUMBERS, 5L)
            .containsEntry(MathOperationTools.MULTIPLY_BY_TWO, 10L)
            .containsEntry("formatted", "The final result is: 10");
        assertThat(result.getCompletedTasks()).extracting(TaskExecutionRecord::getTaskName)
            .containsExactly("add", "double", "format");
    }

    @Test
    @DisplayName("A failing task stops the run, later tasks never start")
    void execute_failingMiddleTask_returnsPartialContext() {
        AtomicInteger thirdCalls = new AtomicInteger();
        tool(new FunctionTool("first", ctx -> Map.of("a", 1)));
        tool(new FunctionTool("second", ctx -> {
            throw new IllegalStateException("boom");
        }));
        tool(new FunctionTool("third", ctx -> {
            thirdCalls.incrementAndGet();
            return Map.of("c", 3);
        }));
        task("t1", "first");
        task("t2", "second");
        task("t3", "third");
        workflow("wf", TaskRef.of("t1", 0), TaskRef.of("t2", 1), TaskRef.of("t3", 2));

        ExecutionResult result = service.execute("wf", Map.of("input", "x"));

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getFailedPhase()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(result.getFailedTaskIndex()).isEqualTo(1);
        assertThat(result.getFailedTaskName()).isEqualTo("t2");
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TOOL_EXECUTION_ERROR);
        assertThat(result.getErrorMessage()).contains("boom");
        assertThat(result.getContext()).containsOnly(Map.entry("input", "x"), Map.entry("a", 1));
        assertThat(result.getCompletedTasks()).hasSize(1);
        assertThat(thirdCalls).hasValue(0);
    }

    @Test
    @DisplayName("Later writes to the same key win")
    void execute_keyCollision_lastWriteWins() {
        tool(new FunctionTool("first", ctx -> Map.of("x", 1)));
        tool(new FunctionTool("second", ctx -> Map.of("x", 2, "y", 3)));
        task("t1", "first");
        task("t2", "second");
        workflow("wf", TaskRef.of("t1", 0), TaskRef.of("t2", 1));

        ExecutionResult result = service.execute("wf", Map.of());

        assertThat(result.getContext()).containsOnly(Map.entry("x", 2), Map.entry("y", 3));
    }

    @Test
    void execute_toolMutatingSnapshot_fails_andCallerMapIsUntouched() {
        tool(new FunctionTool("mutator", ctx -> {
            ctx.put("sneaky", true);
            return Map.of();
        }));
        task("t1", "mutator");
        workflow("wf", TaskRef.of("t1", 0));
        Map<String, Object> initial = new HashMap<>(Map.of("k", "v"));

        ExecutionResult result = service.execute("wf", initial);

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TOOL_EXECUTION_ERROR);
        assertThat(initial).containsOnly(Map.entry("k", "v"));
    }

    @Test
    @DisplayName("A tool throwing an Error still yields a failed result with the partial context")
    void execute_toolThrowingError_returnsFailedResult() {
        tool(new FunctionTool("first", ctx -> Map.of("a", 1)));
        tool(new FunctionTool("buggy", ctx -> {
            throw new AssertionError("tool bug");
        }));
        task("t1", "first");
        task("t2", "buggy");
        workflow("wf", TaskRef.of("t1", 0), TaskRef.of("t2", 1));

        ExecutionResult result = service.execute("wf", Map.of());

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TOOL_EXECUTION_ERROR);
        assertThat(result.getErrorMessage()).contains("tool bug");
        assertThat(result.getFailedTaskName()).isEqualTo("t2");
        assertThat(result.getContext()).containsOnly(Map.entry("a", 1));
    }

    @Test
    void execute_toolThrowingError_sameResultWithTimeout() {
        properties.getExecution().setToolTimeout(Duration.ofSeconds(5));
        tool(new FunctionTool("buggy", ctx -> {
            throw new AssertionError("tool bug");
        }));
        task("t1", "buggy");
        workflow("wf", TaskRef.of("t1", 0));

        ExecutionResult result = service.execute("wf", Map.of());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TOOL_EXECUTION_ERROR);
        assertThat(result.getErrorMessage()).contains("tool bug");
        assertThat(result.getFailedTaskName()).isEqualTo("t1");
    }

    @Test
    void execute_toolReturningNull_fails() {
        tool(new FunctionTool("silent", ctx -> null));
        task("t1", "silent");
        workflow("wf", TaskRef.of("t1", 0));

        ExecutionResult result = service.execute("wf", Map.of());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TOOL_EXECUTION_ERROR);
        assertThat(result.getFailedTaskName()).isEqualTo("t1");
    }

    @Test
    void execute_emptyWorkflow_rejectedByDefault() {
        workflow("empty");

        ExecutionResult result = service.execute("empty", Map.of("k", 1));

        assertThat(result.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(result.getFailedPhase()).isEqualTo(ExecutionStatus.RESOLVING);
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.EMPTY_WORKFLOW);
        assertThat(result.getFailedTaskIndex()).isNull();
    }

    @Test
    void execute_emptyWorkflow_succeedsWhenConfigured() {
        properties.getExecution().setEmptyWorkflowPolicy(ExecutionProperties.EmptyWorkflowPolicy.SUCCEED);
        workflow("empty");

        ExecutionResult result = service.execute("empty", Map.of("k", 1));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getContext()).containsOnly(Map.entry("k", 1));
        assertThat(result.getCompletedTasks()).isEmpty();
    }

    @Test
    void execute_unknownWorkflow_failsWithNotFound() {
        ExecutionResult result = service.execute("missing", Map.of());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(result.getFailedPhase()).isEqualTo(ExecutionStatus.RESOLVING);
    }

    @Test
    @DisplayName("Two tasks at the same order fail before any tool runs")
    void execute_duplicateOrderFromStore_isAmbiguous() {
        GraphStore graphStore = mock(GraphStore.class);
        when(graphStore.getOrderedTasks("wf")).thenReturn(List.of(
            OrderedTask.builder().order(1).task(TaskDefinition.builder().name("a").build()).build(),
            OrderedTask.builder().order(1).task(TaskDefinition.builder().name("b").build()).build()));
        WorkflowExecutionServiceImpl mocked = newService(graphStore);

        ExecutionResult result = mocked.execute("wf", Map.of());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.AMBIGUOUS_ORDER);
        assertThat(result.getFailedPhase()).isEqualTo(ExecutionStatus.RESOLVING);
        verify(graphStore, never()).getToolForTask(anyString());
    }

    @Test
    void execute_afterToolDeleted_isUnresolved() {
        tool(new FunctionTool("first", ctx -> Map.of("a", 1)));
        task("t1", "first");
        workflow("wf", TaskRef.of("t1", 0));
        store.deleteTool("first");

        ExecutionResult result = service.execute("wf", Map.of());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TOOL_UNRESOLVED);
        assertThat(result.getFailedTaskName()).isEqualTo("t1");
    }

    @Test
    void execute_callableNotRegistered_isUnresolved() {
        store.saveTool(ToolDefinition.builder().name("orphan").callable("not.registered").build());
        task("t1", "orphan");
        workflow("wf", TaskRef.of("t1", 0));

        ExecutionResult result = service.execute("wf", Map.of());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TOOL_UNRESOLVED);
        assertThat(result.getErrorMessage()).contains("not.registered");
    }

    @Test
    void execute_slowTool_timesOut() {
        properties.getExecution().setToolTimeout(Duration.ofMillis(100));
        tool(new FunctionTool("slow", ctx -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Map.of("done", true);
        }));
        task("t1", "slow");
        workflow("wf", TaskRef.of("t1", 0));

        ExecutionResult result = service.execute("wf", Map.of());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TOOL_EXECUTION_ERROR);
        assertThat(result.getErrorMessage()).contains("timed out");
        assertThat(result.getContext()).doesNotContainKey("done");
    }

    @Test
    @DisplayName("Concurrent async executions do not see each other's context")
    void executeAsync_concurrentRuns_areIsolated() throws Exception {
        tool(new FunctionTool("echo", ctx -> Map.of("out", ctx.get("in"))));
        task("t1", "echo");
        workflow("wf", TaskRef.of("t1", 0));

        List<CompletableFuture<ExecutionResult>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            futures.add(service.executeAsync("wf", Map.of("in", i)));
        }

        for (int i = 0; i < futures.size(); i++) {
            ExecutionResult result = futures.get(i).get(10, TimeUnit.SECONDS);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getContext()).containsEntry("out", i);
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private WorkflowExecutionServiceImpl newService(GraphStore graphStore) {
        return new WorkflowExecutionServiceImpl(graphStore, registry, properties, workflowExecutor, toolExecutor);
    }

    private void tool(Invocable invocable) {
        registry.register(invocable);
        store.saveTool(ToolDefinition.builder().name(invocable.getName()).description(invocable.getDescription()).build());
    }

    private void task(String name, String toolName) {
        store.saveTask(TaskDefinition.builder().name(name).toolName(toolName).build());
    }

    private void workflow(String name, TaskRef... tasks) {
        store.saveWorkflow(WorkflowDefinition.builder().name(name).build(), List.of(tasks));
    }

    private static ThreadPoolTaskExecutor executor(String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }

    private static final class FunctionTool implements Invocable {

        private final String name;
        private final Function<Map<String, Object>, Map<String, Object>> body;

        private FunctionTool(String name, Function<Map<String, Object>, Map<String, Object>> body) {
            this.name = name;
            this.body = body;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Map<String, Object> invoke(Map<String, Object> context) {
            return body.apply(context);
        }
    }
}
