package com.purchasingpower.flowgraph.service.impl;

import com.purchasingpower.flowgraph.agent.Invocable;
import com.purchasingpower.flowgraph.agent.ToolRegistry;
import com.purchasingpower.flowgraph.configuration.ExecutionProperties;
import com.purchasingpower.flowgraph.configuration.FlowGraphProperties;
import com.purchasingpower.flowgraph.core.OrderedTask;
import com.purchasingpower.flowgraph.core.ToolDefinition;
import com.purchasingpower.flowgraph.exception.AmbiguousOrderException;
import com.purchasingpower.flowgraph.exception.EmptyWorkflowException;
import com.purchasingpower.flowgraph.exception.FlowGraphException;
import com.purchasingpower.flowgraph.exception.NotFoundException;
import com.purchasingpower.flowgraph.exception.ToolExecutionException;
import com.purchasingpower.flowgraph.exception.ToolUnresolvedException;
import com.purchasingpower.flowgraph.knowledge.GraphStore;
import com.purchasingpower.flowgraph.model.execution.ExecutionResult;
import com.purchasingpower.flowgraph.model.execution.ExecutionStatus;
import com.purchasingpower.flowgraph.model.execution.TaskExecutionRecord;
import com.purchasingpower.flowgraph.service.WorkflowExecutionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ordered workflow execution.
 *
 * <p>Holds no per-execution state: every call builds its own context snapshots,
 * so concurrent executions share nothing but the store and the tool registry.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class WorkflowExecutionServiceImpl implements WorkflowExecutionService {

    private final GraphStore graphStore;
    private final ToolRegistry toolRegistry;
    private final ExecutionProperties properties;
    private final Executor workflowExecutor;
    private final AsyncTaskExecutor toolExecutor;

    public WorkflowExecutionServiceImpl(GraphStore graphStore,
                                        ToolRegistry toolRegistry,
                                        FlowGraphProperties properties,
                                        @Qualifier("workflowExecutor") Executor workflowExecutor,
                                        @Qualifier("toolExecutor") AsyncTaskExecutor toolExecutor) {
        this.graphStore = graphStore;
        this.toolRegistry = toolRegistry;
        this.properties = properties.getExecution();
        this.workflowExecutor = workflowExecutor;
        this.toolExecutor = toolExecutor;
    }

    @Override
    public ExecutionResult execute(String workflowName, Map<String, Object> initialContext) {
        Instant startedAt = Instant.now();
        Map<String, Object> context = snapshot(initialContext != null ? initialContext : Map.of());

        log.info("Executing workflow '{}' with {} context variable(s)", workflowName, context.size());

        // RESOLVING
        List<OrderedTask> tasks;
        try {
            tasks = resolveTasks(workflowName);
        } catch (FlowGraphException e) {
            log.warn("Workflow '{}' failed while resolving: {}", workflowName, e.getMessage());
            return ExecutionResult.builder()
                .workflowName(workflowName)
                .status(ExecutionStatus.FAILED)
                .failedPhase(ExecutionStatus.RESOLVING)
                .context(context)
                .error(e)
                .startedAt(startedAt)
                .finishedAt(Instant.now())
                .build();
        }

        // RUNNING
        List<TaskExecutionRecord> completed = new ArrayList<>();
        for (int index = 0; index < tasks.size(); index++) {
            OrderedTask task = tasks.get(index);
            String taskName = task.getTaskName();
            log.debug("[{}] Running task {}/{}: '{}' (order {})",
                workflowName, index + 1, tasks.size(), taskName, task.getOrder());

            try {
                long start = System.nanoTime();
                ToolDefinition tool = resolveTool(taskName);
                Invocable invocable = resolveInvocable(taskName, tool);

                Map<String, Object> output = invoke(invocable, tool.getName(), context);
                context = merge(context, output);

                completed.add(TaskExecutionRecord.builder()
                    .index(index)
                    .order(task.getOrder())
                    .taskName(taskName)
                    .toolName(tool.getName())
                    .durationMillis(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
                    .outputKeys(Collections.unmodifiableSet(new LinkedHashSet<>(output.keySet())))
                    .build());

            } catch (FlowGraphException e) {
                log.error("Workflow '{}' failed at task {} '{}': {}", workflowName, index, taskName, e.getMessage());
                return ExecutionResult.builder()
                    .workflowName(workflowName)
                    .status(ExecutionStatus.FAILED)
                    .failedPhase(ExecutionStatus.RUNNING)
                    .context(context)
                    .failedTaskIndex(index)
                    .failedTaskName(taskName)
                    .error(e)
                    .completedTasks(completed)
                    .startedAt(startedAt)
                    .finishedAt(Instant.now())
                    .build();
            }
        }

        ExecutionResult result = ExecutionResult.builder()
            .workflowName(workflowName)
            .status(ExecutionStatus.COMPLETED)
            .context(context)
            .completedTasks(completed)
            .startedAt(startedAt)
            .finishedAt(Instant.now())
            .build();

        log.info("Workflow '{}' completed: {} task(s) in {} ms",
            workflowName, completed.size(), result.getDuration().toMillis());
        return result;
    }

    @Override
    public CompletableFuture<ExecutionResult> executeAsync(String workflowName, Map<String, Object> initialContext) {
        log.info("Submitting workflow '{}' to async executor", workflowName);
        return CompletableFuture.supplyAsync(() -> execute(workflowName, initialContext), workflowExecutor);
    }

    /**
     * Fetch the task sequence and check it can be run deterministically.
     */
    private List<OrderedTask> resolveTasks(String workflowName) {
        List<OrderedTask> tasks = new ArrayList<>(graphStore.getOrderedTasks(workflowName));

        if (tasks.isEmpty()) {
            if (properties.getEmptyWorkflowPolicy() == ExecutionProperties.EmptyWorkflowPolicy.REJECT) {
                throw new EmptyWorkflowException(workflowName);
            }
            log.info("Workflow '{}' has no tasks, completing without running anything", workflowName);
            return tasks;
        }

        tasks.sort(Comparator.comparingInt(OrderedTask::getOrder));
        for (int i = 1; i < tasks.size(); i++) {
            OrderedTask previous = tasks.get(i - 1);
            OrderedTask current = tasks.get(i);
            if (previous.getOrder() == current.getOrder()) {
                throw new AmbiguousOrderException(workflowName, current.getOrder(),
                    previous.getTaskName(), current.getTaskName());
            }
        }
        return tasks;
    }

    private ToolDefinition resolveTool(String taskName) {
        try {
            return graphStore.getToolForTask(taskName);
        } catch (NotFoundException e) {
            throw new ToolUnresolvedException(taskName, "No tool bound to task '" + taskName + "'", e);
        }
    }

    private Invocable resolveInvocable(String taskName, ToolDefinition tool) {
        String callable = tool.resolveCallable();
        return toolRegistry.find(callable).orElseThrow(() -> new ToolUnresolvedException(taskName,
            String.format("Tool '%s' of task '%s' refers to unregistered callable '%s'",
                tool.getName(), taskName, callable)));
    }

    private Map<String, Object> invoke(Invocable invocable, String toolName, Map<String, Object> context) {
        Map<String, Object> output = properties.hasToolTimeout()
            ? invokeWithTimeout(invocable, toolName, context)
            : invokeInline(invocable, toolName, context);

        if (output == null) {
            throw new ToolExecutionException(toolName, "Tool '" + toolName + "' returned no context");
        }
        return output;
    }

    private Map<String, Object> invokeInline(Invocable invocable, String toolName, Map<String, Object> context) {
        try {
            return invocable.invoke(context);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            // Same outcome as a failure surfaced through the tool executor's future
            throw new ToolExecutionException(toolName, "Tool '" + toolName + "' failed: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> invokeWithTimeout(Invocable invocable, String toolName, Map<String, Object> context) {
        Future<Map<String, Object>> future = toolExecutor.submit(() -> invocable.invoke(context));
        try {
            return future.get(properties.getToolTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolExecutionException(toolName,
                "Tool '" + toolName + "' timed out after " + properties.getToolTimeout().toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ToolExecutionException(toolName, "Tool '" + toolName + "' failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(toolName, "Interrupted while waiting for tool '" + toolName + "'", e);
        }
    }

    /**
     * Next context snapshot: previous keys overlaid with the task output, last write wins.
     */
    private static Map<String, Object> merge(Map<String, Object> previous, Map<String, Object> output) {
        Map<String, Object> next = new LinkedHashMap<>(previous);
        next.putAll(output);
        return Collections.unmodifiableMap(next);
    }

    private static Map<String, Object> snapshot(Map<String, Object> context) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
