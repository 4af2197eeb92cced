package com.purchasingpower.flowgraph.service;

import com.purchasingpower.flowgraph.model.execution.ExecutionResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a workflow's tasks in CONTAINS order, threading one context through their tools.
 *
 * <p>Tasks run strictly one after another: each task's input is the full output
 * of all earlier tasks. Independent executions may run concurrently.
 *
 * @since 1.0.0
 */
public interface WorkflowExecutionService {

    /**
     * Execute a workflow.
     *
     * <p>Execution-time errors (missing or empty workflow, ambiguous order,
     * unresolved tool, tool failure) never escape as exceptions; they come back
     * as a FAILED result carrying the partial context and the failing task.
     * There is no retry and no best-effort continuation after a failure.
     *
     * <p>Key collisions between task outputs resolve last-write-wins: the value
     * returned by the task executed last prevails.
     *
     * @param workflowName Workflow to run
     * @param initialContext Initial variables; may be null
     * @return COMPLETED or FAILED result
     */
    ExecutionResult execute(String workflowName, Map<String, Object> initialContext);

    /**
     * {@link #execute} on the workflow thread pool.
     */
    CompletableFuture<ExecutionResult> executeAsync(String workflowName, Map<String, Object> initialContext);
}
