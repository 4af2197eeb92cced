package com.purchasingpower.flowgraph.service;

import com.purchasingpower.flowgraph.core.EntityKind;
import com.purchasingpower.flowgraph.core.TaskDefinition;
import com.purchasingpower.flowgraph.core.TaskRef;
import com.purchasingpower.flowgraph.core.ToolDefinition;
import com.purchasingpower.flowgraph.core.WorkflowDefinition;
import com.purchasingpower.flowgraph.model.catalog.WorkflowDetails;
import com.purchasingpower.flowgraph.model.execution.ExecutionResult;
import com.purchasingpower.flowgraph.search.SearchHit;

import java.util.List;
import java.util.Map;

/**
 * Public operations over the workflow catalog.
 *
 * <p>Every create embeds the entity's text first and only then writes the node,
 * so a failing embedding provider leaves the graph untouched. Creating an entity
 * whose name already exists updates it in place.
 *
 * @since 1.0.0
 */
public interface WorkflowCatalogService extends AutoCloseable {

    /**
     * Create or update a tool.
     *
     * @param callable Registry key of the implementation; null keeps the current one, or the name for new tools
     * @throws com.purchasingpower.flowgraph.exception.ConstraintViolationException if an existing tool would
     *         be re-pointed at another callable
     */
    ToolDefinition createTool(String name, String description, String callable);

    /**
     * Create or update a task bound to an existing tool.
     *
     * @throws com.purchasingpower.flowgraph.exception.NotFoundException if the tool does not exist
     */
    TaskDefinition createTask(String name, String description, String toolName);

    /**
     * Create a workflow, or replace its description and whole task list.
     *
     * @throws com.purchasingpower.flowgraph.exception.ConstraintViolationException on duplicate tasks or orders
     * @throws com.purchasingpower.flowgraph.exception.NotFoundException if a referenced task does not exist
     */
    WorkflowDetails createWorkflow(String name, String description, List<TaskRef> tasks);

    List<ToolDefinition> listTools();

    List<TaskDefinition> listTasks();

    List<WorkflowDefinition> listWorkflows();

    TaskDefinition getTask(String name);

    WorkflowDetails getWorkflow(String name);

    /**
     * Insert a task into a workflow; tasks at or after {@code order} move up by one.
     */
    WorkflowDetails addTaskToWorkflow(String workflowName, String taskName, int order);

    /**
     * Remove a task from a workflow; later tasks move down by one.
     */
    WorkflowDetails removeTaskFromWorkflow(String workflowName, String taskName);

    void deleteTool(String name);

    /**
     * @throws com.purchasingpower.flowgraph.exception.ConstraintViolationException while a workflow contains the task
     */
    void deleteTask(String name);

    void deleteWorkflow(String name);

    /**
     * Recompute the embedding of an existing entity.
     */
    void reindex(EntityKind kind, String name);

    ExecutionResult executeWorkflow(String name, Map<String, Object> context);

    List<SearchHit> search(EntityKind kind, String query, int topK);

    /**
     * Release the store connection. Further calls do nothing.
     */
    @Override
    void close();
}
