package com.purchasingpower.flowgraph.knowledge;

import com.purchasingpower.flowgraph.core.EntityKind;
import com.purchasingpower.flowgraph.core.OrderedTask;
import com.purchasingpower.flowgraph.core.RelationshipType;
import com.purchasingpower.flowgraph.core.ScoredKey;
import com.purchasingpower.flowgraph.core.TaskDefinition;
import com.purchasingpower.flowgraph.core.TaskRef;
import com.purchasingpower.flowgraph.core.ToolDefinition;
import com.purchasingpower.flowgraph.core.WorkflowDefinition;
import com.purchasingpower.flowgraph.core.WorkflowMembership;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interface for graph database operations.
 *
 * <p>Abstracts the property graph holding Workflow, Task and Tool nodes and the
 * CONTAINS / USES relationships between them. Every node is keyed by its unique
 * {@code name}; writing a node that already exists updates it in place.
 *
 * <p>Failure modes shared by all implementations:
 * <ul>
 *   <li>{@link com.purchasingpower.flowgraph.exception.NotFoundException} when a referenced name does not exist</li>
 *   <li>{@link com.purchasingpower.flowgraph.exception.ConstraintViolationException} when a uniqueness
 *       invariant (name, or order within a workflow) would be broken</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface GraphStore extends AutoCloseable {

    // =========================================================================
    // Generic Node / Relationship Operations
    // =========================================================================

    /**
     * Merge a node on (kind, name) and overwrite the given properties.
     *
     * @param kind Node label
     * @param key Unique name
     * @param properties Properties to set; {@code name} and {@code id} are managed by the store
     */
    void upsertNode(EntityKind kind, String key, Map<String, Object> properties);

    /**
     * Merge a relationship between two existing nodes.
     *
     * <p>USES replaces any existing USES edge of the task. CONTAINS merges the
     * (workflow, task) edge and requires an integer {@code order} property that
     * no other task of the workflow holds.
     *
     * @param fromKey Name of the source node
     * @param toKey Name of the target node
     * @param type Relationship type, which also fixes the endpoint labels
     * @param properties Relationship properties
     */
    void upsertRelationship(String fromKey, String toKey, RelationshipType type, Map<String, Object> properties);

    // =========================================================================
    // Typed Writes
    // =========================================================================

    void saveTool(ToolDefinition tool);

    /**
     * Store the task and point its single USES edge at {@code task.getToolName()}, in one write.
     */
    void saveTask(TaskDefinition task);

    /**
     * Store the workflow and replace its CONTAINS edges with {@code tasks}, in one write.
     * Concurrent saves of the same workflow name never interleave.
     */
    void saveWorkflow(WorkflowDefinition workflow, List<TaskRef> tasks);

    /**
     * Insert a task at {@code order}; existing edges at or after that order move up by one.
     */
    void addTaskToWorkflow(String workflowName, String taskName, int order);

    /**
     * Remove a task from a workflow; later edges move down by one.
     *
     * @return true if an edge was removed
     */
    boolean removeTaskFromWorkflow(String workflowName, String taskName);

    // =========================================================================
    // Reads
    // =========================================================================

    Optional<ToolDefinition> findTool(String name);

    Optional<TaskDefinition> findTask(String name);

    Optional<WorkflowDefinition> findWorkflow(String name);

    List<ToolDefinition> listTools();

    List<TaskDefinition> listTasks();

    List<WorkflowDefinition> listWorkflows();

    /**
     * Tasks of a workflow, ascending by CONTAINS order.
     *
     * @return empty list if the workflow has no tasks
     * @throws com.purchasingpower.flowgraph.exception.NotFoundException if the workflow does not exist
     */
    List<OrderedTask> getOrderedTasks(String workflowName);

    /**
     * Follow the USES edge of a task.
     *
     * @throws com.purchasingpower.flowgraph.exception.NotFoundException if the task, its edge or its tool is missing
     */
    ToolDefinition getToolForTask(String taskName);

    List<WorkflowMembership> findWorkflowsContaining(String taskName);

    List<String> findTasksUsingTool(String toolName);

    // =========================================================================
    // Index Queries
    // =========================================================================

    /**
     * Nearest neighbours of {@code vector} among nodes of {@code kind}, best first.
     * Scores are the backend's raw similarity.
     */
    List<ScoredKey> queryByEmbeddingSimilarity(EntityKind kind, List<Double> vector, int topK);

    /**
     * Full-text matches of {@code text} among nodes of {@code kind}, best first.
     * Scores are the backend's raw relevance.
     */
    List<ScoredKey> queryByFulltext(EntityKind kind, String text, int topK);

    // =========================================================================
    // Deletes
    // =========================================================================

    /**
     * Detach-delete a tool. Tasks that used it keep existing without a USES edge.
     *
     * @return true if the tool existed
     */
    boolean deleteTool(String name);

    /**
     * Detach-delete a task that no workflow contains.
     *
     * @return true if the task existed
     * @throws com.purchasingpower.flowgraph.exception.ConstraintViolationException if a workflow still contains it
     */
    boolean deleteTask(String name);

    /**
     * @return true if the workflow existed
     */
    boolean deleteWorkflow(String name);

    /**
     * Release the backend connection. Calling it twice is harmless.
     */
    @Override
    void close();
}
