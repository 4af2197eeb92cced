package com.purchasingpower.flowgraph.service.impl;

import com.purchasingpower.flowgraph.core.EntityKind;
import com.purchasingpower.flowgraph.core.TaskDefinition;
import com.purchasingpower.flowgraph.core.TaskRef;
import com.purchasingpower.flowgraph.core.ToolDefinition;
import com.purchasingpower.flowgraph.core.WorkflowDefinition;
import com.purchasingpower.flowgraph.exception.ConstraintViolationException;
import com.purchasingpower.flowgraph.exception.NotFoundException;
import com.purchasingpower.flowgraph.knowledge.GraphStore;
import com.purchasingpower.flowgraph.knowledge.IndexingService;
import com.purchasingpower.flowgraph.knowledge.TaskRefValidator;
import com.purchasingpower.flowgraph.model.catalog.WorkflowDetails;
import com.purchasingpower.flowgraph.model.execution.ExecutionResult;
import com.purchasingpower.flowgraph.search.SearchHit;
import com.purchasingpower.flowgraph.search.SearchService;
import com.purchasingpower.flowgraph.service.WorkflowCatalogService;
import com.purchasingpower.flowgraph.service.WorkflowExecutionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowCatalogServiceImpl implements WorkflowCatalogService {

    private final GraphStore graphStore;
    private final IndexingService indexingService;
    private final WorkflowExecutionService executionService;
    private final SearchService searchService;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Override
    public ToolDefinition createTool(String name, String description, String callable) {
        requireName("Tool", name);

        Optional<ToolDefinition> existing = graphStore.findTool(name);
        String resolvedCallable = callable;
        if (existing.isPresent()) {
            String current = existing.get().resolveCallable();
            if (callable != null && !callable.isBlank() && !callable.equals(current)) {
                throw new ConstraintViolationException(String.format(
                    "Tool '%s' is bound to callable '%s' and cannot be re-pointed to '%s'", name, current, callable));
            }
            resolvedCallable = current;
        }

        ToolDefinition tool = ToolDefinition.builder()
            .name(name)
            .description(description)
            .callable(resolvedCallable)
            .build();
        tool.setEmbedding(indexingService.embed(EntityKind.TOOL, name, tool.indexText()).orElse(null));

        graphStore.saveTool(tool);
        log.info("{} tool '{}' (callable '{}')", existing.isPresent() ? "Updated" : "Created", name, tool.resolveCallable());
        return graphStore.findTool(name).orElseThrow(() -> new NotFoundException(EntityKind.TOOL, name));
    }

    @Override
    public TaskDefinition createTask(String name, String description, String toolName) {
        requireName("Task", name);
        requireName("Tool", toolName);
        if (graphStore.findTool(toolName).isEmpty()) {
            throw new NotFoundException(EntityKind.TOOL, toolName);
        }

        TaskDefinition task = TaskDefinition.builder()
            .name(name)
            .description(description)
            .toolName(toolName)
            .build();
        task.setEmbedding(indexingService.embed(EntityKind.TASK, name, task.indexText()).orElse(null));

        graphStore.saveTask(task);
        log.info("Saved task '{}' using tool '{}'", name, toolName);
        return getTask(name);
    }

    @Override
    public WorkflowDetails createWorkflow(String name, String description, List<TaskRef> tasks) {
        requireName("Workflow", name);
        TaskRefValidator.validate(name, tasks);
        for (TaskRef ref : tasks) {
            if (graphStore.findTask(ref.getName()).isEmpty()) {
                throw new NotFoundException(EntityKind.TASK, ref.getName());
            }
        }

        WorkflowDefinition workflow = WorkflowDefinition.builder()
            .name(name)
            .description(description)
            .build();
        workflow.setEmbedding(indexingService.embed(EntityKind.WORKFLOW, name, workflow.indexText()).orElse(null));

        graphStore.saveWorkflow(workflow, tasks);
        log.info("Saved workflow '{}' with {} task(s)", name, tasks.size());
        return getWorkflow(name);
    }

    @Override
    public List<ToolDefinition> listTools() {
        return graphStore.listTools();
    }

    @Override
    public List<TaskDefinition> listTasks() {
        return graphStore.listTasks();
    }

    @Override
    public List<WorkflowDefinition> listWorkflows() {
        return graphStore.listWorkflows();
    }

    @Override
    public TaskDefinition getTask(String name) {
        return graphStore.findTask(name).orElseThrow(() -> new NotFoundException(EntityKind.TASK, name));
    }

    @Override
    public WorkflowDetails getWorkflow(String name) {
        WorkflowDefinition workflow = graphStore.findWorkflow(name)
            .orElseThrow(() -> new NotFoundException(EntityKind.WORKFLOW, name));
        return WorkflowDetails.builder()
            .workflow(workflow)
            .tasks(graphStore.getOrderedTasks(name))
            .build();
    }

    @Override
    public WorkflowDetails addTaskToWorkflow(String workflowName, String taskName, int order) {
        graphStore.addTaskToWorkflow(workflowName, taskName, order);
        log.info("Added task '{}' to workflow '{}' at order {}", taskName, workflowName, order);
        return getWorkflow(workflowName);
    }

    @Override
    public WorkflowDetails removeTaskFromWorkflow(String workflowName, String taskName) {
        if (!graphStore.removeTaskFromWorkflow(workflowName, taskName)) {
            throw new NotFoundException(EntityKind.TASK, taskName,
                "Task '" + taskName + "' is not part of workflow '" + workflowName + "'");
        }
        log.info("Removed task '{}' from workflow '{}'", taskName, workflowName);
        return getWorkflow(workflowName);
    }

    @Override
    public void deleteTool(String name) {
        List<String> users = graphStore.findTasksUsingTool(name);
        if (!graphStore.deleteTool(name)) {
            throw new NotFoundException(EntityKind.TOOL, name);
        }
        if (!users.isEmpty()) {
            log.warn("Deleted tool '{}' still used by task(s) {}", name, users);
        } else {
            log.info("Deleted tool '{}'", name);
        }
    }

    @Override
    public void deleteTask(String name) {
        if (!graphStore.deleteTask(name)) {
            throw new NotFoundException(EntityKind.TASK, name);
        }
        log.info("Deleted task '{}'", name);
    }

    @Override
    public void deleteWorkflow(String name) {
        if (!graphStore.deleteWorkflow(name)) {
            throw new NotFoundException(EntityKind.WORKFLOW, name);
        }
        log.info("Deleted workflow '{}'", name);
    }

    @Override
    public void reindex(EntityKind kind, String name) {
        indexingService.reindex(kind, name);
    }

    @Override
    public ExecutionResult executeWorkflow(String name, Map<String, Object> context) {
        return executionService.execute(name, context);
    }

    @Override
    public List<SearchHit> search(EntityKind kind, String query, int topK) {
        return searchService.search(kind, query, topK);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing workflow catalog");
            graphStore.close();
        }
    }

    private static void requireName(String label, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(label + " name is required");
        }
    }
}
