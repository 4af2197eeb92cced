package com.purchasingpower.flowgraph.api;

import com.purchasingpower.flowgraph.core.EntityKind;
import com.purchasingpower.flowgraph.core.TaskDefinition;
import com.purchasingpower.flowgraph.core.ToolDefinition;
import com.purchasingpower.flowgraph.core.WorkflowDefinition;
import com.purchasingpower.flowgraph.model.catalog.WorkflowDetails;
import com.purchasingpower.flowgraph.service.WorkflowCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.function.Supplier;

/**
 * REST controller for tools, tasks and workflows.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CatalogController {

    private final WorkflowCatalogService catalogService;

    // =========================================================================
    // Tools
    // =========================================================================

    /**
     * POST /api/v1/tools
     */
    @PostMapping("/tools")
    public ResponseEntity<ApiResponse<ToolDefinition>> createTool(@RequestBody ToolRequest request) {
        if (isBlank(request.getName())) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Tool name is required"));
        }
        return handle("Create tool " + request.getName(), HttpStatus.CREATED,
            () -> catalogService.createTool(request.getName(), request.getDescription(), request.getCallable()));
    }

    @GetMapping("/tools")
    public ResponseEntity<ApiResponse<List<ToolDefinition>>> listTools() {
        return handle("List tools", HttpStatus.OK, catalogService::listTools);
    }

    @DeleteMapping("/tools/{name}")
    public ResponseEntity<ApiResponse<Void>> deleteTool(@PathVariable String name) {
        return handle("Delete tool " + name, HttpStatus.OK, () -> {
            catalogService.deleteTool(name);
            return null;
        });
    }

    // =========================================================================
    // Tasks
    // =========================================================================

    /**
     * POST /api/v1/tasks
     */
    @PostMapping("/tasks")
    public ResponseEntity<ApiResponse<TaskDefinition>> createTask(@RequestBody TaskRequest request) {
        if (isBlank(request.getName()) || isBlank(request.getTool())) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Task name and tool are required"));
        }
        return handle("Create task " + request.getName(), HttpStatus.CREATED,
            () -> catalogService.createTask(request.getName(), request.getDescription(), request.getTool()));
    }

    @GetMapping("/tasks")
    public ResponseEntity<ApiResponse<List<TaskDefinition>>> listTasks() {
        return handle("List tasks", HttpStatus.OK, catalogService::listTasks);
    }

    @GetMapping("/tasks/{name}")
    public ResponseEntity<ApiResponse<TaskDefinition>> getTask(@PathVariable String name) {
        return handle("Get task " + name, HttpStatus.OK, () -> catalogService.getTask(name));
    }

    @DeleteMapping("/tasks/{name}")
    public ResponseEntity<ApiResponse<Void>> deleteTask(@PathVariable String name) {
        return handle("Delete task " + name, HttpStatus.OK, () -> {
            catalogService.deleteTask(name);
            return null;
        });
    }

    // =========================================================================
    // Workflows
    // =========================================================================

    /**
     * POST /api/v1/workflows
     */
    @PostMapping("/workflows")
    public ResponseEntity<ApiResponse<WorkflowDetails>> createWorkflow(@RequestBody WorkflowRequest request) {
        if (isBlank(request.getName())) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Workflow name is required"));
        }
        if (request.getTasks() != null && request.getTasks().stream()
            .anyMatch(ref -> ref == null || isBlank(ref.getName()) || ref.getOrder() == null)) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Every task needs a name and an order"));
        }
        return handle("Create workflow " + request.getName(), HttpStatus.CREATED,
            () -> catalogService.createWorkflow(request.getName(), request.getDescription(), request.getTasks()));
    }

    @GetMapping("/workflows")
    public ResponseEntity<ApiResponse<List<WorkflowDefinition>>> listWorkflows() {
        return handle("List workflows", HttpStatus.OK, catalogService::listWorkflows);
    }

    @GetMapping("/workflows/{name}")
    public ResponseEntity<ApiResponse<WorkflowDetails>> getWorkflow(@PathVariable String name) {
        return handle("Get workflow " + name, HttpStatus.OK, () -> catalogService.getWorkflow(name));
    }

    @DeleteMapping("/workflows/{name}")
    public ResponseEntity<ApiResponse<Void>> deleteWorkflow(@PathVariable String name) {
        return handle("Delete workflow " + name, HttpStatus.OK, () -> {
            catalogService.deleteWorkflow(name);
            return null;
        });
    }

    /**
     * POST /api/v1/workflows/{name}/tasks
     */
    @PostMapping("/workflows/{name}/tasks")
    public ResponseEntity<ApiResponse<WorkflowDetails>> addTask(@PathVariable String name,
                                                                @RequestBody WorkflowTaskRequest request) {
        if (isBlank(request.getTask()) || request.getOrder() == null) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Task name and order are required"));
        }
        return handle("Add task " + request.getTask() + " to " + name, HttpStatus.OK,
            () -> catalogService.addTaskToWorkflow(name, request.getTask(), request.getOrder()));
    }

    @DeleteMapping("/workflows/{name}/tasks/{task}")
    public ResponseEntity<ApiResponse<WorkflowDetails>> removeTask(@PathVariable String name,
                                                                   @PathVariable String task) {
        return handle("Remove task " + task + " from " + name, HttpStatus.OK,
            () -> catalogService.removeTaskFromWorkflow(name, task));
    }

    /**
     * Recompute the embedding of an entity.
     *
     * POST /api/v1/reindex/{kind}/{name}
     */
    @PostMapping("/reindex/{kind}/{name}")
    public ResponseEntity<ApiResponse<Void>> reindex(@PathVariable String kind, @PathVariable String name) {
        return handle("Reindex " + kind + " " + name, HttpStatus.OK, () -> {
            catalogService.reindex(EntityKind.fromString(kind), name);
            return null;
        });
    }

    private <T> ResponseEntity<ApiResponse<T>> handle(String operation, HttpStatus success, Supplier<T> action) {
        try {
            return ResponseEntity.status(success).body(ApiResponse.success(action.get()));
        } catch (Exception e) {
            HttpStatus status = ApiErrors.statusOf(e);
            if (status.is5xxServerError()) {
                log.error("{} failed", operation, e);
            } else {
                log.warn("{} rejected: {}", operation, e.getMessage());
            }
            return ResponseEntity.status(status).body(ApiResponse.error(e));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
