package com.purchasingpower.flowgraph.api;

import com.purchasingpower.flowgraph.model.execution.ExecutionResult;
import com.purchasingpower.flowgraph.service.WorkflowCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for running workflows.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
public class ExecutionController {

    private final WorkflowCatalogService catalogService;

    /**
     * Run a workflow to completion.
     *
     * POST /api/v1/workflows/{name}/execute
     *
     * <p>A failed execution still returns its partial context; the status code
     * follows the failure cause.
     */
    @PostMapping("/{name}/execute")
    public ResponseEntity<ExecutionResponse> execute(@PathVariable String name,
                                                     @RequestBody(required = false) ExecuteRequest request) {
        try {
            Map<String, Object> context = request != null && request.getContext() != null
                ? request.getContext()
                : Map.of();

            ExecutionResult result = catalogService.executeWorkflow(name, context);
            ExecutionResponse response = ExecutionResponse.from(result);

            if (result.isSuccess()) {
                return ResponseEntity.ok(response);
            }
            return ResponseEntity.status(ApiErrors.statusOf(result.getError())).body(response);

        } catch (Exception e) {
            log.error("Execution of workflow '{}' failed", name, e);
            return ResponseEntity.status(ApiErrors.statusOf(e))
                .body(ExecutionResponse.error(name, "Execution failed: " + e.getMessage()));
        }
    }
}
