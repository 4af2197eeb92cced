package com.purchasingpower.flowgraph.api;

import com.purchasingpower.flowgraph.core.EntityKind;
import com.purchasingpower.flowgraph.search.SearchHit;
import com.purchasingpower.flowgraph.service.WorkflowCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for search API.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class SearchController {

    private final WorkflowCatalogService catalogService;

    /**
     * Hybrid search.
     *
     * POST /api/v1/search
     */
    @PostMapping
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        try {
            if (request.getQuery() == null || request.getQuery().isBlank()) {
                return ResponseEntity.badRequest()
                    .body(SearchResponse.error("Query is required"));
            }

            EntityKind kind = EntityKind.fromString(request.getKind() != null ? request.getKind() : "WORKFLOW");
            int topK = request.getTopK() != null ? request.getTopK() : 0;

            log.info("Search {}: {}", kind, request.getQuery());
            List<SearchHit> hits = catalogService.search(kind, request.getQuery(), topK);

            return ResponseEntity.ok(SearchResponse.success(hits));

        } catch (Exception e) {
            HttpStatus status = ApiErrors.statusOf(e);
            if (status.is5xxServerError()) {
                log.error("Search failed", e);
            } else {
                log.warn("Search rejected: {}", e.getMessage());
            }
            return ResponseEntity.status(status)
                .body(SearchResponse.error("Search failed: " + e.getMessage()));
        }
    }
}
