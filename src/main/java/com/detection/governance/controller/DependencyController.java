package com.detection.governance.controller;

import com.detection.governance.dto.DependencyRequest;
import com.detection.governance.dto.graph.GraphIntegrityReport;
import com.detection.governance.dto.graph.ItemGraphResponse;
import com.detection.governance.model.ContentItem;
import com.detection.governance.service.graph.DependencyGraphManager;
import com.detection.governance.service.graph.GraphConsistencyChecker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.detection.governance.controller.ContentItemController.ACTOR_HEADER;

/**
 * Dependency edges between content items and graph integrity reporting.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class DependencyController {

    private final DependencyGraphManager graphManager;
    private final GraphConsistencyChecker consistencyChecker;

    /**
     * Add an edge. Responds 409 with the offending cycle when the edge would close one.
     */
    @PostMapping("/content/{id}/dependencies")
    public ResponseEntity<ContentItem> addDependency(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id,
            @Valid @RequestBody DependencyRequest request) {
        return ResponseEntity.ok(graphManager.addDependency(id, request.getDependsOnId(), actor));
    }

    @DeleteMapping("/content/{id}/dependencies/{dependsOnId}")
    public ResponseEntity<ContentItem> removeDependency(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id,
            @PathVariable String dependsOnId) {
        return ResponseEntity.ok(graphManager.removeDependency(id, dependsOnId, actor));
    }

    @GetMapping("/content/{id}/graph")
    public ResponseEntity<ItemGraphResponse> getGraph(@PathVariable String id) {
        return ResponseEntity.ok(graphManager.getGraph(id));
    }

    @GetMapping("/graph/integrity")
    public ResponseEntity<GraphIntegrityReport> checkIntegrity() {
        log.info("Running on-demand graph integrity check");
        return ResponseEntity.ok(consistencyChecker.check());
    }
}
