package com.detection.governance.controller;

import com.detection.governance.dto.CreateBranchRequest;
import com.detection.governance.dto.PullRequestRequest;
import com.detection.governance.dto.ReviewRequest;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.ReviewStatus;
import com.detection.governance.service.workflow.ContentWorkflowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.detection.governance.controller.ContentItemController.ACTOR_HEADER;

/**
 * Branch, pull request, review, merge and fork operations on a single content item.
 */
@RestController
@RequestMapping("/api/content/{id}")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final ContentWorkflowService workflowService;

    /**
     * Create a branch copy of the item. The source item is not modified.
     */
    @PostMapping("/branches")
    public ResponseEntity<ContentItem> createBranch(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id,
            @Valid @RequestBody CreateBranchRequest request) {
        ContentItem branch = workflowService.createBranch(id, request.getBranchName(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(branch);
    }

    @PostMapping("/pull-requests")
    public ResponseEntity<ContentItem> createPullRequest(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id,
            @RequestBody(required = false) PullRequestRequest request) {
        PullRequestRequest body = request == null ? new PullRequestRequest() : request;
        ContentItem item = workflowService.createPullRequest(id, body.getTargetBranch(), body.getDescription(), actor);
        return ResponseEntity.ok(item);
    }

    @PostMapping("/reviews")
    public ResponseEntity<ContentItem> reviewContent(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id,
            @Valid @RequestBody ReviewRequest request) {
        ReviewStatus status = ReviewStatus.fromValue(request.getStatus());
        return ResponseEntity.ok(workflowService.reviewContent(id, status, request.getComment(), actor));
    }

    /**
     * Merge an approved item into main. Responds 409 when the item has not been approved.
     */
    @PostMapping("/merge")
    public ResponseEntity<ContentItem> mergeContent(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id) {
        return ResponseEntity.ok(workflowService.mergeContent(id, actor));
    }

    @PostMapping("/forks")
    public ResponseEntity<ContentItem> forkContent(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id) {
        ContentItem fork = workflowService.forkContent(id, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(fork);
    }
}
