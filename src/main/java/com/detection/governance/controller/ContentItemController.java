package com.detection.governance.controller;

import com.detection.governance.dto.CreateContentItemRequest;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.ContentStatus;
import com.detection.governance.model.ContentType;
import com.detection.governance.model.DdlcPhase;
import com.detection.governance.model.ReviewStatus;
import com.detection.governance.service.ContentItemService;
import com.detection.governance.store.ContentItemFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/content")
@RequiredArgsConstructor
@Slf4j
public class ContentItemController {

    static final String ACTOR_HEADER = "X-Actor";

    private final ContentItemService contentItemService;

    @PostMapping
    public ResponseEntity<ContentItem> registerItem(
            @RequestHeader(ACTOR_HEADER) String actor,
            @Valid @RequestBody CreateContentItemRequest request) {
        ContentItem item = contentItemService.registerItem(request, actor);
        return new ResponseEntity<>(item, HttpStatus.CREATED);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContentItem> getItem(@PathVariable String id) {
        return ResponseEntity.ok(contentItemService.getItem(id));
    }

    @GetMapping
    public ResponseEntity<List<ContentItem>> listItems(
            @RequestParam(required = false) String contentType,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String phase,
            @RequestParam(required = false) String branch,
            @RequestParam(required = false) String reviewStatus) {

        ContentItemFilter filter = ContentItemFilter.builder()
                .contentType(contentType == null ? null : ContentType.fromValue(contentType))
                .status(status == null ? null : ContentStatus.fromValue(status))
                .category(category)
                .severity(severity)
                .ddlcPhase(phase == null ? null : DdlcPhase.fromValue(phase))
                .branch(branch)
                .reviewStatus(reviewStatus == null ? null : ReviewStatus.fromValue(reviewStatus))
                .build();
        return ResponseEntity.ok(contentItemService.listItems(filter));
    }

    @GetMapping("/search")
    public ResponseEntity<List<ContentItem>> searchItems(@RequestParam("q") String query) {
        log.info("Searching content items for '{}'", query);
        return ResponseEntity.ok(contentItemService.searchItems(query));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteItem(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id) {
        contentItemService.deleteItem(id, actor);
        return ResponseEntity.noContent().build();
    }
}
