package com.detection.governance.controller;

import com.detection.governance.dto.AdvancePhaseRequest;
import com.detection.governance.dto.PhaseInfo;
import com.detection.governance.dto.PhaseTransitionRequest;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.DdlcPhase;
import com.detection.governance.model.TestResult;
import com.detection.governance.service.lifecycle.DdlcPhaseTracker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.detection.governance.controller.ContentItemController.ACTOR_HEADER;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PhaseController {

    private final DdlcPhaseTracker phaseTracker;

    @PostMapping("/content/{id}/phase/advance")
    public ResponseEntity<ContentItem> advancePhase(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id,
            @RequestBody(required = false) AdvancePhaseRequest request) {
        String notes = request == null ? null : request.getNotes();
        return ResponseEntity.ok(phaseTracker.advancePhase(id, actor, notes));
    }

    @PostMapping("/content/{id}/phase/transition")
    public ResponseEntity<ContentItem> transitionToPhase(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id,
            @Valid @RequestBody PhaseTransitionRequest request) {
        DdlcPhase target = DdlcPhase.fromValue(request.getTargetPhase());
        return ResponseEntity.ok(phaseTracker.transitionToPhase(id, target, actor, request.getNotes()));
    }

    @PutMapping("/content/{id}/tests")
    public ResponseEntity<ContentItem> recordTestResults(
            @RequestHeader(ACTOR_HEADER) String actor,
            @PathVariable String id,
            @RequestBody List<TestResult> results) {
        return ResponseEntity.ok(phaseTracker.recordTestResults(id, results, actor));
    }

    @GetMapping("/ddlc/phases")
    public ResponseEntity<List<PhaseInfo>> getPhaseCatalog() {
        return ResponseEntity.ok(phaseTracker.getPhaseCatalog());
    }
}
