package com.detection.governance.service.lifecycle;

import com.detection.governance.dto.PhaseInfo;
import com.detection.governance.exception.InvalidTransitionException;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.DdlcMetadata;
import com.detection.governance.model.DdlcPhase;
import com.detection.governance.model.TestOutcome;
import com.detection.governance.model.TestResult;
import com.detection.governance.model.TestStatus;
import com.detection.governance.model.TransitionKind;
import com.detection.governance.model.TransitionRecord;
import com.detection.governance.service.audit.AuditLogAppender;
import com.detection.governance.service.concurrency.ItemLockManager;
import com.detection.governance.store.ContentItemStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Moves content items through the Detection Development Life Cycle. Phases only ever move
 * forward one step at a time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DdlcPhaseTracker {

    private final ContentItemStore store;
    private final AuditLogAppender auditLogAppender;
    private final ItemLockManager lockManager;

    /**
     * Advance the item to the next phase. Advancing from monitoring succeeds and changes nothing.
     */
    public ContentItem advancePhase(String itemId, String actor, String notes) {
        log.info("Advancing phase of content item {} by {}", itemId, actor);

        return lockManager.withItems(() -> {
            ContentItem item = store.require(itemId);
            DdlcPhase current = item.currentPhase();

            if (current.isTerminal()) {
                log.debug("Content item {} already in terminal phase {}", itemId, current.getValue());
                return item;
            }
            return moveTo(item, current.next(), actor, notes);
        }, itemId);
    }

    /**
     * Move the item to an explicit target, which must be the phase directly after the current one.
     *
     * @throws InvalidTransitionException for same, backward or skipping targets
     */
    public ContentItem transitionToPhase(String itemId, DdlcPhase targetPhase, String actor, String notes) {
        if (targetPhase == null) {
            throw new IllegalArgumentException("Target phase is required");
        }
        log.info("Transitioning content item {} to {} by {}", itemId, targetPhase.getValue(), actor);

        return lockManager.withItems(() -> {
            ContentItem item = store.require(itemId);
            DdlcPhase current = item.currentPhase();

            if (current.isTerminal() || current.next() != targetPhase) {
                String reason = current.isTerminal()
                        ? "monitoring is the final phase"
                        : "only the next phase (" + current.next().getValue() + ") is allowed";
                log.warn("Rejected transition of {} from {} to {}", itemId, current.getValue(), targetPhase.getValue());
                throw new InvalidTransitionException(current, targetPhase, reason);
            }
            return moveTo(item, targetPhase, actor, notes);
        }, itemId);
    }

    /**
     * Replace the item's recorded test outcomes.
     */
    public ContentItem recordTestResults(String itemId, List<TestResult> results, String actor) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("At least one test result is required");
        }
        for (TestResult result : results) {
            if (result == null || result.getTestType() == null || result.getTestType().isBlank()
                    || result.getOutcome() == null) {
                throw new IllegalArgumentException("Each test result needs a test type and an outcome");
            }
        }
        log.info("Recording {} test result(s) on content item {} by {}", results.size(), itemId, actor);

        return lockManager.withItems(() -> {
            ContentItem item = store.require(itemId);
            DdlcMetadata metadata = item.getMetadata();
            metadata.setTestResults(new ArrayList<>(results));

            long passed = results.stream().filter(r -> r.getOutcome() == TestOutcome.PASSED).count();
            long failed = results.stream().filter(r -> r.getOutcome() == TestOutcome.FAILED).count();
            auditLogAppender.recordChange(item, actor, "Recorded test results",
                    List.of("tests: " + results.size(), "passed: " + passed, "failed: " + failed));

            store.put(item);
            return item;
        }, itemId);
    }

    public List<PhaseInfo> getPhaseCatalog() {
        return Arrays.stream(DdlcPhase.values()).map(PhaseInfo::from).toList();
    }

    private ContentItem moveTo(ContentItem item, DdlcPhase target, String actor, String notes) {
        DdlcPhase from = item.currentPhase();
        DdlcMetadata metadata = item.getMetadata();
        metadata.setDdlcPhase(target);

        List<String> changes = new ArrayList<>();
        changes.add("ddlcPhase: " + from.getValue() + " -> " + target.getValue());
        TestStatus testStatus = switch (target) {
            case TESTING -> TestStatus.IN_PROGRESS;
            case DEPLOYED -> TestStatus.VALIDATED;
            default -> null;
        };
        if (testStatus != null) {
            changes.add("testStatus: " + metadata.getTestStatus().getValue() + " -> " + testStatus.getValue());
            metadata.setTestStatus(testStatus);
        }
        if (notes != null && !notes.isBlank()) {
            metadata.setValidationNotes(notes);
        }

        auditLogAppender.recordChange(item, actor, "Advanced to " + target.getValue() + " phase", changes,
                TransitionRecord.builder()
                        .kind(TransitionKind.PHASE)
                        .from(from.getValue())
                        .to(target.getValue())
                        .notes(notes)
                        .build());

        store.put(item);
        log.info("Content item {} moved {} -> {} (v{})", item.getId(), from.getValue(), target.getValue(),
                item.getVersion());
        return item;
    }
}
