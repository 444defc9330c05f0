package com.detection.governance.service.audit;

import com.detection.governance.model.ChangeLogEntry;
import com.detection.governance.model.Collaboration;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.ReviewEntry;
import com.detection.governance.model.ReviewStatus;
import com.detection.governance.model.TransitionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Appends change-log and review entries to an item. Every mutating operation goes through
 * here, which keeps the version rule in one place: the version moves by exactly one per
 * change-log entry and never otherwise.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AuditLogAppender {

    private final Clock clock;

    public ChangeLogEntry recordChange(ContentItem item, String actor, String message, List<String> changes) {
        return recordChange(item, actor, message, changes, null);
    }

    /**
     * Bump the version, append a change-log entry carrying it, and mark {@code actor}
     * as the latest contributor.
     */
    public ChangeLogEntry recordChange(ContentItem item, String actor, String message,
                                       List<String> changes, TransitionRecord transition) {
        LocalDateTime now = LocalDateTime.now(clock);
        int newVersion = item.getVersion() + 1;

        ChangeLogEntry entry = ChangeLogEntry.builder()
                .version(newVersion)
                .author(actor)
                .timestamp(now)
                .message(message)
                .changes(changes == null ? List.of() : List.copyOf(changes))
                .transition(transition)
                .build();

        Collaboration collaboration = item.getCollaboration();
        collaboration.getChangeLog().add(entry);
        touch(item, actor, now);
        item.setVersion(newVersion);

        log.debug("Recorded change on {} (v{}): {}", item.getId(), newVersion, message);
        return entry;
    }

    /**
     * Append a review. Reviews live in their own trail and leave the version alone.
     */
    public ReviewEntry recordReview(ContentItem item, String actor, ReviewStatus status, String comment) {
        LocalDateTime now = LocalDateTime.now(clock);
        ReviewEntry review = ReviewEntry.builder()
                .reviewer(actor)
                .status(status)
                .comment(comment)
                .timestamp(now)
                .build();

        item.getCollaboration().getReviews().add(review);
        touch(item, actor, now);

        log.debug("Recorded {} review on {} by {}", status.getValue(), item.getId(), actor);
        return review;
    }

    private void touch(ContentItem item, String actor, LocalDateTime now) {
        Collaboration collaboration = item.getCollaboration();
        collaboration.getContributors().add(actor);
        collaboration.setLastModifiedBy(actor);
        item.setUpdatedAt(now);
    }
}
