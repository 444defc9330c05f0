package com.detection.governance.service.audit;

import com.detection.governance.model.ChangeLogEntry;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.ReviewStatus;
import com.detection.governance.model.TransitionKind;
import com.detection.governance.model.TransitionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AuditLogAppenderTest {

    private static final Instant NOW = Instant.parse("2025-02-01T09:30:00Z");

    private AuditLogAppender appender;
    private ContentItem item;

    @BeforeEach
    void setUp() {
        appender = new AuditLogAppender(Clock.fixed(NOW, ZoneOffset.UTC));
        item = ContentItem.builder().id("correlation_1").name("Brute force").version(3).build();
    }

    @Test
    void recordChange_bumpsVersionByOneAndStampsEntry() {
        ChangeLogEntry entry = appender.recordChange(item, "alice", "Edited query", List.of("query changed"));

        assertThat(item.getVersion()).isEqualTo(4);
        assertThat(entry.getVersion()).isEqualTo(4);
        assertThat(entry.getAuthor()).isEqualTo("alice");
        assertThat(entry.getTimestamp()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(entry.hasTransition()).isFalse();
        assertThat(item.getCollaboration().getChangeLog()).containsExactly(entry);
        assertThat(item.getCollaboration().getLastModifiedBy()).isEqualTo("alice");
        assertThat(item.getUpdatedAt()).isEqualTo(entry.getTimestamp());
    }

    @Test
    void recordChange_copiesChangesSoCallerCannotRewriteHistory() {
        List<String> changes = new ArrayList<>(List.of("first"));
        ChangeLogEntry entry = appender.recordChange(item, "alice", "Edited", changes);

        changes.add("second");

        assertThat(entry.getChanges()).containsExactly("first");
    }

    @Test
    void recordChange_keepsTransitionRecord() {
        TransitionRecord transition = TransitionRecord.builder()
                .kind(TransitionKind.PHASE).from("design").to("development").notes("logic signed off").build();

        ChangeLogEntry entry = appender.recordChange(item, "bob", "Advanced to development phase", List.of(), transition);

        assertThat(entry.hasTransition()).isTrue();
        assertThat(entry.getTransition()).isEqualTo(transition);
    }

    @Test
    void recordReview_leavesVersionAlone() {
        appender.recordReview(item, "carol", ReviewStatus.APPROVED, "LGTM");

        assertThat(item.getVersion()).isEqualTo(3);
        assertThat(item.getCollaboration().getChangeLog()).isEmpty();
        assertThat(item.getCollaboration().getReviews()).singleElement()
                .satisfies(review -> {
                    assertThat(review.getReviewer()).isEqualTo("carol");
                    assertThat(review.getStatus()).isEqualTo(ReviewStatus.APPROVED);
                    assertThat(review.getComment()).isEqualTo("LGTM");
                });
        assertThat(item.getCollaboration().getContributors()).containsExactly("carol");
    }

    @Test
    void contributors_areRecordedOnceInFirstSeenOrder() {
        appender.recordChange(item, "alice", "one", List.of());
        appender.recordChange(item, "bob", "two", List.of());
        appender.recordChange(item, "alice", "three", List.of());

        assertThat(item.getCollaboration().getContributors()).containsExactly("alice", "bob");
        assertThat(item.getCollaboration().getLastModifiedBy()).isEqualTo("alice");
        assertThat(item.getVersion()).isEqualTo(6);
    }
}
