package com.detection.governance.support;

import com.detection.governance.dto.CreateContentItemRequest;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.ContentType;
import com.detection.governance.service.ContentItemService;
import com.detection.governance.service.analytics.AnalyticsSettings;
import com.detection.governance.service.analytics.DdlcAnalyticsService;
import com.detection.governance.service.audit.AuditLogAppender;
import com.detection.governance.service.concurrency.ItemLockManager;
import com.detection.governance.service.graph.DependencyCycleDetector;
import com.detection.governance.service.graph.DependencyGraphManager;
import com.detection.governance.service.graph.GraphConsistencyChecker;
import com.detection.governance.service.lifecycle.DdlcPhaseTracker;
import com.detection.governance.service.workflow.ContentIdGenerator;
import com.detection.governance.service.workflow.ContentWorkflowService;
import com.detection.governance.service.workflow.PullRequestNumberAllocator;
import com.detection.governance.store.CompensatingItemWriter;
import com.detection.governance.store.ContentItemStore;
import com.detection.governance.store.InMemoryContentItemStore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Wires the engine by hand around an in-memory store and a controllable clock.
 */
public class GovernanceFixture {

    public static final String ANALYST = "analyst@soc.example";
    public static final String REVIEWER = "reviewer@soc.example";

    public final MutableClock clock = new MutableClock(Instant.parse("2025-01-20T10:00:00Z"));
    public final ContentItemStore store;
    public final AuditLogAppender auditLogAppender = new AuditLogAppender(clock);
    public final ItemLockManager lockManager = new ItemLockManager();
    public final CompensatingItemWriter itemWriter;
    public final ContentIdGenerator idGenerator;
    public final ContentItemService contentItemService;
    public final ContentWorkflowService workflowService;
    public final DdlcPhaseTracker phaseTracker;
    public final DependencyGraphManager graphManager;
    public final GraphConsistencyChecker consistencyChecker;
    public final DdlcAnalyticsService analyticsService;

    public GovernanceFixture() {
        this(new InMemoryContentItemStore());
    }

    public GovernanceFixture(ContentItemStore store) {
        this.store = store;
        this.itemWriter = new CompensatingItemWriter(store);
        this.idGenerator = new ContentIdGenerator(store, clock);
        DependencyCycleDetector cycleDetector = new DependencyCycleDetector();

        this.contentItemService = new ContentItemService(store, auditLogAppender, lockManager, itemWriter, idGenerator, clock);
        this.workflowService = new ContentWorkflowService(store, auditLogAppender, lockManager, itemWriter,
                idGenerator, new PullRequestNumberAllocator(store), clock);
        this.phaseTracker = new DdlcPhaseTracker(store, auditLogAppender, lockManager);
        this.graphManager = new DependencyGraphManager(store, auditLogAppender, lockManager, itemWriter, cycleDetector, clock);
        this.consistencyChecker = new GraphConsistencyChecker(store, lockManager, cycleDetector, clock);
        this.analyticsService = new DdlcAnalyticsService(store, lockManager, AnalyticsSettings.builder().build(), clock);
    }

    public ContentItem register(String id, String name) {
        return register(id, name, List.of());
    }

    public ContentItem register(String id, String name, List<String> dependencies) {
        return contentItemService.registerItem(CreateContentItemRequest.builder()
                .id(id)
                .contentType(ContentType.CORRELATION)
                .name(name)
                .description(name + " detection")
                .category("Credential Access")
                .severity("high")
                .contentData("{\"query\":\"SecurityEvent | where EventID == 4625\"}")
                .dependencies(dependencies)
                .build(), ANALYST);
    }

    public void advanceClock(Duration duration) {
        clock.advance(duration);
    }
}
