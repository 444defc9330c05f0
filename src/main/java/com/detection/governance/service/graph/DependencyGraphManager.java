package com.detection.governance.service.graph;

import com.detection.governance.dto.graph.ItemGraphResponse;
import com.detection.governance.exception.CycleDetectedException;
import com.detection.governance.model.ContentItem;
import com.detection.governance.service.audit.AuditLogAppender;
import com.detection.governance.service.concurrency.ItemLockManager;
import com.detection.governance.store.CompensatingItemWriter;
import com.detection.governance.store.ContentItemStore;
import com.detection.governance.store.ItemWrite;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maintains dependency edges between content items. Every edge is stored on both ends:
 * {@code X.dependencies} holds Y exactly when {@code Y.dependents} holds X.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DependencyGraphManager {

    private final ContentItemStore store;
    private final AuditLogAppender auditLogAppender;
    private final ItemLockManager lockManager;
    private final CompensatingItemWriter itemWriter;
    private final DependencyCycleDetector cycleDetector;
    private final Clock clock;

    // Cycle checks read beyond the two locked items, so edge additions run one at a time
    private final Object edgeAdditionLock = new Object();

    /**
     * Make {@code itemId} depend on {@code dependsOnId}. Adding an existing edge is a no-op.
     *
     * @throws CycleDetectedException when the edge is a self-edge or would close a cycle
     */
    public ContentItem addDependency(String itemId, String dependsOnId, String actor) {
        log.info("Adding dependency {} -> {} by {}", itemId, dependsOnId, actor);

        synchronized (edgeAdditionLock) {
            return lockManager.withItems(() -> {
                ContentItem item = store.require(itemId);
                ContentItem dependency = store.require(dependsOnId);

                if (item.getDependencies().contains(dependsOnId)) {
                    log.debug("Dependency {} -> {} already present", itemId, dependsOnId);
                    return item;
                }

                Optional<List<String>> cycle = cycleDetector.cycleClosedBy(itemId, dependsOnId, this::dependenciesOf);
                if (cycle.isPresent()) {
                    log.warn("Rejected dependency {} -> {}: cycle {}", itemId, dependsOnId, cycle.get());
                    throw new CycleDetectedException(cycle.get());
                }

                ContentItem itemBefore = item.copy();
                ContentItem dependencyBefore = dependency.copy();

                item.getDependencies().add(dependsOnId);
                auditLogAppender.recordChange(item, actor, "Added dependency on " + dependsOnId,
                        List.of("dependencies + " + dependsOnId));
                dependency.getDependents().add(itemId);
                dependency.setUpdatedAt(LocalDateTime.now(clock));

                itemWriter.apply(List.of(
                        ItemWrite.update(itemBefore, item),
                        ItemWrite.update(dependencyBefore, dependency)));

                log.info("Dependency {} -> {} added", itemId, dependsOnId);
                return item;
            }, itemId, dependsOnId);
        }
    }

    /**
     * Remove the edge from both ends. Removing an absent edge is a no-op.
     */
    public ContentItem removeDependency(String itemId, String dependsOnId, String actor) {
        log.info("Removing dependency {} -> {} by {}", itemId, dependsOnId, actor);

        return lockManager.withItems(() -> {
            ContentItem item = store.require(itemId);
            ContentItem dependency = store.require(dependsOnId);

            if (!item.getDependencies().contains(dependsOnId) && !dependency.getDependents().contains(itemId)) {
                log.debug("Dependency {} -> {} not present", itemId, dependsOnId);
                return item;
            }

            ContentItem itemBefore = item.copy();
            ContentItem dependencyBefore = dependency.copy();

            item.getDependencies().remove(dependsOnId);
            auditLogAppender.recordChange(item, actor, "Removed dependency on " + dependsOnId,
                    List.of("dependencies - " + dependsOnId));
            dependency.getDependents().remove(itemId);
            dependency.setUpdatedAt(LocalDateTime.now(clock));

            itemWriter.apply(List.of(
                    ItemWrite.update(itemBefore, item),
                    ItemWrite.update(dependencyBefore, dependency)));

            log.info("Dependency {} -> {} removed", itemId, dependsOnId);
            return item;
        }, itemId, dependsOnId);
    }

    public ItemGraphResponse getGraph(String itemId) {
        ContentItem item = store.require(itemId);
        return ItemGraphResponse.builder()
                .itemId(item.getId())
                .dependencies(new LinkedHashSet<>(item.getDependencies()))
                .dependents(new LinkedHashSet<>(item.getDependents()))
                .forks(new LinkedHashSet<>(item.getForks()))
                .originalId(item.getOriginalId())
                .build();
    }

    private Set<String> dependenciesOf(String id) {
        return store.get(id).map(ContentItem::getDependencies).orElse(Set.of());
    }
}
