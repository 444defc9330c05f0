package com.detection.governance.service;

import com.detection.governance.dto.CreateContentItemRequest;
import com.detection.governance.exception.DuplicateItemIdException;
import com.detection.governance.exception.PreconditionFailedException;
import com.detection.governance.model.Collaboration;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.ContentStatus;
import com.detection.governance.model.DdlcMetadata;
import com.detection.governance.model.GitInfo;
import com.detection.governance.model.MergeStatus;
import com.detection.governance.model.ReviewStatus;
import com.detection.governance.service.audit.AuditLogAppender;
import com.detection.governance.service.concurrency.ItemLockManager;
import com.detection.governance.service.workflow.ContentIdGenerator;
import com.detection.governance.store.CompensatingItemWriter;
import com.detection.governance.store.ContentItemFilter;
import com.detection.governance.store.ContentItemStore;
import com.detection.governance.store.ItemWrite;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Registration, lookup and removal of content items.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContentItemService {

    private final ContentItemStore store;
    private final AuditLogAppender auditLogAppender;
    private final ItemLockManager lockManager;
    private final CompensatingItemWriter itemWriter;
    private final ContentIdGenerator idGenerator;
    private final Clock clock;

    /**
     * Register a new item on main at version 1. Declared dependencies are wired on both ends in
     * the same write. A caller-supplied id that is taken fails; a generated one is minted again.
     */
    public ContentItem registerItem(CreateContentItemRequest request, String actor) {
        Set<String> dependencyIds = request.getDependencies() == null
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(request.getDependencies());
        if (request.getId() != null && !request.getId().isBlank()) {
            return register(request.getId(), request, dependencyIds, actor);
        }
        return idGenerator.writeWithFreshId(() -> idGenerator.newItemId(request.getContentType()),
                itemId -> register(itemId, request, dependencyIds, actor));
    }

    private ContentItem register(String itemId, CreateContentItemRequest request,
                                 Set<String> dependencyIds, String actor) {
        if (dependencyIds.contains(itemId)) {
            throw new IllegalArgumentException("Content item cannot depend on itself");
        }
        log.info("Registering {} content item {} for {}", request.getContentType().getValue(), itemId, actor);

        List<String> lockSet = new ArrayList<>(dependencyIds);
        lockSet.add(itemId);

        return lockManager.withItems(lockSet, () -> {
            if (store.exists(itemId)) {
                throw new DuplicateItemIdException(itemId);
            }
            LocalDateTime now = LocalDateTime.now(clock);

            List<ItemWrite> dependencyWrites = new ArrayList<>();
            for (String dependencyId : dependencyIds) {
                ContentItem dependency = store.require(dependencyId);
                ContentItem dependencyBefore = dependency.copy();
                dependency.getDependents().add(itemId);
                dependency.setUpdatedAt(now);
                dependencyWrites.add(ItemWrite.update(dependencyBefore, dependency));
            }

            ContentItem item = ContentItem.builder()
                    .id(itemId)
                    .contentType(request.getContentType())
                    .name(request.getName())
                    .description(request.getDescription())
                    .category(request.getCategory())
                    .severity(request.getSeverity())
                    .contentData(request.getContentData())
                    .requirements(request.getRequirements())
                    .status(ContentStatus.DRAFT)
                    .version(0)
                    .metadata(new DdlcMetadata())
                    .gitInfo(GitInfo.builder()
                            .branch(GitInfo.MAIN_BRANCH)
                            .commit(idGenerator.newCommitToken())
                            .author(actor)
                            .message("Created content")
                            .reviewStatus(ReviewStatus.NONE)
                            .mergeStatus(MergeStatus.MERGED)
                            .build())
                    .collaboration(new Collaboration())
                    .dependencies(new LinkedHashSet<>(dependencyIds))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            List<String> changes = new ArrayList<>();
            changes.add("registered " + request.getContentType().getValue());
            dependencyIds.forEach(id -> changes.add("dependencies + " + id));
            auditLogAppender.recordChange(item, actor, "Created content", changes);

            List<ItemWrite> writes = new ArrayList<>();
            writes.add(ItemWrite.create(item));
            writes.addAll(dependencyWrites);
            itemWriter.apply(writes);

            log.info("Content item {} registered with {} dependencies", itemId, dependencyIds.size());
            return item;
        });
    }

    public ContentItem getItem(String itemId) {
        return store.require(itemId);
    }

    public List<ContentItem> listItems(ContentItemFilter filter) {
        return store.list(filter == null ? ContentItemFilter.all() : filter);
    }

    /**
     * Case-insensitive substring match on name, description and category.
     */
    public List<ContentItem> searchItems(String query) {
        if (query == null || query.isBlank()) {
            return store.list();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return store.list().stream()
                .filter(item -> contains(item.getName(), needle)
                        || contains(item.getDescription(), needle)
                        || contains(item.getCategory(), needle))
                .toList();
    }

    /**
     * Delete an item nothing depends on, detaching it from everything it references.
     *
     * @throws PreconditionFailedException when other items still depend on it
     */
    public void deleteItem(String itemId, String actor) {
        log.info("Deleting content item {} by {}", itemId, actor);

        lockManager.withResolvedItems(() -> deleteLockSet(itemId), () -> {
            ContentItem item = store.require(itemId);
            if (!item.getDependents().isEmpty()) {
                log.warn("Delete of {} rejected: still required by {}", itemId, item.getDependents());
                throw new PreconditionFailedException(String.format(
                        "Content item %s is still a dependency of %s", itemId, item.getDependents()));
            }
            LocalDateTime now = LocalDateTime.now(clock);
            List<ItemWrite> writes = new ArrayList<>();

            for (String dependencyId : item.getDependencies()) {
                store.get(dependencyId).ifPresent(dependency -> {
                    ContentItem before = dependency.copy();
                    dependency.getDependents().remove(itemId);
                    dependency.setUpdatedAt(now);
                    writes.add(ItemWrite.update(before, dependency));
                });
            }
            if (item.getOriginalId() != null) {
                store.get(item.getOriginalId()).ifPresent(original -> {
                    ContentItem before = original.copy();
                    original.getForks().remove(itemId);
                    original.setUpdatedAt(now);
                    writes.add(ItemWrite.update(before, original));
                });
            }
            for (String forkId : item.getForks()) {
                store.get(forkId).ifPresent(fork -> {
                    ContentItem before = fork.copy();
                    fork.setOriginalId(null);
                    fork.setUpdatedAt(now);
                    writes.add(ItemWrite.update(before, fork));
                });
            }
            writes.add(ItemWrite.delete(item));
            itemWriter.apply(writes);

            log.info("Content item {} deleted, {} related items detached", itemId, writes.size() - 1);
            return null;
        });
    }

    private Collection<String> deleteLockSet(String itemId) {
        ContentItem item = store.require(itemId);
        Set<String> ids = new LinkedHashSet<>();
        ids.add(itemId);
        ids.addAll(item.getDependencies());
        ids.addAll(item.getForks());
        if (item.getOriginalId() != null) {
            ids.add(item.getOriginalId());
        }
        return ids;
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
