package com.detection.governance.service.workflow;

import com.detection.governance.exception.PreconditionFailedException;
import com.detection.governance.model.Collaboration;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.ContentStatus;
import com.detection.governance.model.DdlcMetadata;
import com.detection.governance.model.GitInfo;
import com.detection.governance.model.MergeStatus;
import com.detection.governance.model.ReviewStatus;
import com.detection.governance.model.TransitionKind;
import com.detection.governance.model.TransitionRecord;
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
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Branch / pull request / review / merge / fork workflow over content items.
 *
 * Branching and forking produce a new, independently identified item; there is no shared
 * history between an item and its branches. Merge requires an approved review and is the only
 * path to {@code published}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContentWorkflowService {

    private final ContentItemStore store;
    private final AuditLogAppender auditLogAppender;
    private final ItemLockManager lockManager;
    private final CompensatingItemWriter itemWriter;
    private final ContentIdGenerator idGenerator;
    private final PullRequestNumberAllocator pullRequestNumbers;
    private final Clock clock;

    /**
     * Snapshot the source into a new item on {@code branchName}. The source is not modified.
     */
    public ContentItem createBranch(String sourceId, String branchName, String actor) {
        if (branchName == null || branchName.isBlank()) {
            throw new IllegalArgumentException("Branch name is required");
        }
        log.info("Creating branch '{}' from content item {} for {}", branchName, sourceId, actor);

        return lockManager.withItems(() -> {
            ContentItem source = store.require(sourceId);
            return idGenerator.writeWithFreshId(() -> idGenerator.branchId(sourceId, branchName),
                    branchId -> writeBranch(source, branchId, branchName, actor));
        }, sourceId);
    }

    private ContentItem writeBranch(ContentItem source, String branchId, String branchName, String actor) {
        LocalDateTime now = LocalDateTime.now(clock);
        String message = "Created branch " + branchName;

        Collaboration collaboration = source.getCollaboration().copy();
        collaboration.setChangeLog(new ArrayList<>());
        collaboration.setReviews(new ArrayList<>());

        ContentItem branch = source.copy().toBuilder()
                .id(branchId)
                .gitInfo(GitInfo.builder()
                        .branch(branchName)
                        .commit(idGenerator.newCommitToken())
                        .author(actor)
                        .message(message)
                        .reviewStatus(ReviewStatus.NONE)
                        .mergeStatus(MergeStatus.UNMERGED)
                        .build())
                .collaboration(collaboration)
                .dependencies(new LinkedHashSet<>())
                .dependents(new LinkedHashSet<>())
                .forks(new LinkedHashSet<>())
                .originalId(null)
                .createdAt(now)
                .updatedAt(now)
                .build();

        // Starts one past the source's version: the branch entry continues its count
        auditLogAppender.recordChange(branch, actor, message,
                List.of("branched from " + source.getId() + " at version " + source.getVersion()));

        itemWriter.apply(List.of(ItemWrite.create(branch)));
        log.info("Branch {} created from {} at version {}", branchId, source.getId(), branch.getVersion());
        return branch;
    }

    /**
     * Open a pull request for the item: mints a number and moves the review to pending.
     */
    public ContentItem createPullRequest(String itemId, String targetBranch, String description, String actor) {
        String target = targetBranch == null || targetBranch.isBlank() ? GitInfo.MAIN_BRANCH : targetBranch;
        log.info("Opening pull request for content item {} into '{}' by {}", itemId, target, actor);

        return lockManager.withItems(() -> {
            ContentItem item = store.require(itemId);
            GitInfo gitInfo = item.getGitInfo();

            int number = pullRequestNumbers.next();
            gitInfo.setPullRequest(number);
            gitInfo.setTargetBranch(target);
            gitInfo.setReviewStatus(ReviewStatus.PENDING);
            gitInfo.setMessage(description);

            auditLogAppender.recordChange(item, actor, "Opened pull request #" + number,
                    List.of("target: " + target, "review: " + ReviewStatus.PENDING.getValue()));

            store.put(item);
            log.info("Pull request #{} opened for {} ({} -> {})", number, itemId, gitInfo.getBranch(), target);
            return item;
        }, itemId);
    }

    /**
     * Record a review; the latest review decides the item's review status.
     */
    public ContentItem reviewContent(String itemId, ReviewStatus status, String comment, String actor) {
        if (status != ReviewStatus.APPROVED && status != ReviewStatus.CHANGES_REQUESTED) {
            throw new IllegalArgumentException("Review status must be approved or changes_requested");
        }
        log.info("Reviewing content item {} as {} by {}", itemId, status.getValue(), actor);

        return lockManager.withItems(() -> {
            ContentItem item = store.require(itemId);
            item.getGitInfo().setReviewStatus(status);
            auditLogAppender.recordReview(item, actor, status, comment);
            store.put(item);
            return item;
        }, itemId);
    }

    /**
     * Promote an approved item onto main and publish it.
     *
     * @throws PreconditionFailedException when the review status is not approved; nothing is written
     */
    public ContentItem mergeContent(String itemId, String actor) {
        log.info("Merging content item {} by {}", itemId, actor);

        return lockManager.withItems(() -> {
            ContentItem item = store.require(itemId);
            GitInfo gitInfo = item.getGitInfo();

            if (gitInfo.getReviewStatus() != ReviewStatus.APPROVED) {
                log.warn("Merge of {} rejected: review status is {}", itemId, gitInfo.getReviewStatus().getValue());
                throw new PreconditionFailedException(String.format(
                        "Content item %s cannot be merged: review status is %s, approval required",
                        itemId, gitInfo.getReviewStatus().getValue()));
            }

            String fromBranch = gitInfo.getBranch();
            gitInfo.setMergeStatus(MergeStatus.MERGED);
            gitInfo.setBranch(GitInfo.MAIN_BRANCH);
            ContentStatus previousStatus = item.getStatus();
            item.setStatus(ContentStatus.PUBLISHED);

            String message = String.format("Merged %s into %s", fromBranch, GitInfo.MAIN_BRANCH);
            auditLogAppender.recordChange(item, actor, message,
                    List.of("status: " + previousStatus.getValue() + " -> " + ContentStatus.PUBLISHED.getValue()),
                    TransitionRecord.builder()
                            .kind(TransitionKind.MERGE)
                            .from(fromBranch)
                            .to(GitInfo.MAIN_BRANCH)
                            .notes(gitInfo.getPullRequest() == null ? null : "pull request #" + gitInfo.getPullRequest())
                            .build());

            store.put(item);
            log.info("Content item {} merged into main and published (v{})", itemId, item.getVersion());
            return item;
        }, itemId);
    }

    /**
     * Fork the source into a new draft item that records where it came from. The source's
     * {@code forks} gains the new id and every inherited dependency lists the fork as a dependent;
     * all of these writes land together or not at all.
     */
    public ContentItem forkContent(String sourceId, String actor) {
        log.info("Forking content item {} for {}", sourceId, actor);

        return lockManager.withResolvedItems(() -> forkLockSet(sourceId),
                () -> idGenerator.writeWithFreshId(() -> idGenerator.forkId(sourceId),
                        forkId -> writeFork(sourceId, forkId, actor)));
    }

    private ContentItem writeFork(String sourceId, String forkId, String actor) {
        ContentItem source = store.require(sourceId);
        ContentItem sourceBefore = source.copy();
        LocalDateTime now = LocalDateTime.now(clock);

        ContentItem fork = ContentItem.builder()
                .id(forkId)
                .contentType(source.getContentType())
                .name(source.getName() + " (Fork)")
                .description(source.getDescription())
                .category(source.getCategory())
                .severity(source.getSeverity())
                .contentData(source.getContentData())
                .requirements(source.getRequirements())
                .status(ContentStatus.DRAFT)
                .version(0)
                .metadata(new DdlcMetadata())
                .gitInfo(GitInfo.builder()
                        .branch(GitInfo.FORK_BRANCH)
                        .commit(idGenerator.newCommitToken())
                        .author(actor)
                        .message("Forked content")
                        .reviewStatus(ReviewStatus.NONE)
                        .mergeStatus(MergeStatus.UNMERGED)
                        .build())
                .collaboration(new Collaboration())
                .dependencies(new LinkedHashSet<>(source.getDependencies()))
                .dependents(new LinkedHashSet<>())
                .forks(new LinkedHashSet<>())
                .originalId(sourceId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        auditLogAppender.recordChange(fork, actor, "Forked content", List.of("forked from " + sourceId));

        source.getForks().add(forkId);
        source.setUpdatedAt(now);

        List<ItemWrite> writes = new ArrayList<>();
        writes.add(ItemWrite.create(fork));
        writes.add(ItemWrite.update(sourceBefore, source));
        for (String dependencyId : fork.getDependencies()) {
            ContentItem dependency = store.require(dependencyId);
            ContentItem dependencyBefore = dependency.copy();
            dependency.getDependents().add(forkId);
            dependency.setUpdatedAt(now);
            writes.add(ItemWrite.update(dependencyBefore, dependency));
        }
        itemWriter.apply(writes);

        log.info("Content item {} forked into {} ({} inherited dependencies)",
                sourceId, forkId, fork.getDependencies().size());
        return fork;
    }

    private Collection<String> forkLockSet(String sourceId) {
        Set<String> ids = new LinkedHashSet<>();
        ids.add(sourceId);
        ids.addAll(store.require(sourceId).getDependencies());
        return ids;
    }
}
