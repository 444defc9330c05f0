package com.detection.governance.store;

import com.detection.governance.model.ContentItem;
import com.detection.governance.repository.ContentItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Store backed by the {@code content_items} MongoDB collection.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "governance.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoContentItemStore implements ContentItemStore {

    private final ContentItemRepository contentItemRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<ContentItem> get(String id) {
        return contentItemRepository.findById(id);
    }

    @Override
    public ContentItem put(ContentItem item) {
        ContentItem saved = contentItemRepository.save(item);
        log.debug("Saved content item {} at version {}", saved.getId(), saved.getVersion());
        return saved;
    }

    @Override
    public boolean insert(ContentItem item) {
        try {
            mongoTemplate.insert(item);
        } catch (DuplicateKeyException e) {
            log.debug("Content item id {} is already taken", item.getId());
            return false;
        }
        log.debug("Inserted content item {} at version {}", item.getId(), item.getVersion());
        return true;
    }

    @Override
    public boolean exists(String id) {
        return contentItemRepository.existsById(id);
    }

    @Override
    public void delete(String id) {
        contentItemRepository.deleteById(id);
    }

    @Override
    public List<ContentItem> list() {
        return contentItemRepository.findAllByOrderByCreatedAtDesc();
    }

    @Override
    public List<ContentItem> list(ContentItemFilter filter) {
        List<Criteria> criteria = new ArrayList<>();
        if (filter.getContentType() != null) {
            criteria.add(Criteria.where("contentType").is(filter.getContentType()));
        }
        if (filter.getStatus() != null) {
            criteria.add(Criteria.where("status").is(filter.getStatus()));
        }
        if (filter.getCategory() != null) {
            criteria.add(Criteria.where("category").regex(exactIgnoreCase(filter.getCategory())));
        }
        if (filter.getSeverity() != null) {
            criteria.add(Criteria.where("severity").regex(exactIgnoreCase(filter.getSeverity())));
        }
        if (filter.getDdlcPhase() != null) {
            criteria.add(Criteria.where("metadata.ddlcPhase").is(filter.getDdlcPhase()));
        }
        if (filter.getBranch() != null) {
            criteria.add(Criteria.where("gitInfo.branch").is(filter.getBranch()));
        }
        if (filter.getReviewStatus() != null) {
            criteria.add(Criteria.where("gitInfo.reviewStatus").is(filter.getReviewStatus()));
        }

        Query query = criteria.isEmpty()
                ? new Query()
                : new Query(new Criteria().andOperator(criteria.toArray(new Criteria[0])));
        query.with(Sort.by(Sort.Direction.DESC, "createdAt"));
        return mongoTemplate.find(query, ContentItem.class);
    }

    @Override
    public int maxPullRequestNumber() {
        return contentItemRepository.findWithPullRequestOrderByPullRequestDesc().stream()
                .findFirst()
                .map(item -> item.getGitInfo().getPullRequest())
                .orElse(0);
    }

    private static Pattern exactIgnoreCase(String value) {
        return Pattern.compile("^" + Pattern.quote(value) + "$", Pattern.CASE_INSENSITIVE);
    }
}
