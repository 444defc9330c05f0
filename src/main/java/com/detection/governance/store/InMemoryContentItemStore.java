package com.detection.governance.store;

import com.detection.governance.model.ContentItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Copies on every read and write so stored state is only
 * ever changed through {@link #put(ContentItem)}.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "governance.store.type", havingValue = "memory")
public class InMemoryContentItemStore implements ContentItemStore {

    private static final Comparator<ContentItem> NEWEST_FIRST = Comparator.comparing(
            ContentItem::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    private final ConcurrentHashMap<String, ContentItem> items = new ConcurrentHashMap<>();

    @Override
    public Optional<ContentItem> get(String id) {
        return Optional.ofNullable(items.get(id)).map(ContentItem::copy);
    }

    @Override
    public ContentItem put(ContentItem item) {
        Objects.requireNonNull(item.getId(), "Content item id is required");
        items.put(item.getId(), item.copy());
        log.debug("Stored content item {} at version {}", item.getId(), item.getVersion());
        return item;
    }

    @Override
    public boolean insert(ContentItem item) {
        Objects.requireNonNull(item.getId(), "Content item id is required");
        if (items.putIfAbsent(item.getId(), item.copy()) != null) {
            log.debug("Content item id {} is already taken", item.getId());
            return false;
        }
        log.debug("Inserted content item {} at version {}", item.getId(), item.getVersion());
        return true;
    }

    @Override
    public boolean exists(String id) {
        return items.containsKey(id);
    }

    @Override
    public void delete(String id) {
        items.remove(id);
    }

    @Override
    public List<ContentItem> list() {
        return list(ContentItemFilter.all());
    }

    @Override
    public List<ContentItem> list(ContentItemFilter filter) {
        return items.values().stream()
                .filter(filter::matches)
                .sorted(NEWEST_FIRST)
                .map(ContentItem::copy)
                .toList();
    }

    @Override
    public int maxPullRequestNumber() {
        return items.values().stream()
                .map(item -> item.getGitInfo().getPullRequest())
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .max()
                .orElse(0);
    }
}
