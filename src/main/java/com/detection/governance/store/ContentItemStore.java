package com.detection.governance.store;

import com.detection.governance.exception.ContentItemNotFoundException;
import com.detection.governance.model.ContentItem;

import java.util.List;
import java.util.Optional;

/**
 * Key-value persistence of content items. Implementations hold no governance logic.
 *
 * Items returned by the store are detached copies: mutating one has no effect until it is
 * passed back to {@link #put(ContentItem)}.
 */
public interface ContentItemStore {

    Optional<ContentItem> get(String id);

    default ContentItem require(String id) {
        return get(id).orElseThrow(() -> new ContentItemNotFoundException(id));
    }

    ContentItem put(ContentItem item);

    /**
     * Store a new item unless its id is already taken.
     *
     * @return false when an item with the same id exists; nothing is written then
     */
    boolean insert(ContentItem item);

    boolean exists(String id);

    void delete(String id);

    /**
     * All items, newest {@code createdAt} first.
     */
    List<ContentItem> list();

    List<ContentItem> list(ContentItemFilter filter);

    /**
     * Highest pull request number held by any stored item, 0 when none has one.
     */
    int maxPullRequestNumber();
}
