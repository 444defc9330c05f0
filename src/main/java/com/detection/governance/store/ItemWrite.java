package com.detection.governance.store;

import com.detection.governance.model.ContentItem;

/**
 * One step of a multi-item write, holding what is needed to undo it. A step without
 * {@code before} creates the item and fails if its id is taken.
 *
 * @param before item as stored before the write, null when the item is new
 * @param after  item to store, null when the step deletes {@code before}
 */
public record ItemWrite(ContentItem before, ContentItem after) {

    public static ItemWrite create(ContentItem item) {
        return new ItemWrite(null, item);
    }

    public static ItemWrite update(ContentItem before, ContentItem after) {
        return new ItemWrite(before, after);
    }

    public static ItemWrite delete(ContentItem before) {
        return new ItemWrite(before, null);
    }

    public String itemId() {
        return after != null ? after.getId() : before.getId();
    }
}
