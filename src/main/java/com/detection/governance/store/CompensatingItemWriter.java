package com.detection.governance.store;

import com.detection.governance.exception.DuplicateItemIdException;
import com.detection.governance.exception.StoreWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a group of item writes as a unit. If any write fails, the steps already applied
 * are undone in reverse order so the store is left as it was before the group started.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CompensatingItemWriter {

    private final ContentItemStore store;

    public void apply(List<ItemWrite> writes) {
        List<ItemWrite> applied = new ArrayList<>();
        for (ItemWrite write : writes) {
            try {
                execute(write);
                applied.add(write);
            } catch (DuplicateItemIdException e) {
                log.warn("Content item id {} was taken before it could be created, undoing {} steps",
                        write.itemId(), applied.size());
                rollback(applied).forEach(e::addSuppressed);
                throw e;
            } catch (RuntimeException e) {
                log.error("Write of content item {} failed after {} of {} steps, rolling back: {}",
                        write.itemId(), applied.size(), writes.size(), e.getMessage(), e);
                StoreWriteException failure =
                        new StoreWriteException("Failed to write content item " + write.itemId(), e);
                rollback(applied).forEach(failure::addSuppressed);
                throw failure;
            }
        }
    }

    private void execute(ItemWrite write) {
        if (write.after() == null) {
            store.delete(write.before().getId());
        } else if (write.before() == null) {
            if (!store.insert(write.after())) {
                throw new DuplicateItemIdException(write.after().getId());
            }
        } else {
            store.put(write.after());
        }
    }

    private List<RuntimeException> rollback(List<ItemWrite> applied) {
        List<RuntimeException> failures = new ArrayList<>();
        for (int i = applied.size() - 1; i >= 0; i--) {
            ItemWrite write = applied.get(i);
            try {
                if (write.before() == null) {
                    store.delete(write.after().getId());
                } else {
                    store.put(write.before());
                }
            } catch (RuntimeException e) {
                // Store is left inconsistent for this item, needs manual repair
                log.error("Rollback of content item {} failed: {}", write.itemId(), e.getMessage(), e);
                failures.add(e);
            }
        }
        return failures;
    }
}
