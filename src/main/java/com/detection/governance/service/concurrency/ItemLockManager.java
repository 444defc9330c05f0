package com.detection.governance.service.concurrency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Serializes read-modify-write operations per content item.
 * <p>
 * Mutations hold the shared side of a global read/write lock plus one exclusive lock per
 * touched item, taken in lexicographic id order so two multi-item operations can never
 * deadlock. Snapshot readers take the exclusive side of the global lock and therefore never
 * observe a multi-item mutation half way through.
 */
@Component
@Slf4j
public class ItemLockManager {

    private static final int MAX_RESOLVE_ATTEMPTS = 5;

    // Entries live only while some thread holds or waits for them
    private final ConcurrentHashMap<String, ItemLock> itemLocks = new ConcurrentHashMap<>();

    private final ReentrantReadWriteLock snapshotLock = new ReentrantReadWriteLock(true);

    /**
     * Run {@code action} while holding the locks of every given item id.
     */
    public <T> T withItems(Supplier<T> action, String... itemIds) {
        return withItems(Arrays.asList(itemIds), action);
    }

    public <T> T withItems(List<String> itemIds, Supplier<T> action) {
        List<String> ordered = itemIds.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();

        snapshotLock.readLock().lock();
        int acquired = 0;
        try {
            for (String id : ordered) {
                acquire(id);
                acquired++;
            }
            log.debug("Acquired item locks {}", ordered);
            return action.get();
        } finally {
            for (int i = acquired - 1; i >= 0; i--) {
                release(ordered.get(i));
            }
            snapshotLock.readLock().unlock();
        }
    }

    /**
     * Lock a set of items that can only be determined by reading one of them (for example an
     * item plus everything it references). The set is resolved, locked, then resolved again;
     * if it grew in between, the locks are released and the attempt repeated.
     */
    public <T> T withResolvedItems(Supplier<Collection<String>> resolver, Supplier<T> action) {
        for (int attempt = 1; attempt <= MAX_RESOLVE_ATTEMPTS; attempt++) {
            List<String> ids = List.copyOf(resolver.get());
            LockedResult<T> result = withItems(ids, () -> ids.containsAll(resolver.get())
                    ? LockedResult.of(action.get())
                    : LockedResult.<T>retry());
            if (!result.stale()) {
                return result.value();
            }
            log.debug("Related item set changed while locking {}, retrying (attempt {})", ids, attempt);
        }
        throw new IllegalStateException("Related items kept changing while acquiring locks");
    }

    /**
     * Run {@code reader} with every mutation excluded, for consistent full-store scans.
     */
    public <T> T withSnapshot(Supplier<T> reader) {
        snapshotLock.writeLock().lock();
        try {
            return reader.get();
        } finally {
            snapshotLock.writeLock().unlock();
        }
    }

    /**
     * Number of item ids that currently have a lock entry.
     */
    int trackedLockCount() {
        return itemLocks.size();
    }

    private void acquire(String id) {
        ItemLock itemLock = itemLocks.compute(id, (key, existing) -> {
            ItemLock entry = existing != null ? existing : new ItemLock();
            entry.users++;
            return entry;
        });
        itemLock.lock.lock();
    }

    private void release(String id) {
        itemLocks.get(id).lock.unlock();
        itemLocks.computeIfPresent(id, (key, entry) -> --entry.users == 0 ? null : entry);
    }

    // users is only read and written inside ConcurrentHashMap.compute for its key
    private static final class ItemLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    private record LockedResult<T>(T value, boolean stale) {

        static <T> LockedResult<T> of(T value) {
            return new LockedResult<>(value, false);
        }

        static <T> LockedResult<T> retry() {
            return new LockedResult<>(null, true);
        }
    }
}
