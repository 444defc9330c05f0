package com.detection.governance.service.concurrency;

import com.detection.governance.exception.ContentItemNotFoundException;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.ReviewEntry;
import com.detection.governance.model.ReviewStatus;
import com.detection.governance.support.GovernanceFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.detection.governance.support.GovernanceFixture.ANALYST;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemLockManagerTest {

    @Nested
    @DisplayName("item locks")
    class ItemLocks {

        private final ItemLockManager lockManager = new ItemLockManager();

        @Test
        @DisplayName("operations on the same item never overlap")
        void sameItemIsMutuallyExclusive() throws Exception {
            AtomicInteger inside = new AtomicInteger();
            AtomicBoolean overlapped = new AtomicBoolean();
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    futures.add(executor.submit(() -> lockManager.withItems(() -> {
                        if (inside.incrementAndGet() > 1) {
                            overlapped.set(true);
                        }
                        Thread.yield();
                        inside.decrementAndGet();
                        return null;
                    }, "I1")));
                }
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }
            assertThat(overlapped).isFalse();
        }

        @Test
        @DisplayName("opposite lock orders on two items do not deadlock")
        void pairLocksInEitherOrderComplete() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger completed = new AtomicInteger();
            try {
                Future<?> forward = executor.submit(() -> {
                    await(start);
                    for (int i = 0; i < 500; i++) {
                        lockManager.withItems(completed::incrementAndGet, "A", "B");
                    }
                });
                Future<?> backward = executor.submit(() -> {
                    await(start);
                    for (int i = 0; i < 500; i++) {
                        lockManager.withItems(completed::incrementAndGet, "B", "A");
                    }
                });
                start.countDown();
                forward.get(10, TimeUnit.SECONDS);
                backward.get(10, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }
            assertThat(completed).hasValue(1000);
        }

        @Test
        void resolvedLockSetIsRetriedWhenItGrows() {
            AtomicInteger resolutions = new AtomicInteger();

            String result = lockManager.withResolvedItems(
                    () -> resolutions.incrementAndGet() == 1 ? List.of("A") : List.of("A", "B"),
                    () -> "done");

            assertThat(result).isEqualTo("done");
            assertThat(resolutions).hasValue(4);
        }

        @Test
        @DisplayName("lock entries are dropped once no thread holds or waits for them")
        void lockEntriesAreReleasedAfterUse() throws Exception {
            lockManager.withItems(() -> lockManager.withItems(() -> "nested", "A", "B"), "A");
            assertThatThrownBy(() -> lockManager.withItems(() -> {
                throw new IllegalStateException("boom");
            }, "C"))
                    .isInstanceOf(IllegalStateException.class);

            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < 100; i++) {
                    String id = "I" + (i % 7);
                    futures.add(executor.submit(() -> lockManager.withItems(() -> {
                        Thread.yield();
                        return null;
                    }, id, "SHARED")));
                }
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(lockManager.trackedLockCount()).isZero();
        }
    }

    @Nested
    @DisplayName("engine operations")
    class EngineOperations {

        @Test
        @DisplayName("concurrent reviews on one item are all kept, latest decides the status")
        void concurrentReviewsSerialize() throws Exception {
            GovernanceFixture fixture = new GovernanceFixture();
            fixture.register("I1", "Brute force logins");
            int reviewers = 16;
            ExecutorService executor = Executors.newFixedThreadPool(reviewers);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<ContentItem>> futures = new ArrayList<>();
                for (int i = 0; i < reviewers; i++) {
                    ReviewStatus status = i % 2 == 0 ? ReviewStatus.APPROVED : ReviewStatus.CHANGES_REQUESTED;
                    String reviewer = "reviewer-" + i;
                    futures.add(executor.submit(() -> {
                        await(start);
                        return fixture.workflowService.reviewContent("I1", status, "review", reviewer);
                    }));
                }
                start.countDown();
                for (Future<ContentItem> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            ContentItem item = fixture.store.require("I1");
            List<ReviewEntry> reviews = item.getCollaboration().getReviews();
            assertThat(reviews).hasSize(reviewers);
            assertThat(item.getGitInfo().getReviewStatus()).isEqualTo(reviews.get(reviews.size() - 1).getStatus());
            assertThat(item.getVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("concurrent forks of one source are all registered on it")
        void concurrentForksAreAllRecorded() throws Exception {
            GovernanceFixture fixture = new GovernanceFixture();
            fixture.register("LIB", "Shared parser");
            fixture.register("I1", "Brute force logins", List.of("LIB"));
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                List<Future<ContentItem>> futures = new ArrayList<>();
                for (int i = 0; i < 12; i++) {
                    futures.add(executor.submit(() -> fixture.workflowService.forkContent("I1", ANALYST)));
                }
                for (Future<ContentItem> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(fixture.store.require("I1").getForks()).hasSize(12);
            assertThat(fixture.store.require("LIB").getDependents()).hasSize(13);
            assertThat(fixture.consistencyChecker.check().isConsistent()).isTrue();
        }

        @Test
        void deletedAndMissingItemsLeaveNoLocksBehind() {
            GovernanceFixture fixture = new GovernanceFixture();
            fixture.register("I1", "Brute force logins");
            fixture.contentItemService.deleteItem("I1", ANALYST);
            assertThatThrownBy(() -> fixture.workflowService.reviewContent("ghost", ReviewStatus.APPROVED, "ok", ANALYST))
                    .isInstanceOf(ContentItemNotFoundException.class);

            assertThat(fixture.lockManager.trackedLockCount()).isZero();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
