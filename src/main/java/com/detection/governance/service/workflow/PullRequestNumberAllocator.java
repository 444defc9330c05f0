package com.detection.governance.service.workflow;

import com.detection.governance.store.ContentItemStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Hands out pull request numbers. Numbers only ever increase, so a newly opened pull request
 * never shares its number with one that is already open.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PullRequestNumberAllocator {

    private final ContentItemStore store;

    private int lastIssued = -1;

    public synchronized int next() {
        if (lastIssued < 0) {
            lastIssued = store.maxPullRequestNumber();
            log.debug("Seeded pull request numbering at {}", lastIssued);
        }
        return ++lastIssued;
    }
}
