package com.detection.governance.service.workflow;

import com.detection.governance.exception.DuplicateItemIdException;
import com.detection.governance.model.ContentType;
import com.detection.governance.store.ContentItemStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Mints item ids and commit tokens. Ids are derived from their source where there is one and
 * suffixed with a counter when the natural id is already taken.
 * <p>
 * The existence check only picks a likely-free id. Different sources can derive the same id,
 * so the create itself must be an insert; {@link #writeWithFreshId} mints again when it loses.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContentIdGenerator {

    private static final int MAX_MINT_ATTEMPTS = 5;

    private final ContentItemStore store;
    private final Clock clock;

    public String newItemId(ContentType contentType) {
        return unique(contentType.getValue() + "_" + shortToken(8));
    }

    /**
     * Format: {sourceId}_{branchName}_{epochMillis}
     */
    public String branchId(String sourceId, String branchName) {
        return unique(sourceId + "_" + branchName + "_" + clock.millis());
    }

    /**
     * Format: {sourceId}_fork_{epochMillis}
     */
    public String forkId(String sourceId) {
        return unique(sourceId + "_fork_" + clock.millis());
    }

    /**
     * Run {@code write} with an id from {@code minter}, minting again each time the write fails
     * because another writer stored that id first.
     */
    public <T> T writeWithFreshId(Supplier<String> minter, Function<String, T> write) {
        for (int attempt = 1; ; attempt++) {
            String id = minter.get();
            try {
                return write.apply(id);
            } catch (DuplicateItemIdException e) {
                if (attempt >= MAX_MINT_ATTEMPTS) {
                    throw e;
                }
                log.debug("Minted id {} was taken concurrently, minting again (attempt {})", id, attempt);
            }
        }
    }

    public String newCommitToken() {
        return shortToken(12);
    }

    private String unique(String candidate) {
        String id = candidate;
        int suffix = 2;
        while (store.exists(id)) {
            id = candidate + "_" + suffix++;
        }
        return id;
    }

    private static String shortToken(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }
}
