package com.detection.governance.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One immutable change-log record. Entries are only ever appended to an item's log.
 */
@Value
@Builder
@Jacksonized
public class ChangeLogEntry {
    int version;
    String author;
    LocalDateTime timestamp;
    String message;
    List<String> changes;
    TransitionRecord transition;    // null unless the entry moved phase or merged

    public boolean hasTransition() {
        return transition != null;
    }
}
