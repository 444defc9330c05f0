package com.detection.governance.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Explicit from/to record attached to a change-log entry that moved an item
 * between DDLC phases (PHASE) or promoted it onto main (MERGE, from/to are branch names).
 */
@Value
@Builder
@Jacksonized
public class TransitionRecord {
    TransitionKind kind;
    String from;
    String to;
    String notes;
}
