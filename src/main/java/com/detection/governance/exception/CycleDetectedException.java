package com.detection.governance.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a dependency edge would close a cycle. {@link #getCycle()} lists the
 * item ids along the cycle, first and last element being the same.
 */
@Getter
public class CycleDetectedException extends GovernanceException {

    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super("Dependency would create a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }
}
