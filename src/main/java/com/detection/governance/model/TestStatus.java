package com.detection.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Test progress of an item, driven by phase advancement into testing and deployed.
 */
public enum TestStatus {
    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),
    VALIDATED("validated");

    private final String value;

    TestStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TestStatus fromValue(String value) {
        for (TestStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown TestStatus: " + value);
    }
}
