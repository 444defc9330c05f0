package com.detection.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ContentStatus {
    DRAFT("draft"),
    VALIDATED("validated"),
    PUBLISHED("published"),
    DEPRECATED("deprecated");

    private final String value;

    ContentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ContentStatus fromValue(String value) {
        for (ContentStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ContentStatus: " + value);
    }
}
