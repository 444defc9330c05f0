package com.detection.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MergeStatus {
    UNMERGED("unmerged"),
    MERGED("merged"),
    CONFLICT("conflict");

    private final String value;

    MergeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MergeStatus fromValue(String value) {
        for (MergeStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown MergeStatus: " + value);
    }
}
