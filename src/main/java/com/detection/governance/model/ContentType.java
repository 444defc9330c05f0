package com.detection.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of generated detection artifact.
 */
public enum ContentType {
    CORRELATION("correlation"),
    PLAYBOOK("playbook"),
    ALERT_LAYOUT("alert_layout"),
    DASHBOARD("dashboard");

    private final String value;

    ContentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ContentType fromValue(String value) {
        for (ContentType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ContentType: " + value);
    }
}
