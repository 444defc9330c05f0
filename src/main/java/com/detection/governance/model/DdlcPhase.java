package com.detection.governance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Detection Development Life Cycle phases, in their fixed order.
 * Declaration order is the progression order; {@link #next()} never skips a phase.
 */
public enum DdlcPhase {

    REQUIREMENT("requirement", "Requirement Gathering",
            "Define detection requirements based on threat intelligence", "2-4 hours"),
    DESIGN("design", "Detection Design",
            "Design detection logic and response workflows", "4-6 hours"),
    DEVELOPMENT("development", "Development",
            "Implement detection rules, playbooks, and interfaces", "6-8 hours"),
    TESTING("testing", "Testing & Validation",
            "Validate detection accuracy and performance", "4-8 hours"),
    DEPLOYED("deployed", "Production Deployment",
            "Deploy to the production environment", "2-4 hours"),
    MONITORING("monitoring", "Monitoring & Tuning",
            "Monitor performance and optimize detection", "Ongoing");

    private final String value;
    private final String displayName;
    private final String description;
    private final String estimatedDuration;

    DdlcPhase(String value, String displayName, String description, String estimatedDuration) {
        this.value = value;
        this.displayName = displayName;
        this.description = description;
        this.estimatedDuration = estimatedDuration;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public String getEstimatedDuration() {
        return estimatedDuration;
    }

    /**
     * The phase that follows this one, or this phase itself when it is terminal.
     */
    public DdlcPhase next() {
        DdlcPhase[] phases = values();
        return phases[Math.min(ordinal() + 1, phases.length - 1)];
    }

    public boolean isTerminal() {
        return this == MONITORING;
    }

    @JsonCreator
    public static DdlcPhase fromValue(String value) {
        for (DdlcPhase phase : values()) {
            if (phase.value.equalsIgnoreCase(value) || phase.name().equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown DDLC phase: " + value);
    }
}
