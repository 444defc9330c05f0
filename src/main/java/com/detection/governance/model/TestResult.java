package com.detection.governance.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of a single validation test run against an item (e.g. query syntax, field mapping).
 */
@Value
@Builder
@Jacksonized
public class TestResult {
    @NotBlank(message = "Test type is required")
    String testType;
    @NotNull(message = "Test outcome is required")
    TestOutcome outcome;
    String details;
}
