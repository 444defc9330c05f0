package com.detection.governance.dto.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityMetrics {

    @JsonProperty("total_tests")
    private int totalTests;

    @JsonProperty("passed_tests")
    private int passedTests;

    @JsonProperty("failed_tests")
    private int failedTests;

    @JsonProperty("success_rate")
    private long successRate;

    @JsonProperty("packages_with_tests")
    private int packagesWithTests;
}
