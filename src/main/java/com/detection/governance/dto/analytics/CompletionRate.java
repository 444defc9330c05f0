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
public class CompletionRate {

    @JsonProperty("deployed_packages")
    private int deployedPackages;

    @JsonProperty("total_packages")
    private int totalPackages;

    @JsonProperty("completion_percentage")
    private long completionPercentage;
}
