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
public class PhaseTime {

    @JsonProperty("average_hours")
    private double averageHours;

    @JsonProperty("sample_count")
    private int sampleCount;
}
