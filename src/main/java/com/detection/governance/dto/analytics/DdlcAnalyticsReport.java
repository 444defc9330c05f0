package com.detection.governance.dto.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle analytics over every tracked content item, shaped for the DDLC dashboard.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DdlcAnalyticsReport {

    @JsonProperty("total_packages")
    private int totalPackages;

    // Every phase present, in lifecycle order, zero when empty
    @JsonProperty("phase_distribution")
    private Map<String, Integer> phaseDistribution;

    @JsonProperty("completion_rate")
    private CompletionRate completionRate;

    @JsonProperty("phase_bottlenecks")
    private List<PhaseBottleneck> phaseBottlenecks;

    @JsonProperty("quality_metrics")
    private QualityMetrics qualityMetrics;

    @JsonProperty("recent_transitions")
    private List<RecentTransition> recentTransitions;

    // Only phases that at least one item has left
    @JsonProperty("average_phase_time")
    private Map<String, PhaseTime> averagePhaseTime;

    @JsonProperty("generated_at")
    private LocalDateTime generatedAt;
}
