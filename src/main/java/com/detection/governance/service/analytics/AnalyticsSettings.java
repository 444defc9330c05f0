package com.detection.governance.service.analytics;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables for bottleneck detection and the transition feed.
 */
@Value
@Builder
public class AnalyticsSettings {

    // Share of all items above which a non-terminal phase is a bottleneck
    @Builder.Default
    double bottleneckThreshold = 0.30;

    // Share above which a bottleneck is reported as high instead of medium
    @Builder.Default
    double highSeverityThreshold = 0.50;

    @Builder.Default
    int recentTransitionsLimit = 10;
}
