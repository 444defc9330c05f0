package com.detection.governance.config;

import com.detection.governance.service.analytics.AnalyticsSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine-wide beans: the clock every timestamp is taken from and the analytics tunables
 * read from application.yml.
 */
@Configuration
@Slf4j
public class GovernanceConfig {

    @Value("${governance.analytics.bottleneck-threshold:0.30}")
    private double bottleneckThreshold;

    @Value("${governance.analytics.high-severity-threshold:0.50}")
    private double highSeverityThreshold;

    @Value("${governance.analytics.recent-transitions-limit:10}")
    private int recentTransitionsLimit;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public AnalyticsSettings analyticsSettings() {
        if (bottleneckThreshold <= 0 || bottleneckThreshold >= 1 || highSeverityThreshold < bottleneckThreshold) {
            throw new IllegalStateException(String.format(
                    "Invalid analytics thresholds: bottleneck=%s, high=%s", bottleneckThreshold, highSeverityThreshold));
        }
        log.info("[Governance Config] Bottleneck threshold {}, high severity above {}, last {} transitions",
                bottleneckThreshold, highSeverityThreshold, recentTransitionsLimit);
        return AnalyticsSettings.builder()
                .bottleneckThreshold(bottleneckThreshold)
                .highSeverityThreshold(highSeverityThreshold)
                .recentTransitionsLimit(recentTransitionsLimit)
                .build();
    }
}
