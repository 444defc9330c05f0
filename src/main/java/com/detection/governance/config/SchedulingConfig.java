package com.detection.governance.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "governance.integrity.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
    // Periodic graph integrity audits run from the scheduler package
}
