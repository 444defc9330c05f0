package com.detection.governance.dto.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Item counts broken down by the main descriptive attributes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentStatistics {
    private int total;
    private Map<String, Integer> byContentType;
    private Map<String, Integer> byStatus;
    private Map<String, Integer> byCategory;
    private Map<String, Integer> bySeverity;
    private Map<String, Integer> byPhase;
}
