package com.detection.governance.dto.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A non-terminal phase holding more than the configured share of all items.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseBottleneck {
    private String phase;
    private int count;
    private double share;       // 0.0 - 1.0, two decimals
    private String severity;    // "high" or "medium"
}
