package com.detection.governance.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A cycle found in the content dependency graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyCycle {
    private String description;
    private List<String> cycle;     // e.g., ["A", "B", "C", "A"]
}
