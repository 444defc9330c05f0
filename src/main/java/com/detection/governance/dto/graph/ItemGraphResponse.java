package com.detection.governance.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemGraphResponse {
    private String itemId;
    private Set<String> dependencies;
    private Set<String> dependents;
    private Set<String> forks;
    private String originalId;
}
